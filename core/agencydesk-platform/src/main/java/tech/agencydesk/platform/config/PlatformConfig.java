package tech.agencydesk.platform.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.List;

/**
 * Configuration for the tenancy core.
 */
@ConfigMapping(prefix = "agencydesk")
public interface PlatformConfig {

    /**
     * MongoDB database shared by all tenants.
     */
    @WithDefault("agencydesk")
    String database();

    Scope scope();

    Sequence sequence();

    Audit audit();

    TenantConfig tenantConfig();

    Indexes indexes();

    interface Scope {

        /**
         * Attribute carrying the tenant id in most collections.
         */
        @WithDefault("agency_id")
        String defaultField();

        /**
         * Attribute carrying the tenant id in the legacy collections.
         */
        @WithDefault("studio_id")
        String legacyField();

        /**
         * Collections that predate the default field name.
         */
        @WithDefault("tasks,task_history")
        List<String> legacyCollections();
    }

    interface Sequence {

        @WithDefault("sequence_counters")
        String collection();

        /**
         * Minimum number of digits in an issued identifier.
         */
        @WithDefault("4")
        int padding();
    }

    interface Audit {

        @WithDefault("task_history")
        String collection();

        /**
         * Maximum number of entries returned by a history lookup.
         */
        @WithDefault("100")
        int historyLimit();

        /**
         * Status value whose transition requires a comment.
         */
        @WithDefault("blocked")
        String blockedStatus();
    }

    interface TenantConfig {

        @WithDefault("agency_configs")
        String collection();

        /**
         * Verticals used when a tenant has no configuration yet.
         */
        @WithDefault("knots,pluto,festia,thryv")
        List<String> defaultVerticals();
    }

    interface Indexes {

        /**
         * Create indexes for the collections owned by this core on startup.
         */
        @WithDefault("true")
        boolean enabled();
    }
}
