package tech.agencydesk.platform.scope;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.agencydesk.platform.config.PlatformConfig;

/**
 * Entry point for tenant-scoped data access.
 *
 * Wraps the shared MongoClient (owned and closed by the Quarkus MongoDB extension)
 * and hands out per-tenant database views. Request handlers should obtain all
 * collections through {@link #forTenant(String)} instead of the raw client.
 */
@ApplicationScoped
public class ScopedStoreFactory {

    private static final Logger LOG = Logger.getLogger(ScopedStoreFactory.class);

    private final MongoDatabase database;
    private final ScopeFieldMapping fieldMapping;

    @Inject
    public ScopedStoreFactory(MongoClient mongoClient, PlatformConfig config) {
        this(mongoClient.getDatabase(config.database()), ScopeFieldMapping.from(config.scope()));
        LOG.infof("Tenant scoping enabled on database %s (default field %s, legacy field %s)",
            config.database(), fieldMapping.defaultField(), fieldMapping.legacyField());
    }

    public ScopedStoreFactory(MongoDatabase database, ScopeFieldMapping fieldMapping) {
        this.database = database;
        this.fieldMapping = fieldMapping;
    }

    /**
     * Create a database view restricted to one tenant.
     *
     * @param tenantId the tenant (agency) id
     * @return scoped database view
     * @throws IllegalArgumentException if the tenant id is null or blank
     */
    public ScopedDatabase forTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("Tenant id cannot be null or empty");
        }
        return new ScopedDatabase(database, fieldMapping, tenantId);
    }

    public ScopeFieldMapping fieldMapping() {
        return fieldMapping;
    }
}
