package tech.agencydesk.platform.scope;

import tech.agencydesk.platform.config.PlatformConfig;

import java.util.Objects;
import java.util.Set;

/**
 * Decides which attribute carries the tenant id for a given collection.
 *
 * Most collections use the default field. A fixed set of legacy collections
 * (tasks and their history) were created before the default name existed and
 * use the legacy field instead. Every collection name resolves to exactly one field.
 */
public final class ScopeFieldMapping {

    public static final String DEFAULT_FIELD = "agency_id";
    public static final String LEGACY_FIELD = "studio_id";
    public static final Set<String> LEGACY_COLLECTIONS = Set.of("tasks", "task_history");

    private final String defaultField;
    private final String legacyField;
    private final Set<String> legacyCollections;

    public ScopeFieldMapping(String defaultField, String legacyField, Set<String> legacyCollections) {
        this.defaultField = requireFieldName(defaultField);
        this.legacyField = requireFieldName(legacyField);
        this.legacyCollections = Set.copyOf(Objects.requireNonNull(legacyCollections, "legacyCollections"));
    }

    /**
     * The mapping used by production collections.
     */
    public static ScopeFieldMapping standard() {
        return new ScopeFieldMapping(DEFAULT_FIELD, LEGACY_FIELD, LEGACY_COLLECTIONS);
    }

    public static ScopeFieldMapping from(PlatformConfig.Scope config) {
        return new ScopeFieldMapping(
            config.defaultField(),
            config.legacyField(),
            Set.copyOf(config.legacyCollections())
        );
    }

    /**
     * Resolve the tenant attribute for a collection.
     *
     * @param collectionName the collection name
     * @return the attribute name holding the tenant id
     */
    public String fieldFor(String collectionName) {
        Objects.requireNonNull(collectionName, "collectionName");
        return legacyCollections.contains(collectionName) ? legacyField : defaultField;
    }

    public String defaultField() {
        return defaultField;
    }

    public String legacyField() {
        return legacyField;
    }

    private static String requireFieldName(String field) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Scope field name cannot be null or empty");
        }
        if (field.startsWith("$") || field.contains(".")) {
            throw new IllegalArgumentException("Scope field must be a top-level attribute: " + field);
        }
        return field;
    }
}
