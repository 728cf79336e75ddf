package tech.agencydesk.platform.scope;

import com.mongodb.client.MongoDatabase;

import java.util.Objects;

/**
 * Database view bound to one tenant. Every collection it hands out is a
 * {@link ScopedCollection} using the field chosen by the {@link ScopeFieldMapping}.
 */
public class ScopedDatabase {

    private final MongoDatabase database;
    private final ScopeFieldMapping fieldMapping;
    private final String tenantId;

    ScopedDatabase(MongoDatabase database, ScopeFieldMapping fieldMapping, String tenantId) {
        this.database = database;
        this.fieldMapping = fieldMapping;
        this.tenantId = tenantId;
    }

    /**
     * Get a tenant-scoped handle to a named collection.
     *
     * @param name the collection name
     * @return scoped handle; callers never need to know the scope field name
     */
    public ScopedCollection collection(String name) {
        Objects.requireNonNull(name, "name");
        return new ScopedCollection(database.getCollection(name), fieldMapping.fieldFor(name), tenantId);
    }

    public String tenantId() {
        return tenantId;
    }
}
