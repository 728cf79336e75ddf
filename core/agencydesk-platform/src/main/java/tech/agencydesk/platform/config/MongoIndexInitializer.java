package tech.agencydesk.platform.config;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.jboss.logging.Logger;
import tech.agencydesk.platform.scope.ScopeFieldMapping;

/**
 * Creates indexes for the collections owned by the tenancy core on startup.
 * Index creation is idempotent. Failures are logged and do not stop startup.
 */
@ApplicationScoped
public class MongoIndexInitializer {

    private static final Logger LOG = Logger.getLogger(MongoIndexInitializer.class);

    @Inject
    MongoClient mongoClient;

    @Inject
    PlatformConfig config;

    void onStart(@Observes StartupEvent ev) {
        if (!config.indexes().enabled()) {
            LOG.debug("Index initialization disabled");
            return;
        }

        LOG.info("Initializing MongoDB indexes...");
        createIndexes(mongoClient.getDatabase(config.database()));
        LOG.info("MongoDB indexes initialized");
    }

    void createIndexes(MongoDatabase db) {
        ScopeFieldMapping mapping = ScopeFieldMapping.from(config.scope());

        String countersName = config.sequence().collection();
        MongoCollection<Document> counters = db.getCollection(countersName);
        createIndex(counters, "tenant", Indexes.ascending(mapping.fieldFor(countersName)), opt());

        String historyName = config.audit().collection();
        MongoCollection<Document> history = db.getCollection(historyName);
        String historyScope = mapping.fieldFor(historyName);
        createIndex(history, "tenant_entity_timestamp",
            Indexes.compoundIndex(
                Indexes.ascending(historyScope),
                Indexes.ascending("entityId"),
                Indexes.descending("timestamp")),
            opt());
        createIndex(history, "tenant_timestamp",
            Indexes.compoundIndex(
                Indexes.ascending(historyScope),
                Indexes.descending("timestamp")),
            opt());

        String configsName = config.tenantConfig().collection();
        MongoCollection<Document> configs = db.getCollection(configsName);
        createIndex(configs, "tenant", Indexes.ascending(mapping.fieldFor(configsName)), opt().unique(true));
    }

    private void createIndex(MongoCollection<Document> collection, String name, Bson keys, IndexOptions options) {
        try {
            collection.createIndex(keys, options.name(name));
            LOG.debugf("Ensured index %s on %s", name, collection.getNamespace().getCollectionName());
        } catch (Exception e) {
            // Index may already exist with different options
            LOG.warnf("Could not create index %s on %s: %s",
                name, collection.getNamespace().getCollectionName(), e.getMessage());
        }
    }

    private IndexOptions opt() {
        return new IndexOptions().background(true);
    }
}
