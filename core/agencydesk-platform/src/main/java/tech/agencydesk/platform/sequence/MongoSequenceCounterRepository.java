package tech.agencydesk.platform.sequence;

import com.mongodb.MongoException;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.Updates;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.jboss.logging.Logger;
import tech.agencydesk.platform.config.PlatformConfig;
import tech.agencydesk.platform.scope.ScopedCollection;
import tech.agencydesk.platform.scope.ScopedStoreFactory;
import tech.agencydesk.platform.shared.Instrumented;
import tech.agencydesk.platform.shared.MongoErrors;

import java.util.Date;

/**
 * MongoDB implementation of SequenceCounterRepository.
 *
 * Uses a single findOneAndUpdate with $inc and upsert, so the read-modify-write
 * happens in one round trip on the server. There is no read-then-write path.
 * Package-private to prevent direct injection - use SequenceCounterRepository interface.
 */
@ApplicationScoped
@Typed(SequenceCounterRepository.class)
@Instrumented(collection = "sequence_counters")
class MongoSequenceCounterRepository implements SequenceCounterRepository {

    private static final Logger LOG = Logger.getLogger(MongoSequenceCounterRepository.class);

    @Inject
    ScopedStoreFactory storeFactory;

    @Inject
    PlatformConfig config;

    @Override
    public long incrementAndGet(String tenantId, String category, String period) {
        ScopedCollection counters = storeFactory.forTenant(tenantId)
            .collection(config.sequence().collection());

        String key = counterKey(tenantId, category, period);
        Bson filter = Filters.eq("_id", key);
        Date now = new Date();
        Bson update = Updates.combine(
            Updates.inc("seq", 1),
            Updates.set("updatedAt", now),
            Updates.setOnInsert("category", category),
            Updates.setOnInsert("period", period),
            Updates.setOnInsert("createdAt", now)
        );
        FindOneAndUpdateOptions options = new FindOneAndUpdateOptions()
            .upsert(true)
            .returnDocument(ReturnDocument.AFTER);

        Document counter;
        try {
            counter = counters.findOneAndUpdate(filter, update, options);
        } catch (MongoException e) {
            if (!MongoErrors.isDuplicateKey(e)) {
                throw e;
            }
            // Two first-time upserts raced on the same key; the counter exists now
            LOG.debugf("Concurrent creation of counter %s, repeating increment", key);
            counter = counters.findOneAndUpdate(filter, update, options);
        }

        return counter.get("seq", Number.class).longValue();
    }

    static String counterKey(String tenantId, String category, String period) {
        return tenantId + "|" + category + "|" + period;
    }
}
