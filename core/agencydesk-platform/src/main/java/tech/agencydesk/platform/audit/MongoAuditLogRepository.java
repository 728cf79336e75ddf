package tech.agencydesk.platform.audit;

import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import org.bson.Document;
import org.bson.conversions.Bson;
import tech.agencydesk.platform.config.PlatformConfig;
import tech.agencydesk.platform.scope.ScopedCollection;
import tech.agencydesk.platform.scope.ScopedStoreFactory;
import tech.agencydesk.platform.shared.Instrumented;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Objects;

/**
 * MongoDB implementation of AuditLogRepository.
 *
 * All access goes through the tenant scope. Entries written before the scope
 * field existed are not returned; they are not backfilled.
 * Package-private to prevent direct injection - use AuditLogRepository interface.
 */
@ApplicationScoped
@Typed(AuditLogRepository.class)
@Instrumented(collection = "task_history")
class MongoAuditLogRepository implements AuditLogRepository {

    private static final Bson NEWEST_FIRST = Sorts.descending("timestamp", "_id");

    @Inject
    ScopedStoreFactory storeFactory;

    @Inject
    PlatformConfig config;

    @Override
    public void insertAll(String tenantId, List<AuditEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        List<Document> documents = entries.stream()
            .map(this::toDocument)
            .toList();
        // insertMany stamps the scope field, so the list must be mutable
        collection(tenantId).insertMany(new ArrayList<>(documents));
    }

    @Override
    public List<AuditEntry> findByEntity(String tenantId, String entityId, int limit) {
        ScopedCollection history = collection(tenantId);
        return history.find(Filters.eq("entityId", entityId))
            .sort(NEWEST_FIRST)
            .limit(limit)
            .map(doc -> toEntry(doc, history.scopeField()));
    }

    @Override
    public List<AuditEntry> findRecent(String tenantId, int limit) {
        ScopedCollection history = collection(tenantId);
        return history.find()
            .sort(NEWEST_FIRST)
            .limit(limit)
            .map(doc -> toEntry(doc, history.scopeField()));
    }

    private ScopedCollection collection(String tenantId) {
        return storeFactory.forTenant(tenantId).collection(config.audit().collection());
    }

    private Document toDocument(AuditEntry entry) {
        return new Document("_id", entry.id())
            .append("entityId", entry.entityId())
            .append("actorId", entry.actorId())
            .append("field", entry.field())
            .append("oldValue", entry.oldValue())
            .append("newValue", entry.newValue())
            .append("comment", entry.comment())
            .append("timestamp", Date.from(entry.timestamp()));
    }

    /**
     * Entries written by older clients may carry an ObjectId, non-string values
     * or a timestamp that is not a date. They are read leniently rather than rejected.
     */
    private AuditEntry toEntry(Document doc, String scopeField) {
        return new AuditEntry(
            text(doc.get("_id")),
            text(doc.get("entityId")),
            text(doc.get("actorId")),
            text(doc.get("field")),
            text(doc.get("oldValue")),
            text(doc.get("newValue")),
            text(doc.get("comment")),
            text(doc.get(scopeField)),
            toInstant(doc.get("timestamp"))
        );
    }

    private static String text(Object value) {
        return Objects.toString(value, null);
    }

    private static Instant toInstant(Object value) {
        return value instanceof Date date ? date.toInstant() : null;
    }
}
