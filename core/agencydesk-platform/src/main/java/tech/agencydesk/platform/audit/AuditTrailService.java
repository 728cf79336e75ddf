package tech.agencydesk.platform.audit;

import com.mongodb.MongoException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.agencydesk.platform.config.PlatformConfig;
import tech.agencydesk.platform.shared.TsidGenerator;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Append-only, field-level history of task mutations.
 *
 * One entry per changed field, all entries of a mutation share one timestamp
 * and are written in one batch. A failed write is rethrown: the caller must
 * treat its own mutation as failed, because an unaudited change is a compliance gap.
 */
@ApplicationScoped
public class AuditTrailService {

    private static final Logger LOG = Logger.getLogger(AuditTrailService.class);

    static final String STATUS_FIELD = "status";

    @Inject
    AuditLogRepository auditLogRepo;

    @Inject
    PlatformConfig config;

    /**
     * Record the changes of one mutation.
     *
     * The comment, if any, is kept on every entry of the mutation. Requiring a
     * comment for a transition of {@code status} to the blocked value is the
     * caller's job; a block without one is recorded and logged.
     *
     * @param entityId the changed entity
     * @param actorId the user who made the change
     * @param tenantId the tenant owning the entity
     * @param changes field name to old/new value, in the order to record
     * @param comment optional comment, may be null
     * @return the entries written, empty if there were no changes
     * @throws MongoException if the batch could not be written
     */
    public List<AuditEntry> record(String entityId, String actorId, String tenantId,
                                   Map<String, FieldChange> changes, String comment) {
        requireText(entityId, "Entity id");
        requireText(actorId, "Actor id");
        if (changes == null || changes.isEmpty()) {
            return List.of();
        }

        Instant timestamp = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        if (isBlockTransition(changes) && (comment == null || comment.isBlank())) {
            LOG.warnf("Entity %s blocked by %s without a comment (tenant %s)", entityId, actorId, tenantId);
        }

        List<AuditEntry> entries = new ArrayList<>(changes.size());
        for (Map.Entry<String, FieldChange> change : changes.entrySet()) {
            entries.add(new AuditEntry(
                TsidGenerator.generate(),
                entityId,
                actorId,
                change.getKey(),
                stringify(change.getValue().oldValue()),
                stringify(change.getValue().newValue()),
                comment,
                tenantId,
                timestamp
            ));
        }

        try {
            auditLogRepo.insertAll(tenantId, entries);
        } catch (MongoException e) {
            LOG.errorf(e, "Failed to write %d audit entries for entity %s (tenant %s)",
                entries.size(), entityId, tenantId);
            throw e;
        }

        LOG.debugf("Recorded %d audit entries for entity %s by %s", entries.size(), entityId, actorId);
        return entries;
    }

    /**
     * Record the changes of one mutation without a comment.
     */
    public List<AuditEntry> record(String entityId, String actorId, String tenantId,
                                   Map<String, FieldChange> changes) {
        return record(entityId, actorId, tenantId, changes, null);
    }

    /**
     * History of one entity within a tenant, newest first.
     */
    public List<AuditEntry> history(String tenantId, String entityId) {
        requireText(entityId, "Entity id");
        return auditLogRepo.findByEntity(tenantId, entityId, config.audit().historyLimit());
    }

    /**
     * Latest changes across every entity of a tenant, newest first.
     *
     * @param limit maximum number of entries, must be positive
     */
    public List<AuditEntry> recentActivity(String tenantId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }
        return auditLogRepo.findRecent(tenantId, limit);
    }

    private boolean isBlockTransition(Map<String, FieldChange> changes) {
        FieldChange status = changes.get(STATUS_FIELD);
        return status != null
            && status.newValue() != null
            && config.audit().blockedStatus().equals(status.newValue().toString());
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or empty");
        }
    }

    private static String stringify(Object value) {
        return value != null ? value.toString() : null;
    }
}
