package tech.agencydesk.platform.audit;

import java.time.Instant;

/**
 * One field-level change to an entity. Written once, never updated or deleted.
 */
public record AuditEntry(
    /**
     * Unique entry id (TSID).
     */
    String id,

    /**
     * The changed entity, e.g. a task id.
     */
    String entityId,

    /**
     * The user who made the change.
     */
    String actorId,

    String field,

    String oldValue,

    String newValue,

    /**
     * Optional comment. Always present on a transition to the blocked status.
     */
    String comment,

    String tenantId,

    /**
     * Shared by every entry written for the same mutation.
     */
    Instant timestamp
) {
}
