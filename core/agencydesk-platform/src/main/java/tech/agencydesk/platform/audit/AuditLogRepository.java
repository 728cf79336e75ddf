package tech.agencydesk.platform.audit;

import java.util.List;

/**
 * Repository interface for audit entries.
 * Append-only: there are no update or delete operations.
 */
public interface AuditLogRepository {

    /**
     * Insert all entries of one mutation in a single batch.
     * Any store failure is propagated; the caller treats the mutation as failed.
     */
    void insertAll(String tenantId, List<AuditEntry> entries);

    /**
     * Entries for one entity, newest first.
     */
    List<AuditEntry> findByEntity(String tenantId, String entityId, int limit);

    /**
     * Latest entries across all entities of a tenant, newest first.
     */
    List<AuditEntry> findRecent(String tenantId, int limit);
}
