package tech.agencydesk.platform.sequence;

/**
 * Storage for per-tenant sequence counters.
 * Counters are created on first use, only ever incremented, and never deleted.
 */
public interface SequenceCounterRepository {

    /**
     * Atomically increment the counter for {@code (tenant, category, period)},
     * creating it if absent, and return the incremented value.
     *
     * @param tenantId the tenant id
     * @param category the sequence category
     * @param period the time bucket, e.g. the year
     * @return the post-increment value, starting at 1
     */
    long incrementAndGet(String tenantId, String category, String period);
}
