package tech.agencydesk.platform.sequence;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.agencydesk.platform.config.PlatformConfig;

import java.time.Clock;
import java.time.Year;
import java.util.Locale;

/**
 * Issues human-readable identifiers such as {@code KN-2026-0001}.
 *
 * Each {@code (tenant, category, year)} has its own counter. Uniqueness under
 * concurrent callers relies entirely on the atomic increment in
 * {@link SequenceCounterRepository}; nothing here holds a lock.
 */
@ApplicationScoped
public class SequenceGenerator {

    private static final Logger LOG = Logger.getLogger(SequenceGenerator.class);

    @Inject
    SequenceCounterRepository counterRepo;

    @Inject
    PlatformConfig config;

    Clock clock = Clock.systemUTC();

    /**
     * Issue the next identifier for a category in the current year.
     *
     * @param tenantId the tenant id
     * @param category the sequence category, used upper-cased as prefix
     * @return identifier in the form {@code CATEGORY-YEAR-0001}
     */
    public String next(String tenantId, String category) {
        requireTenant(tenantId);
        String normalized = normalizeCategory(category);
        String period = currentPeriod();

        long seq = counterRepo.incrementAndGet(tenantId, normalized, period);
        String identifier = format(normalized, period, seq);

        LOG.debugf("Issued %s for tenant %s", identifier, tenantId);
        return identifier;
    }

    /**
     * Issue an identifier that the caller's store does not already use.
     *
     * If the first identifier is taken, one more is issued. If that is taken
     * too the counter cannot be trusted and the call fails instead of looping.
     *
     * @param tenantId the tenant id
     * @param category the sequence category
     * @param probe checks whether a record already uses an identifier
     * @return an identifier the probe reported as free
     * @throws IdentifierCollisionException if the retry also collides
     */
    public String nextUnique(String tenantId, String category, IdentifierProbe probe) {
        String identifier = next(tenantId, category);
        if (!probe.exists(identifier)) {
            return identifier;
        }

        LOG.warnf("Identifier %s already exists for tenant %s, issuing another", identifier, tenantId);
        String retried = next(tenantId, category);
        if (!probe.exists(retried)) {
            return retried;
        }

        LOG.errorf("Identifier collision persisted after retry: %s (tenant %s). Sequence counter may be corrupted",
            retried, tenantId);
        throw new IdentifierCollisionException(tenantId, normalizeCategory(category), retried);
    }

    String format(String category, String period, long seq) {
        int padding = Math.max(1, config.sequence().padding());
        return String.format("%s-%s-%0" + padding + "d", category, period, seq);
    }

    private String currentPeriod() {
        return String.valueOf(Year.now(clock).getValue());
    }

    private static void requireTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("Tenant id cannot be null or empty");
        }
    }

    private static String normalizeCategory(String category) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Sequence category cannot be null or empty");
        }
        if (category.contains("|")) {
            throw new IllegalArgumentException("Sequence category cannot contain '|': " + category);
        }
        return category.trim().toUpperCase(Locale.ROOT);
    }
}
