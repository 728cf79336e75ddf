package tech.agencydesk.platform.tenant;

import java.util.List;
import java.util.Optional;

/**
 * Read access to per-agency configuration.
 */
public interface TenantConfigRepository {

    /**
     * Ids of the verticals configured for a tenant, in configured order.
     *
     * @param tenantId the tenant id
     * @return the vertical ids, or empty if the tenant has no configuration
     *         document or the document has no verticals list
     */
    Optional<List<String>> findVerticalIds(String tenantId);
}
