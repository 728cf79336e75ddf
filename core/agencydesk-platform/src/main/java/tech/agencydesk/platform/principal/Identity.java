package tech.agencydesk.platform.principal;

import java.util.List;
import java.util.Objects;

/**
 * Authenticated caller, rebuilt on every request from a verified token.
 * Never persisted by the tenancy core.
 */
public record Identity(
    /**
     * The user's id.
     */
    String userId,

    /**
     * The agency the user belongs to.
     */
    String tenantId,

    Role role,

    /**
     * Verticals the user is restricted to. Empty means no restriction configured.
     */
    List<String> allowedVerticals,

    /**
     * Explicit finance module grant for non-elevated roles.
     */
    boolean financeAccess
) {
    public Identity {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(role, "role");
        allowedVerticals = allowedVerticals == null ? List.of() : List.copyOf(allowedVerticals);
    }

    /**
     * Identity without vertical restrictions or finance grant.
     */
    public static Identity of(String userId, String tenantId, Role role) {
        return new Identity(userId, tenantId, role, List.of(), false);
    }

    public Identity withAllowedVerticals(List<String> verticals) {
        return new Identity(userId, tenantId, role, verticals, financeAccess);
    }

    public Identity withFinanceAccess(boolean granted) {
        return new Identity(userId, tenantId, role, allowedVerticals, granted);
    }
}
