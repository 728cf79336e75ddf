package tech.agencydesk.platform.authorization;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ForbiddenException;
import org.jboss.logging.Logger;
import tech.agencydesk.platform.config.PlatformConfig;
import tech.agencydesk.platform.principal.Identity;
import tech.agencydesk.platform.principal.Role;
import tech.agencydesk.platform.tenant.TenantConfigRepository;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Derives a caller's effective permissions on every request.
 *
 * Three independent, side-effect-free checks:
 * <ul>
 *   <li>role gate: exact membership in a caller-supplied role set</li>
 *   <li>finance gate: owner and admin always, members only with an explicit grant</li>
 *   <li>vertical resolution: which business verticals the user may see</li>
 * </ul>
 *
 * IMPORTANT: tenant isolation is not checked here. It is enforced by the
 * scoped store that every data access goes through.
 */
@ApplicationScoped
public class AuthorizationService {

    private static final Logger LOG = Logger.getLogger(AuthorizationService.class);

    private static final Set<Role> FINANCE_ROLES = EnumSet.of(Role.OWNER, Role.ADMIN);

    @Inject
    TenantConfigRepository tenantConfigRepo;

    @Inject
    PlatformConfig config;

    /**
     * Require that the identity holds one of the allowed roles.
     * There is no implied hierarchy: admin does not satisfy a member-only gate
     * unless admin is listed too.
     *
     * @param identity the authenticated caller
     * @param allowed every acceptable role
     * @return the identity, unchanged
     * @throws ForbiddenException if the role is not in the allowed set
     */
    public Identity requireRole(Identity identity, Role... allowed) {
        Set<Role> allowedRoles = allowed.length == 0 ? EnumSet.noneOf(Role.class) : EnumSet.copyOf(Arrays.asList(allowed));
        if (!allowedRoles.contains(identity.role())) {
            LOG.warnf("Access denied for user %s with role %s: requires one of %s",
                identity.userId(), identity.role().value(), allowedRoles);
            throw new ForbiddenException("Insufficient permissions");
        }
        return identity;
    }

    /**
     * Check finance module access.
     *
     * @param identity the authenticated caller
     * @return true for owners and admins, or members with an explicit grant
     */
    public boolean hasFinanceAccess(Identity identity) {
        return FINANCE_ROLES.contains(identity.role()) || identity.financeAccess();
    }

    /**
     * Require finance module access.
     *
     * @param identity the authenticated caller
     * @return the identity, unchanged
     * @throws ForbiddenException if finance access is not granted
     */
    public Identity requireFinanceAccess(Identity identity) {
        if (!hasFinanceAccess(identity)) {
            LOG.warnf("Finance access denied for user %s with role %s",
                identity.userId(), identity.role().value());
            throw new ForbiddenException("Access denied: finance data is restricted");
        }
        return identity;
    }

    /**
     * Resolve the verticals visible to the caller.
     *
     * Owners see every configured vertical. Other users see their allow-list
     * intersected with the configured verticals. An empty allow-list means no
     * restriction has been configured yet, so it resolves to every vertical.
     * Never fails: a tenant without configuration falls back to the default verticals.
     *
     * @param identity the authenticated caller
     * @return vertical ids in configured order
     */
    public List<String> resolveVerticals(Identity identity) {
        List<String> configured = configuredVerticals(identity.tenantId());

        if (identity.role() == Role.OWNER || identity.allowedVerticals().isEmpty()) {
            return configured;
        }

        Set<String> allowed = new HashSet<>(identity.allowedVerticals());
        List<String> visible = configured.stream()
            .filter(allowed::contains)
            .toList();

        LOG.debugf("User %s restricted to verticals %s", identity.userId(), visible);
        return visible;
    }

    /**
     * Check whether the caller may see a single vertical.
     */
    public boolean canAccessVertical(Identity identity, String verticalId) {
        return verticalId != null && resolveVerticals(identity).contains(verticalId);
    }

    private List<String> configuredVerticals(String tenantId) {
        return tenantConfigRepo.findVerticalIds(tenantId)
            .orElseGet(() -> List.copyOf(config.tenantConfig().defaultVerticals()));
    }
}
