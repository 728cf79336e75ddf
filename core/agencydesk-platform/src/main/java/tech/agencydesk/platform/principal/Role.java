package tech.agencydesk.platform.principal;

import java.util.Locale;

/**
 * Role of a user within their agency.
 *
 * Business logic treats owner > admin > member, but authorization checks use
 * exact membership: callers list every role they accept.
 */
public enum Role {
    /**
     * Agency owner. Sees every vertical and all finance data.
     */
    OWNER("owner"),

    /**
     * Agency administrator.
     */
    ADMIN("admin"),

    /**
     * Regular team member.
     */
    MEMBER("member");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /**
     * The value stored in user documents and token claims.
     */
    public String value() {
        return value;
    }

    /**
     * Parse a stored role value.
     *
     * @throws IllegalArgumentException if the value is not a known role
     */
    public static Role fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Role cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.value.equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }
}
