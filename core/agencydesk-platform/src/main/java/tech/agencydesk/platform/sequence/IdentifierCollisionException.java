package tech.agencydesk.platform.sequence;

/**
 * Thrown when a freshly issued identifier is still taken after one retry.
 * Indicates a corrupted or lagging counter and needs operator attention.
 */
public class IdentifierCollisionException extends RuntimeException {

    private final String tenantId;
    private final String category;
    private final String identifier;

    public IdentifierCollisionException(String tenantId, String category, String identifier) {
        super(String.format("Identifier %s already exists for tenant %s, category %s after retry",
            identifier, tenantId, category));
        this.tenantId = tenantId;
        this.category = category;
        this.identifier = identifier;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getCategory() {
        return category;
    }

    public String getIdentifier() {
        return identifier;
    }
}
