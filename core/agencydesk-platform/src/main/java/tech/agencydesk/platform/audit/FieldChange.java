package tech.agencydesk.platform.audit;

/**
 * Old and new value of a single field in a mutation.
 */
public record FieldChange(Object oldValue, Object newValue) {

    public static FieldChange of(Object oldValue, Object newValue) {
        return new FieldChange(oldValue, newValue);
    }
}
