package tech.agencydesk.platform.sequence;

/**
 * Checks whether a record already uses an identifier, e.g. a project imported
 * without going through the generator.
 */
@FunctionalInterface
public interface IdentifierProbe {

    boolean exists(String identifier);
}
