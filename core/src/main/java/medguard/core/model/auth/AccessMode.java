package medguard.core.model.auth;

/**
 * How the caller wants an access check evaluated.
 */
public enum AccessMode {
    /** Normal evaluation: restrictions, then role and grants. */
    STANDARD,

    /**
     * Explicit request to use the actor's emergency override. Only honored when the
     * actor's record has the override flag set, and always audited.
     */
    EMERGENCY_OVERRIDE
}
