package medguard.core.model.incident;

/**
 * Incident status, derived from whether resolution fields are set.
 */
public enum IncidentStatus {
    OPEN,
    RESOLVED
}
