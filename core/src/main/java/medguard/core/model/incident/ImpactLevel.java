package medguard.core.model.incident;

/**
 * Ordinal incident impact. Declaration order is the impact order.
 */
public enum ImpactLevel {
    MINIMAL,
    MODERATE,
    SIGNIFICANT,
    SEVERE;

    public boolean isAtLeast(ImpactLevel threshold) {
        return compareTo(threshold) >= 0;
    }
}
