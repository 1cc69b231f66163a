package medguard.core.model.threat;

/**
 * Ordinal threat severity. Declaration order is the severity order.
 */
public enum ThreatSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Compare against a threshold.
     *
     * @param threshold the minimum severity
     * @return true if this severity is the threshold or above
     */
    public boolean isAtLeast(ThreatSeverity threshold) {
        return compareTo(threshold) >= 0;
    }
}
