package medguard.core.model.threat;

/**
 * Threat lifecycle states.
 *
 * <pre>
 * DETECTED ──► BLOCKED ──► MITIGATED ──► RESOLVED
 *     └───────────────────────┘
 * </pre>
 *
 * <p>{@code DETECTED} is initial and {@code RESOLVED} is terminal. A threat can only
 * be resolved from {@code MITIGATED}.
 */
public enum ThreatStatus {
    DETECTED,
    BLOCKED,
    MITIGATED,
    RESOLVED;

    /**
     * Check whether moving from this status to {@code target} is a legal transition.
     *
     * @param target the requested status
     * @return true if the transition is allowed
     */
    public boolean canTransitionTo(ThreatStatus target) {
        return switch (this) {
            case DETECTED -> target == BLOCKED || target == MITIGATED;
            case BLOCKED -> target == MITIGATED;
            case MITIGATED -> target == RESOLVED;
            case RESOLVED -> false;
        };
    }

    public boolean isTerminal() {
        return this == RESOLVED;
    }
}
