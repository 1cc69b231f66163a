package medguard.core.model.auth;

/**
 * Reason codes attached to every access decision.
 */
public enum DecisionReason {
    ROLE_PERMISSION("role_permission", true),
    EXPLICIT_GRANT("explicit_grant", true),
    EMERGENCY_OVERRIDE("emergency_override", true),
    RESTRICTED("restricted", false),
    NO_MATCHING_PERMISSION("no_matching_permission", false),
    ACTOR_NOT_FOUND("actor_not_found", false),
    ROLE_CLAIM_MISMATCH("role_claim_mismatch", false);

    private final String code;
    private final boolean allowing;

    DecisionReason(String code, boolean allowing) {
        this.code = code;
        this.allowing = allowing;
    }

    public String code() {
        return code;
    }

    /**
     * Whether decisions with this reason allow the request.
     *
     * @return true for allow reasons
     */
    public boolean isAllowing() {
        return allowing;
    }
}
