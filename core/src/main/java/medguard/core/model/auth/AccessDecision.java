package medguard.core.model.auth;

import java.util.Optional;

import medguard.core.model.permission.Permission;

/**
 * Result of evaluating an access request.
 */
public sealed interface AccessDecision {

    String actorId();

    String permission();

    DecisionReason reason();

    /**
     * The pattern that decided the outcome: the grant that allowed it or the
     * restriction that denied it. Empty when no pattern was involved.
     */
    Optional<Permission> matchedPattern();

    default boolean isAllowed() {
        return this instanceof Allowed;
    }

    /**
     * The request is permitted.
     */
    record Allowed(String actorId, String permission, DecisionReason reason, Optional<Permission> matchedPattern)
            implements AccessDecision {

        public Allowed {
            if (!reason.isAllowing()) {
                throw new IllegalArgumentException("Reason " + reason + " cannot allow access");
            }
            if (matchedPattern == null) {
                matchedPattern = Optional.empty();
            }
        }
    }

    /**
     * The request is refused.
     */
    record Denied(String actorId, String permission, DecisionReason reason, Optional<Permission> matchedPattern)
            implements AccessDecision {

        public Denied {
            if (reason.isAllowing()) {
                throw new IllegalArgumentException("Reason " + reason + " cannot deny access");
            }
            if (matchedPattern == null) {
                matchedPattern = Optional.empty();
            }
        }
    }

    static AccessDecision allow(String actorId, String permission, DecisionReason reason, Permission matched) {
        return new Allowed(actorId, permission, reason, Optional.ofNullable(matched));
    }

    static AccessDecision deny(String actorId, String permission, DecisionReason reason, Permission matched) {
        return new Denied(actorId, permission, reason, Optional.ofNullable(matched));
    }

    static AccessDecision deny(String actorId, String permission, DecisionReason reason) {
        return new Denied(actorId, permission, reason, Optional.empty());
    }
}
