package medguard.core.model.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import medguard.core.exception.ValidationException;
import medguard.core.model.permission.Permission;

/**
 * Per-actor access record.
 *
 * <p>Effective permissions are the role's permissions plus explicit grants, minus
 * anything matched by a restriction. Restrictions always win over grants and role
 * permissions of the same or broader scope.
 *
 * <p>Session timeout and MFA are stored for the external session layer; they are
 * not enforced here.
 *
 * @param actorId           the actor this record belongs to
 * @param roleId            assigned role
 * @param grants            additive permission patterns
 * @param restrictions      subtractive permission patterns, evaluated first
 * @param accessLevel       ordinal access level, 1 to 10
 * @param emergencyOverride whether the actor may invoke the emergency override
 * @param mfaRequired       whether the session layer must demand multi-factor confirmation
 * @param sessionTimeout    idle timeout the session layer should apply
 * @param auditRequired     whether every access by this actor must be audited
 * @param updatedAt         when the record last changed
 */
public record AccessControl(
        String actorId,
        String roleId,
        Set<Permission> grants,
        Set<Permission> restrictions,
        int accessLevel,
        boolean emergencyOverride,
        boolean mfaRequired,
        Duration sessionTimeout,
        boolean auditRequired,
        Instant updatedAt) {

    public static final int MIN_ACCESS_LEVEL = 1;
    public static final int MAX_ACCESS_LEVEL = 10;
    public static final Duration DEFAULT_SESSION_TIMEOUT = Duration.ofMinutes(30);

    public AccessControl {
        if (actorId == null || actorId.isBlank()) {
            throw new ValidationException("Actor ID cannot be null or blank");
        }
        if (roleId == null || roleId.isBlank()) {
            throw new ValidationException("Role ID cannot be null or blank for actor '" + actorId + "'");
        }
        if (accessLevel < MIN_ACCESS_LEVEL || accessLevel > MAX_ACCESS_LEVEL) {
            throw new ValidationException("Access level must be between " + MIN_ACCESS_LEVEL + " and "
                    + MAX_ACCESS_LEVEL + ", got " + accessLevel);
        }
        if (sessionTimeout == null) {
            sessionTimeout = DEFAULT_SESSION_TIMEOUT;
        } else if (sessionTimeout.isZero() || sessionTimeout.isNegative()) {
            throw new ValidationException("Session timeout must be positive for actor '" + actorId + "'");
        }
        grants = grants == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(grants));
        restrictions =
                restrictions == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(restrictions));
        if (updatedAt == null) {
            updatedAt = Instant.now();
        }
    }

    public AccessControl withRole(String newRoleId, Instant now) {
        return toBuilder().roleId(newRoleId).updatedAt(now).build();
    }

    public AccessControl withGrant(Permission grant, Instant now) {
        final var updated = new LinkedHashSet<>(grants);
        updated.add(grant);
        return toBuilder().grants(updated).updatedAt(now).build();
    }

    public AccessControl withoutGrant(Permission grant, Instant now) {
        final var updated = new LinkedHashSet<>(grants);
        updated.remove(grant);
        return toBuilder().grants(updated).updatedAt(now).build();
    }

    public AccessControl withRestriction(Permission restriction, Instant now) {
        final var updated = new LinkedHashSet<>(restrictions);
        updated.add(restriction);
        return toBuilder().restrictions(updated).updatedAt(now).build();
    }

    public AccessControl withoutRestriction(Permission restriction, Instant now) {
        final var updated = new LinkedHashSet<>(restrictions);
        updated.remove(restriction);
        return toBuilder().restrictions(updated).updatedAt(now).build();
    }

    public static Builder builder(String actorId, String roleId) {
        return new Builder(actorId, roleId);
    }

    public Builder toBuilder() {
        return new Builder(actorId, roleId)
                .grants(grants)
                .restrictions(restrictions)
                .accessLevel(accessLevel)
                .emergencyOverride(emergencyOverride)
                .mfaRequired(mfaRequired)
                .sessionTimeout(sessionTimeout)
                .auditRequired(auditRequired)
                .updatedAt(updatedAt);
    }

    public static class Builder {
        private final String actorId;
        private String roleId;
        private Set<Permission> grants = Set.of();
        private Set<Permission> restrictions = Set.of();
        private int accessLevel = MIN_ACCESS_LEVEL;
        private boolean emergencyOverride;
        private boolean mfaRequired;
        private Duration sessionTimeout = DEFAULT_SESSION_TIMEOUT;
        private boolean auditRequired = true;
        private Instant updatedAt;

        private Builder(String actorId, String roleId) {
            this.actorId = actorId;
            this.roleId = roleId;
        }

        public Builder roleId(String roleId) {
            this.roleId = roleId;
            return this;
        }

        public Builder grants(Set<Permission> grants) {
            this.grants = grants;
            return this;
        }

        /**
         * Set grants from pattern strings.
         *
         * @throws ValidationException if any pattern is malformed
         */
        public Builder grantPatterns(String... patterns) {
            this.grants = Role.parseAll(Arrays.asList(patterns));
            return this;
        }

        public Builder restrictions(Set<Permission> restrictions) {
            this.restrictions = restrictions;
            return this;
        }

        /**
         * Set restrictions from pattern strings.
         *
         * @throws ValidationException if any pattern is malformed
         */
        public Builder restrictionPatterns(String... patterns) {
            this.restrictions = Role.parseAll(Arrays.asList(patterns));
            return this;
        }

        public Builder accessLevel(int accessLevel) {
            this.accessLevel = accessLevel;
            return this;
        }

        public Builder emergencyOverride(boolean emergencyOverride) {
            this.emergencyOverride = emergencyOverride;
            return this;
        }

        public Builder mfaRequired(boolean mfaRequired) {
            this.mfaRequired = mfaRequired;
            return this;
        }

        public Builder sessionTimeout(Duration sessionTimeout) {
            this.sessionTimeout = sessionTimeout;
            return this;
        }

        public Builder auditRequired(boolean auditRequired) {
            this.auditRequired = auditRequired;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public AccessControl build() {
            return new AccessControl(
                    actorId,
                    roleId,
                    grants,
                    restrictions,
                    accessLevel,
                    emergencyOverride,
                    mfaRequired,
                    sessionTimeout,
                    auditRequired,
                    updatedAt);
        }
    }
}
