package medguard.core.model.auth;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import medguard.core.exception.ValidationException;
import medguard.core.model.permission.Permission;

/**
 * A named bundle of permission patterns.
 *
 * <p>Permissions keep their insertion order for display; matching does not depend
 * on it. Member and permission counts are not stored here, see {@link RoleSummary}.
 *
 * @param id          unique identifier (e.g., "attending-radiologist")
 * @param description human-readable description
 * @param permissions ordered set of permission patterns
 * @param createdAt   when the role was registered
 * @param updatedAt   when the role was last modified
 */
public record Role(
        String id, String description, Set<Permission> permissions, Instant createdAt, Instant updatedAt) {

    public Role {
        if (id == null || id.isBlank()) {
            throw new ValidationException("Role ID cannot be null or blank");
        }
        if (description == null) {
            description = "";
        }
        if (permissions == null) {
            permissions = Set.of();
        } else {
            permissions = Collections.unmodifiableSet(new LinkedHashSet<>(permissions));
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * Create a role from raw pattern strings, validating each one.
     *
     * @param id          unique identifier
     * @param description human-readable description
     * @param patterns    permission pattern strings
     * @param now         creation timestamp
     * @return the new role
     * @throws ValidationException if any pattern is malformed
     */
    public static Role of(String id, String description, Collection<String> patterns, Instant now) {
        return new Role(id, description, parseAll(patterns), now, now);
    }

    /**
     * Copy this role with a replaced permission set.
     *
     * @param newPermissions the new permissions
     * @param now            modification timestamp
     * @return the updated role
     */
    public Role withPermissions(Set<Permission> newPermissions, Instant now) {
        return new Role(id, description, newPermissions, createdAt, now);
    }

    /**
     * Copy this role with a new description.
     *
     * @param newDescription the new description
     * @param now            modification timestamp
     * @return the updated role
     */
    public Role withDescription(String newDescription, Instant now) {
        return new Role(id, newDescription, permissions, createdAt, now);
    }

    /**
     * Parse a collection of pattern strings, keeping their order and dropping duplicates.
     *
     * @param patterns pattern strings, may be null
     * @return ordered set of parsed permissions
     * @throws ValidationException if any pattern is malformed
     */
    public static Set<Permission> parseAll(Collection<String> patterns) {
        final var parsed = new LinkedHashSet<Permission>();
        if (patterns != null) {
            for (var pattern : patterns) {
                parsed.add(Permission.parse(pattern));
            }
        }
        return parsed;
    }
}
