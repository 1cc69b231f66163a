package medguard.core.port.in;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import medguard.core.model.auth.Role;
import medguard.core.model.auth.RoleSummary;
import medguard.core.model.permission.Permission;

/**
 * Port for managing roles.
 *
 * <p>Every permission pattern is validated on the way in; a role with a malformed
 * pattern is never stored.
 */
public interface RoleManagement {

    /**
     * Register a new role.
     *
     * @param id          unique identifier
     * @param description human-readable description
     * @param permissions permission patterns
     * @return the registered role
     * @throws medguard.core.exception.ValidationException if the id is taken or a pattern is malformed
     */
    Role register(String id, String description, Set<String> permissions);

    /**
     * Get a role by id.
     *
     * @throws medguard.core.exception.NotFoundException if the role does not exist
     */
    Role get(String id);

    Optional<Role> find(String id);

    List<Role> list();

    /**
     * Replace a role's permissions.
     *
     * @throws medguard.core.exception.NotFoundException if the role does not exist
     * @throws medguard.core.exception.ValidationException if a pattern is malformed
     */
    Role updatePermissions(String id, Set<String> permissions);

    /**
     * Update a role incrementally.
     *
     * @param id                the role to update
     * @param description       new description, null to keep
     * @param addPermissions    patterns to add, null to skip
     * @param removePermissions patterns to remove, null to skip
     * @return the updated role
     */
    Role update(String id, String description, Set<String> addPermissions, Set<String> removePermissions);

    /**
     * Delete a role that has no members.
     *
     * @return true if deleted, false if it did not exist
     * @throws medguard.core.exception.ValidationException if actors are still assigned the role
     */
    boolean delete(String id);

    /**
     * The role's permission patterns.
     *
     * @throws medguard.core.exception.NotFoundException if the role does not exist
     */
    Set<Permission> effectivePermissions(String id);

    /**
     * The role with counts computed from live data.
     *
     * @throws medguard.core.exception.NotFoundException if the role does not exist
     */
    RoleSummary summary(String id);

    List<RoleSummary> summaries();
}
