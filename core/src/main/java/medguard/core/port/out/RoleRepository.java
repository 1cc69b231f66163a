package medguard.core.port.out;

import java.util.List;
import java.util.Optional;

import medguard.core.model.auth.Role;

/**
 * Port interface for role storage.
 *
 * <p>Operations are synchronous and must not block on I/O: the core evaluates
 * requests in memory. Durable persistence, if any, happens behind this port
 * outside the request path.
 */
public interface RoleRepository {

    /**
     * Store a role only if no role with the same id exists.
     *
     * @param role the role to insert
     * @return true if inserted, false if the id was taken
     */
    boolean insert(Role role);

    /**
     * Save or replace a role.
     *
     * @param role the role to persist
     */
    void save(Role role);

    Optional<Role> findById(String roleId);

    List<Role> findAll();

    boolean exists(String roleId);

    /**
     * Delete a role.
     *
     * @param roleId the role identifier
     * @return true if deleted, false if not found
     */
    boolean delete(String roleId);
}
