package medguard.core.port.out;

import java.util.List;
import java.util.Optional;

import medguard.core.model.auth.AccessControl;

/**
 * Port interface for per-actor access records, keyed by actor id.
 */
public interface AccessControlRepository {

    void save(AccessControl accessControl);

    Optional<AccessControl> findByActorId(String actorId);

    List<AccessControl> findAll();

    /**
     * List the actors assigned a role.
     *
     * @param roleId the role identifier
     * @return records assigned the role
     */
    List<AccessControl> findByRoleId(String roleId);

    /**
     * Count the actors assigned a role, from live data.
     *
     * @param roleId the role identifier
     * @return member count
     */
    long countByRoleId(String roleId);

    boolean delete(String actorId);
}
