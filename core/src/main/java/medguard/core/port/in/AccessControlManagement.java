package medguard.core.port.in;

import java.util.List;
import java.util.Optional;

import medguard.core.model.auth.AccessControl;
import medguard.core.model.auth.AccessDecision;
import medguard.core.model.auth.AccessMode;
import medguard.core.model.permission.Permission;

/**
 * Port for managing per-actor access records and evaluating requests against them.
 */
public interface AccessControlManagement {

    /**
     * Create or replace an actor's access record.
     *
     * @throws medguard.core.exception.NotFoundException if the record's role does not exist
     */
    AccessControl assign(AccessControl accessControl);

    /**
     * @throws medguard.core.exception.NotFoundException if the actor has no record
     */
    AccessControl get(String actorId);

    Optional<AccessControl> find(String actorId);

    List<AccessControl> list();

    List<AccessControl> listByRole(String roleId);

    AccessControl changeRole(String actorId, String roleId);

    AccessControl grant(String actorId, String permission);

    AccessControl revokeGrant(String actorId, String permission);

    AccessControl restrict(String actorId, String permission);

    AccessControl liftRestriction(String actorId, String permission);

    boolean remove(String actorId);

    /**
     * Evaluate a request.
     *
     * @param actorId   the requesting actor
     * @param requested the requested capability
     * @param mode      standard evaluation or an explicit emergency override
     * @return the decision
     * @throws medguard.core.exception.NotFoundException if the actor has no record; callers must treat this as deny
     */
    AccessDecision authorize(String actorId, Permission requested, AccessMode mode);
}
