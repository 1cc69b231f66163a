package medguard.core.service.auth;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import medguard.core.exception.NotFoundException;
import medguard.core.exception.ValidationException;
import medguard.core.model.auth.AccessControl;
import medguard.core.model.auth.AccessDecision;
import medguard.core.model.auth.AccessMode;
import medguard.core.model.auth.DecisionReason;
import medguard.core.model.auth.Role;
import medguard.core.model.permission.Permission;
import medguard.core.port.in.AccessControlManagement;
import medguard.core.port.out.AccessControlRepository;
import medguard.core.port.out.RoleRepository;
import medguard.core.service.common.KeyedLocks;

/**
 * Access control store: owns per-actor access records and evaluates requests.
 *
 * <p>Evaluation order:
 * <ol>
 *   <li>Look up the actor's record; absence is a {@link NotFoundException}.</li>
 *   <li>An explicit emergency override by an actor holding the override flag allows.</li>
 *   <li>A restriction overlapping the request denies, whatever the role or grants say.</li>
 *   <li>A matching role permission or explicit grant allows.</li>
 *   <li>Anything else denies.</li>
 * </ol>
 *
 * <p>Evaluation reads immutable snapshots and never locks. Writes to one actor's
 * record are serialized; writes to different actors proceed in parallel.
 */
@ApplicationScoped
public class AccessControlService implements AccessControlManagement {

    private static final Logger LOG = Logger.getLogger(AccessControlService.class);

    private final AccessControlRepository repository;
    private final RoleRepository roles;
    private final PermissionMatcher matcher;
    private final Clock clock;
    private final KeyedLocks locks = new KeyedLocks("actor");

    @Inject
    public AccessControlService(AccessControlRepository repository, RoleRepository roles, PermissionMatcher matcher) {
        this(repository, roles, matcher, Clock.systemUTC());
    }

    public AccessControlService(
            AccessControlRepository repository, RoleRepository roles, PermissionMatcher matcher, Clock clock) {
        this.repository = repository;
        this.roles = roles;
        this.matcher = matcher;
        this.clock = clock;
    }

    @Override
    public AccessControl assign(AccessControl accessControl) {
        if (accessControl == null) {
            throw new ValidationException("Access control record is required");
        }
        requireRole(accessControl.roleId());
        return locks.withLock(accessControl.actorId(), () -> {
            final var stored = accessControl.toBuilder().updatedAt(clock.instant()).build();
            repository.save(stored);
            LOG.infof(
                    "Assigned role %s to actor %s (level %d, override %s)",
                    stored.roleId(), stored.actorId(), stored.accessLevel(), stored.emergencyOverride());
            return stored;
        });
    }

    @Override
    public AccessControl get(String actorId) {
        return find(actorId).orElseThrow(() -> new NotFoundException("Actor", actorId));
    }

    @Override
    public Optional<AccessControl> find(String actorId) {
        if (actorId == null) {
            return Optional.empty();
        }
        return repository.findByActorId(actorId);
    }

    @Override
    public List<AccessControl> list() {
        return repository.findAll().stream()
                .sorted(Comparator.comparing(AccessControl::actorId))
                .toList();
    }

    @Override
    public List<AccessControl> listByRole(String roleId) {
        return repository.findByRoleId(roleId).stream()
                .sorted(Comparator.comparing(AccessControl::actorId))
                .toList();
    }

    @Override
    public AccessControl changeRole(String actorId, String roleId) {
        requireRole(roleId);
        return update(actorId, current -> current.withRole(roleId, clock.instant()));
    }

    @Override
    public AccessControl grant(String actorId, String permission) {
        final var parsed = Permission.parse(permission);
        return update(actorId, current -> current.withGrant(parsed, clock.instant()));
    }

    @Override
    public AccessControl revokeGrant(String actorId, String permission) {
        final var parsed = Permission.parse(permission);
        return update(actorId, current -> current.withoutGrant(parsed, clock.instant()));
    }

    @Override
    public AccessControl restrict(String actorId, String permission) {
        final var parsed = Permission.parse(permission);
        return update(actorId, current -> current.withRestriction(parsed, clock.instant()));
    }

    @Override
    public AccessControl liftRestriction(String actorId, String permission) {
        final var parsed = Permission.parse(permission);
        return update(actorId, current -> current.withoutRestriction(parsed, clock.instant()));
    }

    @Override
    public boolean remove(String actorId) {
        return locks.withLock(actorId, () -> {
            final var removed = repository.delete(actorId);
            if (removed) {
                LOG.infof("Removed access record for actor %s", actorId);
            }
            return removed;
        });
    }

    @Override
    public AccessDecision authorize(String actorId, Permission requested, AccessMode mode) {
        if (requested == null) {
            throw new ValidationException("Requested permission is required");
        }
        final var record = get(actorId);
        final var permission = requested.value();

        if (mode == AccessMode.EMERGENCY_OVERRIDE && record.emergencyOverride()) {
            LOG.warnf("Emergency override invoked by actor %s for %s", actorId, permission);
            return AccessDecision.allow(actorId, permission, DecisionReason.EMERGENCY_OVERRIDE, null);
        }

        final var restriction = matcher.firstOverlap(record.restrictions(), requested);
        if (restriction.isPresent()) {
            LOG.debugf("Actor %s denied %s by restriction %s", actorId, permission, restriction.get());
            return AccessDecision.deny(actorId, permission, DecisionReason.RESTRICTED, restriction.get());
        }

        final var rolePermission = matcher.firstMatch(rolePermissions(record.roleId()), requested);
        if (rolePermission.isPresent()) {
            LOG.debugf("Actor %s allowed %s by role %s", actorId, permission, record.roleId());
            return AccessDecision.allow(actorId, permission, DecisionReason.ROLE_PERMISSION, rolePermission.get());
        }

        final var grant = matcher.firstMatch(record.grants(), requested);
        if (grant.isPresent()) {
            LOG.debugf("Actor %s allowed %s by explicit grant %s", actorId, permission, grant.get());
            return AccessDecision.allow(actorId, permission, DecisionReason.EXPLICIT_GRANT, grant.get());
        }

        LOG.debugf("Actor %s denied %s: no matching permission", actorId, permission);
        return AccessDecision.deny(actorId, permission, DecisionReason.NO_MATCHING_PERMISSION);
    }

    private AccessControl update(String actorId, UnaryOperator<AccessControl> change) {
        return locks.withLock(actorId, () -> {
            final var updated = change.apply(get(actorId));
            repository.save(updated);
            LOG.debugf("Updated access record for actor %s", actorId);
            return updated;
        });
    }

    private void requireRole(String roleId) {
        if (roleId == null || !roles.exists(roleId)) {
            throw new NotFoundException("Role", roleId);
        }
    }

    // A role deleted after assignment contributes nothing.
    private Set<Permission> rolePermissions(String roleId) {
        return roles.findById(roleId).map(Role::permissions).orElse(Set.of());
    }
}
