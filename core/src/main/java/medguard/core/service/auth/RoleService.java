package medguard.core.service.auth;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import medguard.core.exception.NotFoundException;
import medguard.core.exception.ValidationException;
import medguard.core.model.auth.Role;
import medguard.core.model.auth.RoleSummary;
import medguard.core.model.permission.Permission;
import medguard.core.port.in.RoleManagement;
import medguard.core.port.out.AccessControlRepository;
import medguard.core.port.out.RoleRepository;
import medguard.core.service.common.KeyedLocks;

/**
 * Role registry.
 *
 * <p>Validates every permission pattern before a role is stored and rejects
 * duplicate ids atomically. Member and permission counts are computed from the
 * live repositories on each read; nothing is cached, so displayed counts cannot
 * drift from the authoritative data.
 */
@ApplicationScoped
public class RoleService implements RoleManagement {

    private static final Logger LOG = Logger.getLogger(RoleService.class);

    private final RoleRepository repository;
    private final AccessControlRepository accessControls;
    private final Clock clock;
    private final KeyedLocks locks = new KeyedLocks("role");

    @Inject
    public RoleService(RoleRepository repository, AccessControlRepository accessControls) {
        this(repository, accessControls, Clock.systemUTC());
    }

    public RoleService(RoleRepository repository, AccessControlRepository accessControls, Clock clock) {
        this.repository = repository;
        this.accessControls = accessControls;
        this.clock = clock;
    }

    @Override
    public Role register(String id, String description, Set<String> permissions) {
        final var role = Role.of(id, description, permissions, clock.instant());
        if (!repository.insert(role)) {
            throw new ValidationException("Role with ID '" + id + "' already exists");
        }
        LOG.infof("Registered role %s with %d permission(s)", role.id(), role.permissions().size());
        return role;
    }

    @Override
    public Role get(String id) {
        return find(id).orElseThrow(() -> new NotFoundException("Role", id));
    }

    @Override
    public Optional<Role> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return repository.findById(id);
    }

    @Override
    public List<Role> list() {
        return repository.findAll().stream()
                .sorted(Comparator.comparing(Role::id))
                .toList();
    }

    @Override
    public Role updatePermissions(String id, Set<String> permissions) {
        final var parsed = Role.parseAll(permissions);
        return locks.withLock(id, () -> {
            final var updated = get(id).withPermissions(parsed, clock.instant());
            repository.save(updated);
            LOG.infof("Replaced permissions of role %s (%d pattern(s))", id, parsed.size());
            return updated;
        });
    }

    @Override
    public Role update(String id, String description, Set<String> addPermissions, Set<String> removePermissions) {
        final var toAdd = Role.parseAll(addPermissions);
        final var toRemove = Role.parseAll(removePermissions);
        return locks.withLock(id, () -> {
            final var current = get(id);
            final var now = clock.instant();

            final var permissions = new LinkedHashSet<>(current.permissions());
            permissions.addAll(toAdd);
            permissions.removeAll(toRemove);

            var updated = current.withPermissions(permissions, now);
            if (description != null) {
                updated = updated.withDescription(description, now);
            }
            repository.save(updated);
            LOG.debugf("Updated role %s: +%d -%d permission(s)", id, toAdd.size(), toRemove.size());
            return updated;
        });
    }

    @Override
    public boolean delete(String id) {
        return locks.withLock(id, () -> {
            final var members = accessControls.countByRoleId(id);
            if (members > 0) {
                throw new ValidationException(
                        "Role '" + id + "' still has " + members + " member(s) and cannot be deleted");
            }
            final var deleted = repository.delete(id);
            if (deleted) {
                LOG.infof("Deleted role %s", id);
            }
            return deleted;
        });
    }

    @Override
    public Set<Permission> effectivePermissions(String id) {
        return get(id).permissions();
    }

    @Override
    public RoleSummary summary(String id) {
        final var role = get(id);
        return RoleSummary.of(role, accessControls.countByRoleId(id));
    }

    @Override
    public List<RoleSummary> summaries() {
        return list().stream()
                .map(role -> RoleSummary.of(role, accessControls.countByRoleId(role.id())))
                .toList();
    }
}
