package medguard.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import medguard.core.model.auth.Role;
import medguard.core.port.out.RoleRepository;

/**
 * In-memory implementation of RoleRepository.
 *
 * <p>Data is NOT persisted across restarts. This implementation is suitable for:
 * <ul>
 *   <li>Development and testing</li>
 *   <li>Single-instance deployments where persistence is handled externally</li>
 * </ul>
 *
 * <p>Thread-safety: Uses ConcurrentHashMap for safe concurrent access.
 */
public class InMemoryRoleRepository implements RoleRepository {

    private final ConcurrentHashMap<String, Role> storage = new ConcurrentHashMap<>();

    @Override
    public boolean insert(Role role) {
        return storage.putIfAbsent(role.id(), role) == null;
    }

    @Override
    public void save(Role role) {
        storage.put(role.id(), role);
    }

    @Override
    public Optional<Role> findById(String roleId) {
        return Optional.ofNullable(storage.get(roleId));
    }

    @Override
    public List<Role> findAll() {
        return new ArrayList<>(storage.values());
    }

    @Override
    public boolean exists(String roleId) {
        return storage.containsKey(roleId);
    }

    @Override
    public boolean delete(String roleId) {
        return storage.remove(roleId) != null;
    }
}
