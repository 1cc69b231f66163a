package medguard.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import medguard.core.model.auth.AccessControl;
import medguard.core.port.out.AccessControlRepository;

/**
 * In-memory implementation of AccessControlRepository.
 *
 * <p>Data is NOT persisted across restarts. Role membership is answered by a scan,
 * so member counts always reflect the stored records.
 */
public class InMemoryAccessControlRepository implements AccessControlRepository {

    private final ConcurrentHashMap<String, AccessControl> storage = new ConcurrentHashMap<>();

    @Override
    public void save(AccessControl accessControl) {
        storage.put(accessControl.actorId(), accessControl);
    }

    @Override
    public Optional<AccessControl> findByActorId(String actorId) {
        return Optional.ofNullable(storage.get(actorId));
    }

    @Override
    public List<AccessControl> findAll() {
        return new ArrayList<>(storage.values());
    }

    @Override
    public List<AccessControl> findByRoleId(String roleId) {
        return storage.values().stream()
                .filter(record -> record.roleId().equals(roleId))
                .toList();
    }

    @Override
    public long countByRoleId(String roleId) {
        return storage.values().stream()
                .filter(record -> record.roleId().equals(roleId))
                .count();
    }

    @Override
    public boolean delete(String actorId) {
        return storage.remove(actorId) != null;
    }
}
