package medguard.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import medguard.core.model.threat.SecurityThreat;
import medguard.core.port.out.ThreatRepository;

/**
 * In-memory implementation of ThreatRepository.
 *
 * <p>Data is NOT persisted across restarts. Threats are never removed.
 */
public class InMemoryThreatRepository implements ThreatRepository {

    private final ConcurrentHashMap<String, SecurityThreat> storage = new ConcurrentHashMap<>();

    @Override
    public void save(SecurityThreat threat) {
        storage.put(threat.id(), threat);
    }

    @Override
    public Optional<SecurityThreat> findById(String threatId) {
        return Optional.ofNullable(storage.get(threatId));
    }

    @Override
    public List<SecurityThreat> findAll() {
        return new ArrayList<>(storage.values());
    }
}
