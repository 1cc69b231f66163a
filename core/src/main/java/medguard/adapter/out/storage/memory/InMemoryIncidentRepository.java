package medguard.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import medguard.core.model.incident.SecurityIncident;
import medguard.core.port.out.IncidentRepository;

/**
 * In-memory implementation of IncidentRepository.
 *
 * <p>Data is NOT persisted across restarts.
 */
public class InMemoryIncidentRepository implements IncidentRepository {

    private final ConcurrentHashMap<String, SecurityIncident> storage = new ConcurrentHashMap<>();

    @Override
    public void save(SecurityIncident incident) {
        storage.put(incident.id(), incident);
    }

    @Override
    public Optional<SecurityIncident> findById(String incidentId) {
        return Optional.ofNullable(storage.get(incidentId));
    }

    @Override
    public List<SecurityIncident> findAll() {
        return new ArrayList<>(storage.values());
    }

    @Override
    public List<SecurityIncident> findByThreatId(String threatId) {
        return storage.values().stream()
                .filter(incident -> incident.threatId().equals(threatId))
                .toList();
    }
}
