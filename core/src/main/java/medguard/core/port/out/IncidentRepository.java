package medguard.core.port.out;

import java.util.List;
import java.util.Optional;

import medguard.core.model.incident.SecurityIncident;

/**
 * Port interface for incident storage.
 */
public interface IncidentRepository {

    void save(SecurityIncident incident);

    Optional<SecurityIncident> findById(String incidentId);

    List<SecurityIncident> findAll();

    List<SecurityIncident> findByThreatId(String threatId);
}
