package medguard.core.port.out;

import java.util.List;
import java.util.Optional;

import medguard.core.model.threat.SecurityThreat;

/**
 * Port interface for threat storage. Threats are never deleted.
 */
public interface ThreatRepository {

    /**
     * Store a new threat or replace an existing one with a later version.
     *
     * @param threat the threat to persist
     */
    void save(SecurityThreat threat);

    Optional<SecurityThreat> findById(String threatId);

    List<SecurityThreat> findAll();
}
