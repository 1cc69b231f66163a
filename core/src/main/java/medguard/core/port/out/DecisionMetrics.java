package medguard.core.port.out;

import medguard.core.model.audit.AuditEventKind;
import medguard.core.model.auth.AccessDecision;
import medguard.core.model.incident.SecurityIncident;
import medguard.core.model.threat.SecurityThreat;

/**
 * Port interface for recording operational metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface DecisionMetrics {

    boolean isEnabled();

    void recordDecision(AccessDecision decision);

    void recordThreat(SecurityThreat threat);

    void recordIncident(SecurityIncident incident);

    void recordAuditFailure(AuditEventKind kind);
}
