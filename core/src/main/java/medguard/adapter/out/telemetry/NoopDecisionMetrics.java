package medguard.adapter.out.telemetry;

import medguard.core.model.audit.AuditEventKind;
import medguard.core.model.auth.AccessDecision;
import medguard.core.model.incident.SecurityIncident;
import medguard.core.model.threat.SecurityThreat;
import medguard.core.port.out.DecisionMetrics;

/**
 * Metrics that record nothing, used when no meter registry is available.
 */
public final class NoopDecisionMetrics implements DecisionMetrics {

    public static final NoopDecisionMetrics INSTANCE = new NoopDecisionMetrics();

    private NoopDecisionMetrics() {}

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public void recordDecision(AccessDecision decision) {}

    @Override
    public void recordThreat(SecurityThreat threat) {}

    @Override
    public void recordIncident(SecurityIncident incident) {}

    @Override
    public void recordAuditFailure(AuditEventKind kind) {}
}
