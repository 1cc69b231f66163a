package medguard.adapter.out.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import medguard.core.model.audit.AuditEventKind;
import medguard.core.model.auth.AccessDecision;
import medguard.core.model.incident.SecurityIncident;
import medguard.core.model.threat.SecurityThreat;
import medguard.core.port.out.DecisionMetrics;

/**
 * Records decisions, threats, incidents and audit failures as Micrometer counters.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code medguard.access.decisions} - Access decisions by outcome and reason</li>
 *   <li>{@code medguard.threats.detected} - Detected threats by type, severity and status</li>
 *   <li>{@code medguard.incidents.opened} - Opened incidents by impact and reporting flag</li>
 *   <li>{@code medguard.audit.failures} - Unacknowledged audit events by kind</li>
 * </ul>
 */
public class MicrometerDecisionMetrics implements DecisionMetrics {

    private final MeterRegistry registry;

    public MicrometerDecisionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public boolean isEnabled() {
        return registry != null;
    }

    @Override
    public void recordDecision(AccessDecision decision) {
        if (registry == null) {
            return;
        }
        Counter.builder("medguard.access.decisions")
                .description("Access decisions")
                .tag("outcome", decision.isAllowed() ? "allowed" : "denied")
                .tag("reason", decision.reason().code())
                .register(registry)
                .increment();
    }

    @Override
    public void recordThreat(SecurityThreat threat) {
        if (registry == null) {
            return;
        }
        Counter.builder("medguard.threats.detected")
                .description("Detected security threats")
                .tag("type", threat.type().code())
                .tag("severity", threat.severity().name().toLowerCase())
                .tag("status", threat.status().name().toLowerCase())
                .register(registry)
                .increment();
    }

    @Override
    public void recordIncident(SecurityIncident incident) {
        if (registry == null) {
            return;
        }
        Counter.builder("medguard.incidents.opened")
                .description("Opened security incidents")
                .tag("impact", incident.impact().name().toLowerCase())
                .tag("reporting_required", String.valueOf(incident.reportingRequired()))
                .register(registry)
                .increment();
    }

    @Override
    public void recordAuditFailure(AuditEventKind kind) {
        if (registry == null) {
            return;
        }
        Counter.builder("medguard.audit.failures")
                .description("Audit events that were not acknowledged")
                .tag("kind", kind.code())
                .register(registry)
                .increment();
    }
}
