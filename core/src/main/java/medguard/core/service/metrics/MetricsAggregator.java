package medguard.core.service.metrics;

import java.time.Duration;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import medguard.core.model.incident.SecurityIncident;
import medguard.core.model.metrics.ComplianceScores;
import medguard.core.model.metrics.SecurityMetrics;
import medguard.core.model.threat.SecurityThreat;
import medguard.core.model.threat.ThreatStatus;
import medguard.core.port.out.ComplianceScoreSource;
import medguard.core.port.out.IncidentRepository;
import medguard.core.port.out.ThreatRepository;

/**
 * Recomputes security metrics from the current threats, incidents and external scores.
 *
 * <p>Nothing is cached between calls.
 * <ul>
 *   <li>{@code openVulnerabilities}: threats not yet resolved</li>
 *   <li>{@code accessControlEffectiveness}: share of detected threats that were
 *       contained (blocked or mitigated at some point), 100 when there are none</li>
 *   <li>{@code emergencyResponseTime}: mean incident response time, zero when there are none</li>
 * </ul>
 */
@ApplicationScoped
public class MetricsAggregator {

    private final ThreatRepository threats;
    private final IncidentRepository incidents;
    private final ComplianceScoreSource scores;

    @Inject
    public MetricsAggregator(ThreatRepository threats, IncidentRepository incidents, ComplianceScoreSource scores) {
        this.threats = threats;
        this.incidents = incidents;
        this.scores = scores;
    }

    public SecurityMetrics snapshot() {
        final var allThreats = threats.findAll();
        final var allIncidents = incidents.findAll();

        final long detected = allThreats.size();
        final var blocked = allThreats.stream().filter(SecurityThreat::wasBlocked).count();
        final var contained = allThreats.stream().filter(MetricsAggregator::wasContained).count();
        final var open = allThreats.stream().filter(SecurityThreat::isActive).count();
        final var resolvedIncidents =
                allIncidents.stream().filter(SecurityIncident::isResolved).count();

        final var external = currentScores();
        return new SecurityMetrics(
                detected,
                blocked,
                resolvedIncidents,
                open,
                external.compliance(),
                external.audit(),
                external.dataProtection(),
                detected == 0 ? 100.0 : contained * 100.0 / detected,
                external.trainingCompletion(),
                meanResponseTime(allIncidents));
    }

    private ComplianceScores currentScores() {
        final var current = scores == null ? null : scores.currentScores();
        return current == null ? ComplianceScores.none() : current;
    }

    private static boolean wasContained(SecurityThreat threat) {
        for (var change : threat.history()) {
            if (change.status() != ThreatStatus.DETECTED) {
                return true;
            }
        }
        return false;
    }

    private static Duration meanResponseTime(List<SecurityIncident> incidents) {
        if (incidents.isEmpty()) {
            return Duration.ZERO;
        }
        var total = Duration.ZERO;
        for (var incident : incidents) {
            total = total.plus(incident.responseTime());
        }
        return total.dividedBy(incidents.size());
    }
}
