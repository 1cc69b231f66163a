package medguard.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import medguard.core.model.audit.AuditEventKind;
import medguard.core.model.auth.AccessDecision;
import medguard.core.model.auth.DecisionReason;
import medguard.core.model.incident.ImpactLevel;
import medguard.core.model.incident.IncidentRequest;
import medguard.core.model.incident.SecurityIncident;

@DisplayName("MicrometerDecisionMetrics")
class MicrometerDecisionMetricsTest {

    private SimpleMeterRegistry registry;
    private MicrometerDecisionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerDecisionMetrics(registry);
    }

    @Test
    @DisplayName("should tag decisions by outcome and reason")
    void shouldCountDecisions() {
        metrics.recordDecision(AccessDecision.deny("dr-lee", "user:manage", DecisionReason.NO_MATCHING_PERMISSION));
        metrics.recordDecision(AccessDecision.deny("dr-lee", "user:manage", DecisionReason.NO_MATCHING_PERMISSION));
        metrics.recordDecision(AccessDecision.allow("dr-ortiz", "x:y", DecisionReason.EMERGENCY_OVERRIDE, null));

        assertEquals(
                2.0,
                registry.get("medguard.access.decisions")
                        .tag("outcome", "denied")
                        .tag("reason", "no_matching_permission")
                        .counter()
                        .count());
        assertEquals(
                1.0,
                registry.get("medguard.access.decisions")
                        .tag("outcome", "allowed")
                        .counter()
                        .count());
    }

    @Test
    @DisplayName("should tag incidents by impact and reporting")
    void shouldCountIncidents() {
        final var at = Instant.parse("2026-03-01T08:00:00Z");
        final var incident = SecurityIncident.open(
                "inc-1",
                "thr-1",
                at,
                new IncidentRequest(ImpactLevel.SEVERE, Set.of(), 12, false, false, List.of()),
                at);

        metrics.recordIncident(incident);

        assertEquals(
                1.0,
                registry.get("medguard.incidents.opened")
                        .tag("impact", "severe")
                        .tag("reporting_required", "true")
                        .counter()
                        .count());
    }

    @Test
    @DisplayName("should count audit failures by event kind")
    void shouldCountAuditFailures() {
        metrics.recordAuditFailure(AuditEventKind.THREAT_DETECTED);

        assertEquals(
                1.0,
                registry.get("medguard.audit.failures")
                        .tag("kind", "threat.detected")
                        .counter()
                        .count());
    }

    @Test
    @DisplayName("should be a no-op without a registry")
    void shouldIgnoreMissingRegistry() {
        final var disabled = new MicrometerDecisionMetrics(null);

        assertFalse(disabled.isEnabled());
        assertTrue(metrics.isEnabled());
        disabled.recordAuditFailure(AuditEventKind.ACCESS_DENIED);
    }
}
