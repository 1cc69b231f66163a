package medguard.core.service.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import medguard.adapter.out.storage.memory.InMemoryIncidentRepository;
import medguard.adapter.out.storage.memory.InMemoryThreatRepository;
import medguard.core.model.incident.ImpactLevel;
import medguard.core.model.incident.IncidentRequest;
import medguard.core.model.metrics.ComplianceScores;
import medguard.core.model.threat.ThreatReport;
import medguard.core.model.threat.ThreatSeverity;
import medguard.core.model.threat.ThreatType;
import medguard.core.port.out.ComplianceScoreSource;
import medguard.core.service.common.CommitGuard;
import medguard.core.service.common.IdentifierGenerator;
import medguard.core.service.incident.IncidentTracker;
import medguard.core.service.threat.ThreatEngine;
import medguard.core.service.threat.ThreatResponsePolicy;
import medguard.testing.MutableClock;

@DisplayName("MetricsAggregator")
class MetricsAggregatorTest {

    private MutableClock clock;
    private ThreatEngine threats;
    private IncidentTracker incidents;
    private ComplianceScoreSource scores;
    private MetricsAggregator aggregator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T08:00:00Z");
        final var ids = new IdentifierGenerator();
        final var threatRepository = new InMemoryThreatRepository();
        final var incidentRepository = new InMemoryIncidentRepository();
        threats = new ThreatEngine(threatRepository, new ThreatResponsePolicy(), ids, clock);
        incidents = new IncidentTracker(incidentRepository, threats, ids, clock);
        scores = mock(ComplianceScoreSource.class);
        when(scores.currentScores()).thenReturn(new ComplianceScores(92.5, 88, 95, 76));
        aggregator = new MetricsAggregator(threatRepository, incidentRepository, scores);
    }

    private String detect(ThreatSeverity severity) {
        final var report = ThreatReport.builder(ThreatType.MALWARE, severity)
                .source("host-1")
                .target("pacs")
                .build();
        return threats.detect(report, CommitGuard.none()).id();
    }

    @Test
    @DisplayName("should report neutral values with no history")
    void shouldReportNeutralValues() {
        final var metrics = aggregator.snapshot();

        assertEquals(0, metrics.threatsDetected());
        assertEquals(0, metrics.openVulnerabilities());
        assertEquals(100.0, metrics.accessControlEffectiveness());
        assertEquals(Duration.ZERO, metrics.emergencyResponseTime());
        assertEquals(92.5, metrics.complianceScore());
        assertEquals(76, metrics.trainingCompletion());
    }

    @Test
    @DisplayName("should derive counts and percentages from current state")
    void shouldDeriveFromState() {
        detect(ThreatSeverity.CRITICAL);
        final var low = detect(ThreatSeverity.LOW);
        detect(ThreatSeverity.MEDIUM);
        detect(ThreatSeverity.HIGH);
        threats.mitigate(low, List.of("cleaned host"), null, CommitGuard.none());
        threats.resolve(low, null, CommitGuard.none());

        clock.advance(Duration.ofMinutes(10));
        final var first = incidents.openIncident(
                low, IncidentRequest.of(ImpactLevel.MINIMAL, Set.of(), 0), CommitGuard.none());
        clock.advance(Duration.ofMinutes(10));
        incidents.openIncident(low, IncidentRequest.of(ImpactLevel.MINIMAL, Set.of(), 0), CommitGuard.none());
        incidents.resolve(first.id(), List.of(), CommitGuard.none());

        final var metrics = aggregator.snapshot();

        assertEquals(4, metrics.threatsDetected());
        assertEquals(1, metrics.threatsBlocked());
        assertEquals(3, metrics.openVulnerabilities());
        assertEquals(1, metrics.incidentsResolved());
        assertEquals(50.0, metrics.accessControlEffectiveness());
        assertEquals(Duration.ofMinutes(15), metrics.emergencyResponseTime());
    }

    @Test
    @DisplayName("repeated snapshots without writes should be equal")
    void shouldBeIdempotent() {
        detect(ThreatSeverity.CRITICAL);
        detect(ThreatSeverity.LOW);

        assertEquals(aggregator.snapshot(), aggregator.snapshot());
    }

    @Test
    @DisplayName("should treat a missing score source result as zero scores")
    void shouldHandleMissingScores() {
        when(scores.currentScores()).thenReturn(null);

        assertEquals(0, aggregator.snapshot().complianceScore());
    }
}
