package medguard.core.service.incident;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import medguard.adapter.out.storage.memory.InMemoryIncidentRepository;
import medguard.adapter.out.storage.memory.InMemoryThreatRepository;
import medguard.core.exception.AuditException;
import medguard.core.exception.NotFoundException;
import medguard.core.exception.ReferenceException;
import medguard.core.exception.ValidationException;
import medguard.core.model.incident.ImpactLevel;
import medguard.core.model.incident.IncidentRequest;
import medguard.core.model.incident.SecurityIncident;
import medguard.core.model.threat.SecurityThreat;
import medguard.core.model.threat.ThreatReport;
import medguard.core.model.threat.ThreatSeverity;
import medguard.core.model.threat.ThreatStatus;
import medguard.core.model.threat.ThreatType;
import medguard.core.service.common.CommitGuard;
import medguard.core.service.common.IdentifierGenerator;
import medguard.core.service.threat.ThreatEngine;
import medguard.core.service.threat.ThreatResponsePolicy;
import medguard.testing.MutableClock;

@DisplayName("IncidentTracker")
class IncidentTrackerTest {

    private InMemoryIncidentRepository repository;
    private MutableClock clock;
    private ThreatEngine threats;
    private IncidentTracker tracker;

    @BeforeEach
    void setUp() {
        repository = new InMemoryIncidentRepository();
        clock = MutableClock.startingAt("2026-03-01T08:00:00Z");
        final var ids = new IdentifierGenerator();
        threats = new ThreatEngine(new InMemoryThreatRepository(), new ThreatResponsePolicy(), ids, clock);
        tracker = new IncidentTracker(repository, threats, ids, clock);
    }

    private SecurityThreat detectedThreat() {
        final var report = ThreatReport.builder(ThreatType.PHISHING, ThreatSeverity.MEDIUM)
                .source("mail-gateway")
                .target("ris")
                .build();
        return threats.detect(report, CommitGuard.none());
    }

    @Nested
    @DisplayName("openIncident()")
    class OpenTests {

        @Test
        @DisplayName("escalating a detected threat with affected patients should require reporting")
        void shouldRequireReportingForAffectedPatients() {
            final var threat = detectedThreat();
            assertEquals(ThreatStatus.DETECTED, threat.status());
            clock.advance(Duration.ofMinutes(15));

            final var incident = tracker.openIncident(
                    threat.id(),
                    new IncidentRequest(ImpactLevel.MODERATE, Set.of("ris"), 3, false, false, List.of()),
                    CommitGuard.none());

            assertTrue(incident.reportingRequired());
            assertEquals(Duration.ofMinutes(15), incident.responseTime());
            assertEquals(threat.id(), incident.threatId());
            assertEquals(List.of(incident), tracker.byThreat(threat.id()));
        }

        @Test
        @DisplayName("escalating an unknown threat should fail and create nothing")
        void shouldRejectUnknownThreat() {
            final var exception = assertThrows(
                    ReferenceException.class,
                    () -> tracker.openIncident(
                            "thr-missing", IncidentRequest.of(ImpactLevel.MINIMAL, Set.of(), 0), CommitGuard.none()));

            assertEquals("thr-missing", exception.reference());
            assertTrue(repository.findAll().isEmpty());
        }

        @Test
        @DisplayName("should store nothing when the guard rejects the incident")
        void shouldStoreNothingWhenGuardFails() {
            final var threat = detectedThreat();

            assertThrows(
                    AuditException.class,
                    () -> tracker.openIncident(
                            threat.id(), IncidentRequest.of(ImpactLevel.MINIMAL, Set.of(), 0), (previous, pending) -> {
                                throw new AuditException("sink down");
                            }));

            assertTrue(repository.findAll().isEmpty());
        }

        @Test
        @DisplayName("should hold the threat lock while opening")
        void shouldHoldThreatLock() {
            final var threat = detectedThreat();
            final var held = new boolean[1];

            tracker.openIncident(
                    threat.id(),
                    IncidentRequest.of(ImpactLevel.MINIMAL, Set.of(), 0),
                    (previous, pending) -> held[0] = threats.withThreatLock(threat.id(), () -> true));

            assertTrue(held[0]);
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        private SecurityIncident incident;

        @BeforeEach
        void openIncident() {
            final var threat = detectedThreat();
            clock.advance(Duration.ofMinutes(5));
            incident = tracker.openIncident(
                    threat.id(), IncidentRequest.of(ImpactLevel.SIGNIFICANT, Set.of("pacs"), 0), CommitGuard.none());
        }

        @Test
        @DisplayName("resolve() should measure from the threat's detection")
        void shouldResolve() {
            clock.advance(Duration.ofMinutes(55));

            final var resolved = tracker.resolve(incident.id(), List.of("patched viewer"), CommitGuard.none());

            assertTrue(resolved.isResolved());
            assertEquals(Duration.ofHours(1), resolved.resolutionTime().orElseThrow());
            assertTrue(tracker.open().isEmpty());
        }

        @Test
        @DisplayName("recordComplianceViolation() should force reporting until resolution")
        void shouldRecordViolation() {
            final var flagged = tracker.recordComplianceViolation(incident.id(), CommitGuard.none());
            assertTrue(flagged.reportingRequired());

            tracker.resolve(incident.id(), List.of(), CommitGuard.none());
            assertThrows(
                    ValidationException.class,
                    () -> tracker.recordComplianceViolation(incident.id(), CommitGuard.none()));
        }

        @Test
        @DisplayName("appendLesson() should work after resolution")
        void shouldAppendLessonAfterResolution() {
            tracker.resolve(incident.id(), List.of("first"), CommitGuard.none());

            final var updated = tracker.appendLesson(incident.id(), "second", CommitGuard.none());

            assertEquals(List.of("first", "second"), updated.lessonsLearned());
        }

        @Test
        @DisplayName("updates on an unknown incident should fail")
        void shouldFailForUnknownIncident() {
            assertThrows(NotFoundException.class, () -> tracker.resolve("inc-missing", List.of(), CommitGuard.none()));
        }
    }

    @Test
    @DisplayName("parallel escalations and updates on one threat should finish and store every incident")
    void parallelEscalationsShouldAllBeStored() throws Exception {
        final var threat = detectedThreat();
        final var first = tracker.openIncident(
                threat.id(), IncidentRequest.of(ImpactLevel.MINIMAL, Set.of("ris"), 0), CommitGuard.none());
        final var executor = Executors.newFixedThreadPool(8);
        final var start = new CountDownLatch(1);
        try {
            final List<Future<?>> futures = new ArrayList<>();
            for (var i = 0; i < 30; i++) {
                final var n = i;
                futures.add(executor.submit(() -> {
                    start.await();
                    final var request = IncidentRequest.of(ImpactLevel.MODERATE, Set.of("pacs"), n);
                    return tracker.openIncident(threat.id(), request, CommitGuard.none());
                }));
                futures.add(executor.submit(() -> {
                    start.await();
                    return tracker.appendLesson(first.id(), "lesson " + n, CommitGuard.none());
                }));
                futures.add(executor.submit(() -> {
                    start.await();
                    return threats.recordStep(threat.id(), "step " + n, CommitGuard.none());
                }));
            }
            start.countDown();
            for (var future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(31, tracker.byThreat(threat.id()).size());
        assertEquals(31, tracker.open().size());
        assertEquals(30, tracker.get(first.id()).lessonsLearned().size());
        assertEquals(30, threats.get(threat.id()).mitigationSteps().size());
    }
}
