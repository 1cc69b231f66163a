package medguard.core.service.threat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
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

import medguard.adapter.out.storage.memory.InMemoryThreatRepository;
import medguard.core.exception.AuditException;
import medguard.core.exception.NotFoundException;
import medguard.core.exception.ValidationException;
import medguard.core.model.threat.SecurityThreat;
import medguard.core.model.threat.ThreatReport;
import medguard.core.model.threat.ThreatSeverity;
import medguard.core.model.threat.ThreatStatus;
import medguard.core.model.threat.ThreatType;
import medguard.core.service.common.CommitGuard;
import medguard.core.service.common.IdentifierGenerator;
import medguard.testing.MutableClock;

@DisplayName("ThreatEngine")
class ThreatEngineTest {

    private InMemoryThreatRepository repository;
    private MutableClock clock;
    private ThreatEngine engine;

    @BeforeEach
    void setUp() {
        repository = new InMemoryThreatRepository();
        clock = MutableClock.startingAt("2026-03-01T08:00:00Z");
        engine = new ThreatEngine(repository, new ThreatResponsePolicy(), new IdentifierGenerator(), clock);
    }

    private static ThreatReport report(ThreatSeverity severity, boolean patientDataAtRisk) {
        return ThreatReport.builder(ThreatType.INTRUSION, severity)
                .source("10.0.0.7")
                .target("ehr-gateway")
                .patientDataAtRisk(patientDataAtRisk)
                .build();
    }

    @Nested
    @DisplayName("detect()")
    class DetectTests {

        @Test
        @DisplayName("critical threat with patient data at risk should be blocked and counted once")
        void shouldBlockCriticalPatientThreat() {
            final var before = engine.blockedCount();

            final var threat = engine.detect(report(ThreatSeverity.CRITICAL, true), CommitGuard.none());

            assertEquals(ThreatStatus.BLOCKED, threat.status());
            assertEquals(before + 1, engine.blockedCount());
            assertEquals(threat, engine.get(threat.id()));
        }

        @Test
        @DisplayName("low severity threat should stay detected")
        void shouldLeaveLowThreatDetected() {
            final var threat = engine.detect(report(ThreatSeverity.LOW, false), CommitGuard.none());

            assertEquals(ThreatStatus.DETECTED, threat.status());
            assertEquals(0, engine.blockedCount());
        }

        @Test
        @DisplayName("should store nothing when the guard rejects the new threat")
        void shouldStoreNothingWhenGuardFails() {
            final CommitGuard<SecurityThreat> failing = (previous, pending) -> {
                throw new AuditException("sink down");
            };

            assertThrows(AuditException.class, () -> engine.detect(report(ThreatSeverity.HIGH, false), failing));

            assertTrue(repository.findAll().isEmpty());
        }

        @Test
        @DisplayName("should hand the pending threat to the guard with no previous version")
        void shouldPassPendingToGuard() {
            final var seen = new SecurityThreat[2];
            engine.detect(report(ThreatSeverity.CRITICAL, false), (previous, pending) -> {
                seen[0] = previous;
                seen[1] = pending;
            });

            assertNull(seen[0]);
            assertEquals(ThreatStatus.BLOCKED, seen[1].status());
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should mitigate and resolve with steps")
        void shouldMitigateAndResolve() {
            final var threat = engine.detect(report(ThreatSeverity.CRITICAL, false), CommitGuard.none());
            clock.advance(Duration.ofMinutes(10));

            engine.mitigate(threat.id(), List.of("revoked session"), "mitigated", CommitGuard.none());
            engine.recordStep(threat.id(), "rotated credentials", CommitGuard.none());
            final var resolved = engine.resolve(threat.id(), "closed", CommitGuard.none());

            assertEquals(ThreatStatus.RESOLVED, resolved.status());
            assertEquals(List.of("revoked session", "rotated credentials"), resolved.mitigationSteps());
            assertEquals(1, engine.blockedCount());
            assertTrue(engine.active().isEmpty());
        }

        @Test
        @DisplayName("should refuse to resolve without mitigation steps")
        void shouldRefuseResolveWithoutSteps() {
            final var threat = engine.detect(report(ThreatSeverity.LOW, false), CommitGuard.none());
            engine.mitigate(threat.id(), List.of(), null, CommitGuard.none());

            assertThrows(ValidationException.class, () -> engine.resolve(threat.id(), null, CommitGuard.none()));
            assertEquals(ThreatStatus.MITIGATED, engine.get(threat.id()).status());
        }

        @Test
        @DisplayName("should keep the stored version when the guard rejects a transition")
        void shouldKeepStoredVersionOnGuardFailure() {
            final var threat = engine.detect(report(ThreatSeverity.LOW, false), CommitGuard.none());

            assertThrows(
                    AuditException.class,
                    () -> engine.mitigate(threat.id(), List.of("step"), null, (previous, pending) -> {
                        throw new AuditException("sink down");
                    }));

            assertEquals(ThreatStatus.DETECTED, engine.get(threat.id()).status());
        }

        @Test
        @DisplayName("should fail for an unknown threat")
        void shouldFailForUnknownThreat() {
            assertThrows(
                    NotFoundException.class,
                    () -> engine.mitigate("thr-missing", List.of("x"), null, CommitGuard.none()));
        }
    }

    @Test
    @DisplayName("queries should order by severity and filter by status")
    void queriesShouldOrderAndFilter() {
        final var low = engine.detect(report(ThreatSeverity.LOW, false), CommitGuard.none());
        clock.advance(Duration.ofSeconds(1));
        final var critical = engine.detect(report(ThreatSeverity.CRITICAL, false), CommitGuard.none());
        clock.advance(Duration.ofSeconds(1));
        final var high = engine.detect(report(ThreatSeverity.HIGH, false), CommitGuard.none());

        assertEquals(
                List.of(critical.id(), high.id(), low.id()),
                engine.list().stream().map(SecurityThreat::id).toList());
        assertEquals(
                List.of(critical.id()),
                engine.listByStatus(ThreatStatus.BLOCKED).stream().map(SecurityThreat::id).toList());
        assertEquals(
                List.of(critical.id(), high.id()),
                engine.listBySeverity(ThreatSeverity.HIGH).stream().map(SecurityThreat::id).toList());
    }

    @Test
    @DisplayName("concurrent steps and mitigation on one threat should lose no step")
    void concurrentStepsShouldAllBeKept() throws Exception {
        final var threat = engine.detect(report(ThreatSeverity.LOW, false), CommitGuard.none());
        final var executor = Executors.newFixedThreadPool(8);
        final var start = new CountDownLatch(1);
        try {
            final List<Future<SecurityThreat>> futures = new ArrayList<>();
            for (var i = 0; i < 40; i++) {
                final var step = "blocked port " + (8000 + i);
                futures.add(executor.submit(() -> {
                    start.await();
                    return engine.recordStep(threat.id(), step, CommitGuard.none());
                }));
            }
            futures.add(executor.submit(() -> {
                start.await();
                return engine.mitigate(threat.id(), List.of("isolated host"), "contained", CommitGuard.none());
            }));
            start.countDown();
            for (var future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        final var stored = engine.get(threat.id());
        assertEquals(ThreatStatus.MITIGATED, stored.status());
        assertEquals(41, stored.mitigationSteps().size());
        assertEquals(41, Set.copyOf(stored.mitigationSteps()).size());
        assertTrue(stored.mitigationSteps().contains("isolated host"));
    }
}
