package medguard.adapter.out.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.jboss.logging.Logger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import medguard.core.model.audit.AuditEvent;
import medguard.core.model.audit.AuditEventKind;

@DisplayName("LoggingAuditLogger")
class LoggingAuditLoggerTest {

    private static AuditEvent event(AuditEventKind kind) {
        return AuditEvent.builder(kind, Instant.parse("2026-03-01T08:00:00Z")).target("t").build();
    }

    @Test
    @DisplayName("overrides and threat transitions should log at WARN")
    void shouldWarnForOverridesAndThreats() {
        assertEquals(Logger.Level.WARN, LoggingAuditLogger.levelFor(event(AuditEventKind.EMERGENCY_OVERRIDE_USED)));
        assertEquals(Logger.Level.WARN, LoggingAuditLogger.levelFor(event(AuditEventKind.THREAT_DETECTED)));
        assertEquals(Logger.Level.WARN, LoggingAuditLogger.levelFor(event(AuditEventKind.THREAT_RESOLVED)));
    }

    @Test
    @DisplayName("routine events should stay below INFO")
    void shouldDebugRoutineEvents() {
        assertEquals(Logger.Level.DEBUG, LoggingAuditLogger.levelFor(event(AuditEventKind.ACCESS_ALLOWED)));
        assertEquals(Logger.Level.INFO, LoggingAuditLogger.levelFor(event(AuditEventKind.ACCESS_DENIED)));
    }

    @ParameterizedTest
    @EnumSource(
            value = AuditEventKind.class,
            names = {"THREAT_STEP_RECORDED", "INCIDENT_UPDATED"})
    @DisplayName("follow-up updates should log at DEBUG")
    void shouldDebugFollowUps(AuditEventKind kind) {
        assertEquals(Logger.Level.DEBUG, LoggingAuditLogger.levelFor(event(kind)));
    }

    @ParameterizedTest
    @EnumSource(AuditEventKind.class)
    @DisplayName("every kind of event should map to a level no more verbose than DEBUG")
    void shouldMapEveryKind(AuditEventKind kind) {
        final var level = LoggingAuditLogger.levelFor(event(kind));

        assertNotNull(level);
        assertTrue(level.ordinal() <= Logger.Level.DEBUG.ordinal(), kind.name());
    }

    @ParameterizedTest
    @EnumSource(AuditEventKind.class)
    @DisplayName("should acknowledge every kind of event")
    void shouldAcknowledgeEveryKind(AuditEventKind kind) {
        new LoggingAuditLogger().emit(event(kind)).await().atMost(Duration.ofSeconds(1));
    }
}
