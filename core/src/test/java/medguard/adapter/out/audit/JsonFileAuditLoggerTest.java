package medguard.adapter.out.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import medguard.core.exception.AuditException;
import medguard.core.model.audit.AuditEvent;
import medguard.core.model.audit.AuditEventKind;

@DisplayName("JsonFileAuditLogger")
class JsonFileAuditLoggerTest {

    private static final Duration WAIT = Duration.ofSeconds(1);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private static AuditEvent event(AuditEventKind kind, String target) {
        return AuditEvent.builder(kind, Instant.parse("2026-03-01T08:00:00Z"))
                .actor("dr-lee")
                .target(target)
                .detail("reason", "role_permission")
                .build();
    }

    @Test
    @DisplayName("should append one JSON object per line")
    void shouldAppendJsonLines() throws IOException {
        final var file = tempDir.resolve("audit/events.jsonl");
        final var logger = new JsonFileAuditLogger(file);

        logger.emit(event(AuditEventKind.ACCESS_ALLOWED, "imaging:study:read")).await().atMost(WAIT);
        logger.emit(event(AuditEventKind.ACCESS_DENIED, "user:manage")).await().atMost(WAIT);
        logger.close();

        final var lines = Files.readAllLines(file);
        assertEquals(2, lines.size());
        final var first = MAPPER.readTree(lines.get(0));
        assertEquals("access.allowed", first.get("kind").asText());
        assertEquals("dr-lee", first.get("actorId").asText());
        assertEquals("imaging:study:read", first.get("targetId").asText());
        assertEquals("2026-03-01T08:00:00Z", first.get("timestamp").asText());
        assertEquals("role_permission", first.get("details").get("reason").asText());
    }

    @Test
    @DisplayName("should keep existing lines when reopened")
    void shouldAppendAcrossInstances() throws IOException {
        final var file = tempDir.resolve("events.jsonl");
        final var first = new JsonFileAuditLogger(file);
        first.emit(event(AuditEventKind.THREAT_DETECTED, "thr-1")).await().atMost(WAIT);
        first.close();

        final var second = new JsonFileAuditLogger(file);
        second.emit(event(AuditEventKind.THREAT_RESOLVED, "thr-1")).await().atMost(WAIT);
        second.close();

        assertEquals(2, Files.readAllLines(file).size());
    }

    @Test
    @DisplayName("should reject events after close")
    void shouldRejectAfterClose() {
        final var logger = new JsonFileAuditLogger(tempDir.resolve("events.jsonl"));
        logger.close();
        logger.close();

        assertThrows(
                AuditException.class,
                () -> logger.emit(event(AuditEventKind.ACCESS_ALLOWED, "x:y")).await().atMost(WAIT));
    }

    @Test
    @DisplayName("should fail with an audit error when the file cannot be opened")
    void shouldFailOnUnwritablePath() throws IOException {
        final var directory = Files.createDirectory(tempDir.resolve("taken"));

        final var exception = assertThrows(AuditException.class, () -> new JsonFileAuditLogger(directory));
        assertTrue(exception.getMessage().contains("Cannot open audit file"));
    }
}
