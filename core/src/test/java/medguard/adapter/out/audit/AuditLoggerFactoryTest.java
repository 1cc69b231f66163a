package medguard.adapter.out.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

import java.nio.file.Path;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import medguard.core.config.MedguardConfig;

@DisplayName("AuditLoggerFactory")
@ExtendWith(MockitoExtension.class)
class AuditLoggerFactoryTest {

    @TempDir
    Path tempDir;

    @Mock
    MedguardConfig config;

    @Mock
    MedguardConfig.Audit audit;

    @Test
    @DisplayName("should default to the logging sink")
    void shouldDefaultToLogging() {
        assertInstanceOf(LoggingAuditLogger.class, AuditLoggerFactory.create(null, null));
        assertInstanceOf(LoggingAuditLogger.class, AuditLoggerFactory.create(" Logging ", null));
    }

    @Test
    @DisplayName("should build the sink named in configuration")
    void shouldUseConfiguredSink() {
        when(config.audit()).thenReturn(audit);
        when(audit.sink()).thenReturn(AuditLoggerFactory.JSON_FILE);
        when(audit.file()).thenReturn(tempDir.resolve("audit.jsonl").toString());

        final var logger = new AuditLoggerFactory(config).auditLogger();

        final var fileLogger = assertInstanceOf(JsonFileAuditLogger.class, logger);
        assertEquals(tempDir.resolve("audit.jsonl"), fileLogger.file());
        logger.close();
    }

    @Test
    @DisplayName("should create the in-memory sink")
    void shouldCreateMemorySink() {
        assertEquals("memory", AuditLoggerFactory.create(AuditLoggerFactory.MEMORY, null).name());
    }

    @Test
    @DisplayName("should reject unknown sinks")
    void shouldRejectUnknownSink() {
        assertThrows(IllegalArgumentException.class, () -> AuditLoggerFactory.create("syslog", null));
    }
}
