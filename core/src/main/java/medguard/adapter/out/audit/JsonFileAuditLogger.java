package medguard.adapter.out.audit;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import medguard.core.exception.AuditException;
import medguard.core.model.audit.AuditEvent;
import medguard.core.port.out.AuditLogger;

/**
 * Append-only audit sink writing one JSON object per line.
 *
 * <p>Each event is written and flushed before it is acknowledged. Any write failure
 * fails the acknowledgement with an {@link AuditException}, which aborts the audited
 * operation. Writes are serialized, so lines never interleave.
 */
public class JsonFileAuditLogger implements AuditLogger {

    private static final Logger LOG = Logger.getLogger(JsonFileAuditLogger.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Path file;
    private final Object writeLock = new Object();
    private BufferedWriter writer;
    private boolean closed;

    /**
     * Open (or create) the audit file for appending.
     *
     * @param file the target file; parent directories are created as needed
     * @throws AuditException if the file cannot be opened
     */
    public JsonFileAuditLogger(Path file) {
        this.file = file;
        try {
            final var parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            this.writer = Files.newBufferedWriter(
                    file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new AuditException("Cannot open audit file " + file, e);
        }
        LOG.infof("Writing audit events to %s", file.toAbsolutePath());
    }

    @Override
    public String name() {
        return "json-file";
    }

    public Path file() {
        return file;
    }

    @Override
    public Uni<Void> emit(AuditEvent event) {
        return Uni.createFrom().item(() -> {
            final var line = toJson(event);
            synchronized (writeLock) {
                if (closed) {
                    throw new AuditException("Audit file " + file + " is closed");
                }
                try {
                    writer.write(line);
                    writer.newLine();
                    writer.flush();
                } catch (IOException e) {
                    throw new AuditException("Failed to write audit event to " + file, e);
                }
            }
            return null;
        });
    }

    @Override
    public void close() {
        synchronized (writeLock) {
            if (closed) {
                return;
            }
            closed = true;
            try {
                writer.close();
            } catch (IOException e) {
                LOG.warnf(e, "Failed to close audit file %s", file);
            }
        }
    }

    static String toJson(AuditEvent event) {
        final Map<String, Object> json = new LinkedHashMap<>();
        json.put("kind", event.kind().code());
        json.put("actorId", event.actorId());
        json.put("targetId", event.targetId());
        json.put("timestamp", event.timestamp());
        json.put("details", event.details());
        try {
            return OBJECT_MAPPER.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new AuditException("Failed to serialize audit event " + event.kind().code(), e);
        }
    }
}
