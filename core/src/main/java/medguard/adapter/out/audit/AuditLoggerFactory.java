package medguard.adapter.out.audit;

import java.nio.file.Path;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import medguard.core.config.MedguardConfig;
import medguard.core.port.out.AuditLogger;

/**
 * Selects the audit sink from {@code medguard.audit.sink}.
 */
@ApplicationScoped
public class AuditLoggerFactory {

    private static final Logger LOG = Logger.getLogger(AuditLoggerFactory.class);

    public static final String LOGGING = "logging";
    public static final String JSON_FILE = "json-file";
    public static final String MEMORY = "memory";

    private final MedguardConfig config;

    @Inject
    public AuditLoggerFactory(MedguardConfig config) {
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public AuditLogger auditLogger() {
        return create(config.audit().sink(), config.audit().file());
    }

    /**
     * Create a sink by name.
     *
     * @param sink the sink name
     * @param file target file, used by the {@code json-file} sink only
     * @return the sink
     * @throws IllegalArgumentException if the sink name is unknown
     */
    public static AuditLogger create(String sink, String file) {
        final var name = sink == null ? LOGGING : sink.trim().toLowerCase();
        LOG.debugf("Creating %s audit sink", name);
        return switch (name) {
            case LOGGING -> new LoggingAuditLogger();
            case JSON_FILE -> new JsonFileAuditLogger(Path.of(file));
            case MEMORY -> {
                LOG.warn("In-memory audit sink selected: audit events will not survive a restart");
                yield new InMemoryAuditLogger();
            }
            default -> throw new IllegalArgumentException("Unknown audit sink '" + sink + "'; expected "
                    + LOGGING + ", " + JSON_FILE + " or " + MEMORY);
        };
    }
}
