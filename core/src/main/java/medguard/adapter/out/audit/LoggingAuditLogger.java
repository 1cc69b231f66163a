package medguard.adapter.out.audit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import medguard.core.model.audit.AuditEvent;
import medguard.core.port.out.AuditLogger;

/**
 * Audit sink that writes events to the {@code medguard.audit} log category.
 *
 * <p>Emergency overrides and threat events are logged at WARN, denials at INFO and
 * everything else at DEBUG. The event is acknowledged once the log call returns,
 * so durability is whatever the configured log handler provides.
 */
public class LoggingAuditLogger implements AuditLogger {

    static final String CATEGORY = "medguard.audit";

    private static final Logger AUDIT = Logger.getLogger(CATEGORY);

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public Uni<Void> emit(AuditEvent event) {
        return Uni.createFrom().item(() -> {
            AUDIT.logf(
                    levelFor(event),
                    "%s actor=%s target=%s at=%s %s",
                    event.kind().code(),
                    event.actorId(),
                    event.targetId(),
                    event.timestamp(),
                    event.details());
            return null;
        });
    }

    static Logger.Level levelFor(AuditEvent event) {
        return switch (event.kind()) {
            case EMERGENCY_OVERRIDE_USED, THREAT_DETECTED, THREAT_MITIGATED, THREAT_RESOLVED -> Logger.Level.WARN;
            case ACCESS_DENIED, INCIDENT_OPENED, INCIDENT_RESOLVED -> Logger.Level.INFO;
            case ACCESS_ALLOWED, THREAT_STEP_RECORDED, INCIDENT_UPDATED -> Logger.Level.DEBUG;
        };
    }
}
