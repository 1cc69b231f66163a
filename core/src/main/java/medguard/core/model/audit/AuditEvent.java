package medguard.core.model.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event handed to the external audit logger.
 *
 * @param kind      what happened
 * @param actorId   who caused it
 * @param targetId  what it happened to (permission, threat id, incident id)
 * @param timestamp when it happened
 * @param details   ordered key/value details
 */
public record AuditEvent(
        AuditEventKind kind, String actorId, String targetId, Instant timestamp, Map<String, String> details) {

    /** Details key carrying special markers. */
    public static final String MARKER = "marker";

    /** Marker placed on every event produced by an emergency override. */
    public static final String EMERGENCY_OVERRIDE_MARKER = "emergency-override-used";

    /** Actor recorded for transitions made by the core itself. */
    public static final String SYSTEM_ACTOR = "medguard";

    public AuditEvent {
        if (kind == null || timestamp == null) {
            throw new IllegalArgumentException("Audit event requires kind and timestamp");
        }
        if (actorId == null) {
            actorId = SYSTEM_ACTOR;
        }
        if (targetId == null) {
            targetId = "";
        }
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public boolean hasMarker(String marker) {
        return marker.equals(details.get(MARKER));
    }

    public static Builder builder(AuditEventKind kind, Instant timestamp) {
        return new Builder(kind, timestamp);
    }

    public static class Builder {
        private final AuditEventKind kind;
        private final Instant timestamp;
        private final Map<String, String> details = new LinkedHashMap<>();
        private String actorId;
        private String targetId;

        private Builder(AuditEventKind kind, Instant timestamp) {
            this.kind = kind;
            this.timestamp = timestamp;
        }

        public Builder actor(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder target(String targetId) {
            this.targetId = targetId;
            return this;
        }

        public Builder detail(String key, Object value) {
            if (value != null) {
                details.put(key, String.valueOf(value));
            }
            return this;
        }

        public AuditEvent build() {
            return new AuditEvent(kind, actorId, targetId, timestamp, details);
        }
    }
}
