package medguard.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the medguard security core.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code medguard.audit.ack-timeout} - Max wait for the audit acknowledgement (default: PT5S)</li>
 *   <li>{@code medguard.audit.sink} - Audit sink: logging, json-file or memory (default: logging)</li>
 *   <li>{@code medguard.audit.file} - Path of the JSON-lines audit file (default: medguard-audit.jsonl)</li>
 *   <li>{@code medguard.access.emergency-override-enabled} - Allow emergency overrides (default: true)</li>
 *   <li>{@code medguard.anomaly.enabled} - Raise threats on denial spikes (default: true)</li>
 *   <li>{@code medguard.bootstrap.default-roles} - Seed the built-in roles (default: true)</li>
 * </ul>
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code MEDGUARD_AUDIT_SINK} - Audit sink</li>
 *   <li>{@code MEDGUARD_AUDIT_ACK_TIMEOUT} - Audit acknowledgement timeout</li>
 *   <li>{@code MEDGUARD_ACCESS_EMERGENCY_OVERRIDE_ENABLED} - Emergency override kill switch</li>
 * </ul>
 */
@ConfigMapping(prefix = "medguard")
public interface MedguardConfig {

    Audit audit();

    Access access();

    Anomaly anomaly();

    Bootstrap bootstrap();

    Compliance compliance();

    /**
     * Audit sink configuration.
     */
    interface Audit {

        /**
         * Maximum time to wait for the sink to acknowledge an event.
         *
         * <p>An operation whose event is not acknowledged in time fails with an
         * audit error and commits nothing.
         *
         * @return the acknowledgement timeout (default: 5 seconds)
         */
        @WithName("ack-timeout")
        @WithDefault("PT5S")
        Duration ackTimeout();

        /**
         * Which sink receives audit events.
         *
         * @return {@code logging}, {@code json-file} or {@code memory}
         */
        @WithDefault("logging")
        String sink();

        /**
         * Target file for the {@code json-file} sink.
         */
        @WithDefault("medguard-audit.jsonl")
        String file();
    }

    /**
     * Access evaluation configuration.
     */
    interface Access {

        /**
         * Global switch for emergency overrides.
         *
         * <p>When disabled, override requests are evaluated as standard requests
         * and the refusal is recorded in the audit event.
         *
         * @return true if overrides may be honored
         */
        @WithName("emergency-override-enabled")
        @WithDefault("true")
        boolean emergencyOverrideEnabled();
    }

    /**
     * Denial spike detection.
     */
    interface Anomaly {

        @WithDefault("true")
        boolean enabled();

        /**
         * Denials within one window that raise a threat.
         */
        @WithName("denial-threshold")
        @WithDefault("5")
        int denialThreshold();

        @WithDefault("PT1M")
        Duration window();

        /**
         * Upper bound on actors whose denial windows are held at once.
         */
        @WithName("max-tracked-actors")
        @WithDefault("10000")
        long maxTrackedActors();
    }

    /**
     * Startup seeding.
     */
    interface Bootstrap {

        /**
         * Whether to seed the built-in medical roles at startup.
         */
        @WithName("default-roles")
        @WithDefault("true")
        boolean defaultRoles();
    }

    /**
     * Static compliance scores, used when no external score source is wired in.
     */
    interface Compliance {

        @WithDefault("0")
        double score();

        @WithDefault("0")
        double audit();

        @WithName("data-protection")
        @WithDefault("0")
        double dataProtection();

        @WithName("training-completion")
        @WithDefault("0")
        double trainingCompletion();
    }
}
