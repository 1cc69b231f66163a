package medguard.core.service.common;

import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Generates collision-free identifiers for threats and incidents.
 *
 * <p>Identifiers are a short type prefix followed by a random (version 4) UUID,
 * e.g. {@code thr-3f0c...}. {@link UUID#randomUUID()} draws from a
 * {@link java.security.SecureRandom}, which is safe for concurrent callers.
 */
@ApplicationScoped
public class IdentifierGenerator {

    public static final String THREAT_PREFIX = "thr";
    public static final String INCIDENT_PREFIX = "inc";

    public String threatId() {
        return generate(THREAT_PREFIX);
    }

    public String incidentId() {
        return generate(INCIDENT_PREFIX);
    }

    /**
     * Generate an identifier with a custom prefix.
     *
     * @param prefix the type prefix
     * @return a new identifier
     */
    public String generate(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }
}
