package medguard.core.model.metrics;

import java.time.Duration;

/**
 * Point-in-time security metrics, recomputed on every read.
 *
 * <p>Carries no timestamp so that two snapshots taken with no intervening writes
 * are equal.
 *
 * @param threatsDetected            threats ever detected
 * @param threatsBlocked             threats that were blocked at some point
 * @param incidentsResolved          incidents with resolution fields set
 * @param openVulnerabilities        threats not yet resolved
 * @param complianceScore            external compliance percentage
 * @param auditScore                 external audit percentage
 * @param dataProtectionScore        external data protection percentage
 * @param accessControlEffectiveness percentage of detected threats that were contained
 * @param trainingCompletion         external training completion percentage
 * @param emergencyResponseTime      mean incident response time, zero with no incidents
 */
public record SecurityMetrics(
        long threatsDetected,
        long threatsBlocked,
        long incidentsResolved,
        long openVulnerabilities,
        double complianceScore,
        double auditScore,
        double dataProtectionScore,
        double accessControlEffectiveness,
        double trainingCompletion,
        Duration emergencyResponseTime) {}
