package medguard.core.model.threat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import medguard.core.exception.ValidationException;

/**
 * A detected security threat.
 *
 * <p>Instances are immutable; every transition returns a new instance with the
 * status history extended. Type, severity, source, target and the data-involvement
 * flags never change after detection. Threats are never deleted, only resolved.
 *
 * @param id                    unique identifier
 * @param type                  threat category
 * @param severity              assessed severity
 * @param sourceId              origin of the threat
 * @param targetId              system or resource targeted
 * @param title                 short headline
 * @param description           free-text description
 * @param detectedAt            detection timestamp
 * @param status                current lifecycle status
 * @param protectedDataInvolved whether protected medical data is implicated
 * @param patientDataAtRisk     whether patient data is at risk
 * @param mitigationSteps       ordered remediation steps taken so far
 * @param history               append-only status history, oldest first
 */
public record SecurityThreat(
        String id,
        ThreatType type,
        ThreatSeverity severity,
        String sourceId,
        String targetId,
        String title,
        String description,
        Instant detectedAt,
        ThreatStatus status,
        boolean protectedDataInvolved,
        boolean patientDataAtRisk,
        List<String> mitigationSteps,
        List<ThreatStatusChange> history) {

    public SecurityThreat {
        if (id == null || id.isBlank()) {
            throw new ValidationException("Threat ID cannot be null or blank");
        }
        if (type == null || severity == null || status == null || detectedAt == null) {
            throw new ValidationException("Threat '" + id + "' is missing type, severity, status or timestamp");
        }
        mitigationSteps = mitigationSteps == null ? List.of() : List.copyOf(mitigationSteps);
        history = history == null ? List.of() : List.copyOf(history);
        if (status == ThreatStatus.RESOLVED && mitigationSteps.isEmpty()) {
            throw new ValidationException("Threat '" + id + "' cannot be resolved without mitigation steps");
        }
    }

    /**
     * Create a threat in the {@code DETECTED} state from a report.
     *
     * @param id     identifier to assign
     * @param report the detection report
     * @param at     detection timestamp
     * @return the new threat
     */
    public static SecurityThreat detect(String id, ThreatReport report, Instant at) {
        return new SecurityThreat(
                id,
                report.type(),
                report.severity(),
                report.sourceId(),
                report.targetId(),
                report.title(),
                report.description(),
                at,
                ThreatStatus.DETECTED,
                report.protectedDataInvolved(),
                report.patientDataAtRisk(),
                List.of(),
                List.of(new ThreatStatusChange(ThreatStatus.DETECTED, at, "detected")));
    }

    /**
     * Move to {@code BLOCKED}.
     *
     * @throws ValidationException if the current status cannot move to BLOCKED
     */
    public SecurityThreat block(Instant at, String note) {
        return transition(ThreatStatus.BLOCKED, mitigationSteps, at, note);
    }

    /**
     * Move to {@code MITIGATED}, appending any steps supplied.
     *
     * @param steps additional remediation steps, may be empty
     * @throws ValidationException if the current status cannot move to MITIGATED
     */
    public SecurityThreat mitigate(List<String> steps, Instant at, String note) {
        return transition(ThreatStatus.MITIGATED, appended(steps), at, note);
    }

    /**
     * Append a remediation step without changing status.
     *
     * @throws ValidationException if the threat is resolved or the step is blank
     */
    public SecurityThreat withMitigationStep(String step) {
        if (status.isTerminal()) {
            throw new ValidationException("Threat '" + id + "' is resolved and can no longer change");
        }
        if (step == null || step.isBlank()) {
            throw new ValidationException("Mitigation step cannot be blank");
        }
        return new SecurityThreat(
                id,
                type,
                severity,
                sourceId,
                targetId,
                title,
                description,
                detectedAt,
                status,
                protectedDataInvolved,
                patientDataAtRisk,
                appended(List.of(step)),
                history);
    }

    /**
     * Move to {@code RESOLVED}.
     *
     * @throws ValidationException if the threat is not mitigated or has no mitigation steps
     */
    public SecurityThreat resolve(Instant at, String note) {
        if (status == ThreatStatus.MITIGATED && mitigationSteps.isEmpty()) {
            throw new ValidationException(
                    "Threat '" + id + "' cannot be resolved without at least one documented mitigation step");
        }
        return transition(ThreatStatus.RESOLVED, mitigationSteps, at, note);
    }

    /**
     * Whether the threat was ever blocked, read from the status history.
     */
    public boolean wasBlocked() {
        for (var change : history) {
            if (change.status() == ThreatStatus.BLOCKED) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether the threat still needs attention (anything but resolved).
     */
    public boolean isActive() {
        return !status.isTerminal();
    }

    private SecurityThreat transition(ThreatStatus target, List<String> steps, Instant at, String note) {
        if (!status.canTransitionTo(target)) {
            throw new ValidationException(
                    "Threat '" + id + "' cannot move from " + status + " to " + target);
        }
        final var updatedHistory = new ArrayList<>(history);
        updatedHistory.add(new ThreatStatusChange(target, at, note));
        return new SecurityThreat(
                id,
                type,
                severity,
                sourceId,
                targetId,
                title,
                description,
                detectedAt,
                target,
                protectedDataInvolved,
                patientDataAtRisk,
                steps,
                updatedHistory);
    }

    private List<String> appended(List<String> steps) {
        if (steps == null || steps.isEmpty()) {
            return mitigationSteps;
        }
        final var combined = new ArrayList<>(mitigationSteps);
        for (var step : steps) {
            if (step == null || step.isBlank()) {
                throw new ValidationException("Mitigation step cannot be blank");
            }
            combined.add(step);
        }
        return combined;
    }
}
