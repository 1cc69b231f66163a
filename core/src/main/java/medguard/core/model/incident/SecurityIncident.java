package medguard.core.model.incident;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import medguard.core.exception.ValidationException;

/**
 * A security incident escalated from a threat.
 *
 * <p>{@code reportingRequired} is normalised on every construction: it is true
 * whenever {@code affectedPatients > 0} or {@code complianceViolation} is set,
 * whatever value was passed in. Once resolved, only lessons may be appended.
 *
 * @param id                  unique identifier
 * @param threatId            the originating threat (non-owning reference)
 * @param impact              assessed impact
 * @param affectedSystems     affected system identifiers
 * @param affectedPatients    number of affected patients
 * @param openedAt            when the incident was opened
 * @param responseTime        threat detection to incident opening
 * @param resolvedAt          when the incident was resolved
 * @param resolutionTime      threat detection to incident resolution
 * @param complianceViolation whether a compliance violation occurred
 * @param reportingRequired   whether regulatory reporting is required
 * @param lessonsLearned      free-text lessons
 */
public record SecurityIncident(
        String id,
        String threatId,
        ImpactLevel impact,
        Set<String> affectedSystems,
        int affectedPatients,
        Instant openedAt,
        Duration responseTime,
        Optional<Instant> resolvedAt,
        Optional<Duration> resolutionTime,
        boolean complianceViolation,
        boolean reportingRequired,
        List<String> lessonsLearned) {

    public SecurityIncident {
        if (id == null || id.isBlank()) {
            throw new ValidationException("Incident ID cannot be null or blank");
        }
        if (threatId == null || threatId.isBlank()) {
            throw new ValidationException("Incident '" + id + "' must reference a threat");
        }
        if (impact == null || openedAt == null || responseTime == null) {
            throw new ValidationException("Incident '" + id + "' is missing impact, open time or response time");
        }
        if (affectedPatients < 0) {
            throw new ValidationException("Affected patient count cannot be negative");
        }
        if (responseTime.isNegative()) {
            throw new ValidationException("Response time cannot be negative for incident '" + id + "'");
        }
        resolvedAt = resolvedAt == null ? Optional.empty() : resolvedAt;
        resolutionTime = resolutionTime == null ? Optional.empty() : resolutionTime;
        if (resolutionTime.isPresent() && resolutionTime.get().isNegative()) {
            throw new ValidationException("Resolution time cannot be negative for incident '" + id + "'");
        }
        if (resolvedAt.isPresent() != resolutionTime.isPresent()) {
            throw new ValidationException("Incident '" + id + "' must set resolution time and timestamp together");
        }
        affectedSystems = affectedSystems == null ? Set.of() : Set.copyOf(affectedSystems);
        lessonsLearned = lessonsLearned == null ? List.of() : List.copyOf(lessonsLearned);
        reportingRequired = reportingRequired || requiresReporting(affectedPatients, complianceViolation);
    }

    /**
     * Open an incident.
     *
     * @param id               identifier to assign
     * @param threatId         originating threat
     * @param threatDetectedAt when the threat was detected
     * @param request          escalation input
     * @param openedAt         opening timestamp
     * @return the new incident
     * @throws ValidationException if the opening precedes the threat's detection
     */
    public static SecurityIncident open(
            String id, String threatId, Instant threatDetectedAt, IncidentRequest request, Instant openedAt) {
        return new SecurityIncident(
                id,
                threatId,
                request.impact(),
                request.affectedSystems(),
                request.affectedPatients(),
                openedAt,
                Duration.between(threatDetectedAt, openedAt),
                Optional.empty(),
                Optional.empty(),
                request.complianceViolation(),
                request.reportingRequired(),
                request.lessonsLearned());
    }

    /**
     * Whether the given inputs force regulatory reporting.
     */
    public static boolean requiresReporting(int affectedPatients, boolean complianceViolation) {
        return affectedPatients > 0 || complianceViolation;
    }

    public IncidentStatus status() {
        return resolvedAt.isPresent() ? IncidentStatus.RESOLVED : IncidentStatus.OPEN;
    }

    public boolean isResolved() {
        return status() == IncidentStatus.RESOLVED;
    }

    /**
     * Set the resolution fields.
     *
     * @param threatDetectedAt when the originating threat was detected
     * @param at               resolution timestamp
     * @param lessons          lessons to append, may be empty
     * @throws ValidationException if already resolved or the resolution precedes detection
     */
    public SecurityIncident resolve(Instant threatDetectedAt, Instant at, List<String> lessons) {
        requireOpen();
        return new SecurityIncident(
                id,
                threatId,
                impact,
                affectedSystems,
                affectedPatients,
                openedAt,
                responseTime,
                Optional.of(at),
                Optional.of(Duration.between(threatDetectedAt, at)),
                complianceViolation,
                reportingRequired,
                appended(lessons));
    }

    /**
     * Flag a compliance violation, which also forces reporting.
     *
     * @throws ValidationException if already resolved
     */
    public SecurityIncident withComplianceViolation() {
        requireOpen();
        return new SecurityIncident(
                id,
                threatId,
                impact,
                affectedSystems,
                affectedPatients,
                openedAt,
                responseTime,
                resolvedAt,
                resolutionTime,
                true,
                true,
                lessonsLearned);
    }

    /**
     * Append a lesson. Allowed before and after resolution.
     *
     * @throws ValidationException if the lesson is blank
     */
    public SecurityIncident withLesson(String lesson) {
        return new SecurityIncident(
                id,
                threatId,
                impact,
                affectedSystems,
                affectedPatients,
                openedAt,
                responseTime,
                resolvedAt,
                resolutionTime,
                complianceViolation,
                reportingRequired,
                appended(List.of(lesson)));
    }

    private void requireOpen() {
        if (isResolved()) {
            throw new ValidationException("Incident '" + id + "' is resolved; only lessons may be appended");
        }
    }

    private List<String> appended(List<String> lessons) {
        if (lessons == null || lessons.isEmpty()) {
            return lessonsLearned;
        }
        final var combined = new ArrayList<>(lessonsLearned);
        for (var lesson : lessons) {
            if (lesson == null || lesson.isBlank()) {
                throw new ValidationException("Lesson cannot be blank");
            }
            combined.add(lesson);
        }
        return combined;
    }
}
