package medguard.core.model.incident;

import java.util.List;
import java.util.Set;

import medguard.core.exception.ValidationException;

/**
 * Input for escalating a threat into an incident.
 *
 * <p>{@code reportingRequired} is a request only: it is forced to true whenever
 * patients are affected or a compliance violation is flagged.
 *
 * @param impact              assessed impact
 * @param affectedSystems     identifiers of affected systems
 * @param affectedPatients    number of affected patients
 * @param complianceViolation whether a compliance violation occurred
 * @param reportingRequired   requested reporting flag
 * @param lessonsLearned      initial lessons, usually empty
 */
public record IncidentRequest(
        ImpactLevel impact,
        Set<String> affectedSystems,
        int affectedPatients,
        boolean complianceViolation,
        boolean reportingRequired,
        List<String> lessonsLearned) {

    public IncidentRequest {
        if (impact == null) {
            throw new ValidationException("Incident impact is required");
        }
        if (affectedPatients < 0) {
            throw new ValidationException("Affected patient count cannot be negative");
        }
        affectedSystems = affectedSystems == null ? Set.of() : Set.copyOf(affectedSystems);
        lessonsLearned = lessonsLearned == null ? List.of() : List.copyOf(lessonsLearned);
    }

    public static IncidentRequest of(ImpactLevel impact, Set<String> affectedSystems, int affectedPatients) {
        return new IncidentRequest(impact, affectedSystems, affectedPatients, false, false, List.of());
    }
}
