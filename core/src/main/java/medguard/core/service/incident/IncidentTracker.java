package medguard.core.service.incident;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import medguard.core.exception.NotFoundException;
import medguard.core.exception.ReferenceException;
import medguard.core.exception.ValidationException;
import medguard.core.model.incident.IncidentRequest;
import medguard.core.model.incident.SecurityIncident;
import medguard.core.model.threat.SecurityThreat;
import medguard.core.port.out.IncidentRepository;
import medguard.core.service.common.CommitGuard;
import medguard.core.service.common.IdentifierGenerator;
import medguard.core.service.common.KeyedLocks;
import medguard.core.service.threat.ThreatEngine;

/**
 * Owns security incidents escalated from threats.
 *
 * <p>Operations that read the originating threat take the threat lock before the
 * incident lock. Durations are measured from the threat's detection timestamp.
 */
@ApplicationScoped
public class IncidentTracker {

    private static final Logger LOG = Logger.getLogger(IncidentTracker.class);

    private static final Comparator<SecurityIncident> BY_OPENED =
            Comparator.comparing(SecurityIncident::openedAt).thenComparing(SecurityIncident::id);

    private final IncidentRepository repository;
    private final ThreatEngine threats;
    private final IdentifierGenerator ids;
    private final Clock clock;
    private final KeyedLocks locks = new KeyedLocks("incident");

    @Inject
    public IncidentTracker(IncidentRepository repository, ThreatEngine threats, IdentifierGenerator ids) {
        this(repository, threats, ids, Clock.systemUTC());
    }

    public IncidentTracker(
            IncidentRepository repository, ThreatEngine threats, IdentifierGenerator ids, Clock clock) {
        this.repository = repository;
        this.threats = threats;
        this.ids = ids;
        this.clock = clock;
    }

    /**
     * Escalate a threat into a new incident.
     *
     * @param threatId the originating threat
     * @param request  impact, affected systems and patients, flags
     * @param guard    run before the incident is stored
     * @return the stored incident
     * @throws ReferenceException  if the threat does not exist; nothing is stored
     * @throws ValidationException if the request is missing or the durations would be negative
     */
    public SecurityIncident openIncident(
            String threatId, IncidentRequest request, CommitGuard<SecurityIncident> guard) {
        if (request == null) {
            throw new ValidationException("Incident data is required");
        }
        if (threatId == null || threatId.isBlank()) {
            throw new ReferenceException("Cannot escalate without a threat reference", threatId);
        }
        return threats.withThreatLock(threatId, () -> {
            final var threat = threats.find(threatId)
                    .orElseThrow(() -> new ReferenceException(
                            "Cannot escalate unknown threat '" + threatId + "'", threatId));
            final var id = ids.incidentId();
            return locks.withLock(id, () -> {
                final var incident =
                        SecurityIncident.open(id, threatId, threat.detectedAt(), request, clock.instant());
                guard.beforeCommit(null, incident);
                repository.save(incident);
                LOG.infof(
                        "Incident %s opened for threat %s (impact %s, %d patient(s), reporting %s)",
                        id, threatId, incident.impact(), incident.affectedPatients(), incident.reportingRequired());
                return incident;
            });
        });
    }

    /**
     * Set the resolution fields of an open incident.
     *
     * @throws NotFoundException   if the incident does not exist
     * @throws ValidationException if it is already resolved
     */
    public SecurityIncident resolve(String incidentId, List<String> lessons, CommitGuard<SecurityIncident> guard) {
        return update(
                incidentId,
                guard,
                (current, threat) -> current.resolve(threat.detectedAt(), clock.instant(), lessons));
    }

    /**
     * Flag a compliance violation on an open incident, forcing reporting.
     *
     * @throws NotFoundException   if the incident does not exist
     * @throws ValidationException if it is already resolved
     */
    public SecurityIncident recordComplianceViolation(String incidentId, CommitGuard<SecurityIncident> guard) {
        return update(incidentId, guard, (current, threat) -> current.withComplianceViolation());
    }

    /**
     * Append a lesson, before or after resolution.
     *
     * @throws NotFoundException   if the incident does not exist
     * @throws ValidationException if the lesson is blank
     */
    public SecurityIncident appendLesson(String incidentId, String lesson, CommitGuard<SecurityIncident> guard) {
        return update(incidentId, guard, (current, threat) -> current.withLesson(lesson));
    }

    public Optional<SecurityIncident> find(String incidentId) {
        if (incidentId == null) {
            return Optional.empty();
        }
        return repository.findById(incidentId);
    }

    /**
     * @throws NotFoundException if the incident does not exist
     */
    public SecurityIncident get(String incidentId) {
        return find(incidentId).orElseThrow(() -> new NotFoundException("Incident", incidentId));
    }

    public List<SecurityIncident> list() {
        return repository.findAll().stream().sorted(BY_OPENED).toList();
    }

    public List<SecurityIncident> open() {
        return repository.findAll().stream()
                .filter(incident -> !incident.isResolved())
                .sorted(BY_OPENED)
                .toList();
    }

    public List<SecurityIncident> byThreat(String threatId) {
        return repository.findByThreatId(threatId).stream().sorted(BY_OPENED).toList();
    }

    private SecurityIncident update(
            String incidentId,
            CommitGuard<SecurityIncident> guard,
            BiFunction<SecurityIncident, SecurityThreat, SecurityIncident> change) {
        final var threatId = get(incidentId).threatId();
        return threats.withThreatLock(threatId, () -> locks.withLock(incidentId, () -> {
            final var current = get(incidentId);
            final var threat = threats.find(threatId)
                    .orElseThrow(() -> new ReferenceException(
                            "Incident '" + incidentId + "' references unknown threat '" + threatId + "'", threatId));
            final var updated = change.apply(current, threat);
            guard.beforeCommit(current, updated);
            repository.save(updated);
            LOG.infof("Incident %s updated (status %s)", incidentId, updated.status());
            return updated;
        }));
    }
}
