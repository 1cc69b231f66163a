package medguard.core.service.threat;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import medguard.core.exception.NotFoundException;
import medguard.core.exception.ValidationException;
import medguard.core.model.threat.SecurityThreat;
import medguard.core.model.threat.ThreatReport;
import medguard.core.model.threat.ThreatSeverity;
import medguard.core.model.threat.ThreatStatus;
import medguard.core.port.out.ThreatRepository;
import medguard.core.service.common.CommitGuard;
import medguard.core.service.common.IdentifierGenerator;
import medguard.core.service.common.KeyedLocks;

/**
 * Owns security threats and drives their lifecycle.
 *
 * <p>Every write is computed from the stored version under the threat's lock, handed
 * to the caller's {@link CommitGuard}, and stored only if the guard returns normally.
 * Reads never lock and always see a complete threat.
 *
 * <p>The blocked count is derived from each threat's status history on every read.
 */
@ApplicationScoped
public class ThreatEngine {

    private static final Logger LOG = Logger.getLogger(ThreatEngine.class);

    /** Most severe first, then oldest first. */
    public static final Comparator<SecurityThreat> BY_SEVERITY =
            Comparator.comparing(SecurityThreat::severity, Comparator.reverseOrder())
                    .thenComparing(SecurityThreat::detectedAt)
                    .thenComparing(SecurityThreat::id);

    private final ThreatRepository repository;
    private final ThreatResponsePolicy policy;
    private final IdentifierGenerator ids;
    private final Clock clock;
    private final KeyedLocks locks = new KeyedLocks("threat");

    @Inject
    public ThreatEngine(ThreatRepository repository, ThreatResponsePolicy policy, IdentifierGenerator ids) {
        this(repository, policy, ids, Clock.systemUTC());
    }

    public ThreatEngine(
            ThreatRepository repository, ThreatResponsePolicy policy, IdentifierGenerator ids, Clock clock) {
        this.repository = repository;
        this.policy = policy;
        this.ids = ids;
        this.clock = clock;
    }

    /**
     * Record a detected threat and apply the automatic response policy.
     *
     * @param report the detection report
     * @param guard  run before the new threat is stored
     * @return the stored threat, already blocked if the policy demanded it
     */
    public SecurityThreat detect(ThreatReport report, CommitGuard<SecurityThreat> guard) {
        if (report == null) {
            throw new ValidationException("Threat report is required");
        }
        final var id = ids.threatId();
        return locks.withLock(id, () -> {
            final var now = clock.instant();
            var threat = SecurityThreat.detect(id, report, now);
            if (policy.shouldBlock(report)) {
                threat = threat.block(now, policy.blockNote(report));
            }
            guard.beforeCommit(null, threat);
            repository.save(threat);
            if (threat.status() == ThreatStatus.BLOCKED) {
                LOG.warnf(
                        "Threat %s (%s, %s) from %s blocked on detection",
                        id, report.type().code(), report.severity(), report.sourceId());
            } else {
                LOG.infof(
                        "Threat %s (%s, %s) from %s detected",
                        id, report.type().code(), report.severity(), report.sourceId());
            }
            return threat;
        });
    }

    /**
     * Move a threat to mitigated.
     *
     * @param threatId the threat
     * @param steps    remediation steps taken, appended to any already recorded
     * @param note     history note
     * @param guard    run before the change is stored
     * @throws NotFoundException   if the threat does not exist
     * @throws ValidationException if the threat is resolved or already mitigated
     */
    public SecurityThreat mitigate(
            String threatId, List<String> steps, String note, CommitGuard<SecurityThreat> guard) {
        return update(threatId, guard, current -> current.mitigate(steps, clock.instant(), note));
    }

    /**
     * Append a remediation step without changing status.
     *
     * @throws NotFoundException   if the threat does not exist
     * @throws ValidationException if the threat is resolved or the step is blank
     */
    public SecurityThreat recordStep(String threatId, String step, CommitGuard<SecurityThreat> guard) {
        return update(threatId, guard, current -> current.withMitigationStep(step));
    }

    /**
     * Resolve a mitigated threat.
     *
     * @throws NotFoundException   if the threat does not exist
     * @throws ValidationException if the threat is not mitigated or has no steps
     */
    public SecurityThreat resolve(String threatId, String note, CommitGuard<SecurityThreat> guard) {
        return update(threatId, guard, current -> current.resolve(clock.instant(), note));
    }

    /**
     * Run an action holding a threat's write lock.
     *
     * <p>Callers that go on to lock other entities must take this lock first.
     */
    public <T> T withThreatLock(String threatId, Supplier<T> action) {
        return locks.withLock(threatId, action);
    }

    public Optional<SecurityThreat> find(String threatId) {
        if (threatId == null) {
            return Optional.empty();
        }
        return repository.findById(threatId);
    }

    /**
     * @throws NotFoundException if the threat does not exist
     */
    public SecurityThreat get(String threatId) {
        return find(threatId).orElseThrow(() -> new NotFoundException("Threat", threatId));
    }

    public List<SecurityThreat> list() {
        return repository.findAll().stream().sorted(BY_SEVERITY).toList();
    }

    public List<SecurityThreat> listByStatus(ThreatStatus status) {
        return repository.findAll().stream()
                .filter(threat -> threat.status() == status)
                .sorted(BY_SEVERITY)
                .toList();
    }

    /**
     * Threats at or above a severity.
     */
    public List<SecurityThreat> listBySeverity(ThreatSeverity minimum) {
        return repository.findAll().stream()
                .filter(threat -> threat.severity().isAtLeast(minimum))
                .sorted(BY_SEVERITY)
                .toList();
    }

    public List<SecurityThreat> active() {
        return repository.findAll().stream()
                .filter(SecurityThreat::isActive)
                .sorted(BY_SEVERITY)
                .toList();
    }

    /**
     * Number of threats that were blocked at any point.
     */
    public long blockedCount() {
        return repository.findAll().stream().filter(SecurityThreat::wasBlocked).count();
    }

    private SecurityThreat update(
            String threatId, CommitGuard<SecurityThreat> guard, UnaryOperator<SecurityThreat> change) {
        return locks.withLock(threatId, () -> {
            final var current = get(threatId);
            final var updated = change.apply(current);
            guard.beforeCommit(current, updated);
            repository.save(updated);
            LOG.infof(
                    "Threat %s now %s with %d mitigation step(s)",
                    threatId, updated.status(), updated.mitigationSteps().size());
            return updated;
        });
    }
}
