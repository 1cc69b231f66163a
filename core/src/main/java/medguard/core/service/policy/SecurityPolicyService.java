package medguard.core.service.policy;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;
import java.util.function.Supplier;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import medguard.core.config.MedguardConfig;
import medguard.core.exception.AuditException;
import medguard.core.exception.NotFoundException;
import medguard.core.exception.ValidationException;
import medguard.core.model.audit.AuditEvent;
import medguard.core.model.audit.AuditEventKind;
import medguard.core.model.auth.AccessDecision;
import medguard.core.model.auth.AccessMode;
import medguard.core.model.auth.ActorIdentity;
import medguard.core.model.auth.DecisionReason;
import medguard.core.model.incident.IncidentRequest;
import medguard.core.model.incident.SecurityIncident;
import medguard.core.model.metrics.SecurityMetrics;
import medguard.core.model.permission.Permission;
import medguard.core.model.threat.SecurityThreat;
import medguard.core.model.threat.ThreatReport;
import medguard.core.port.in.AccessControlManagement;
import medguard.core.port.in.SecurityPolicyUseCase;
import medguard.core.port.out.AuditLogger;
import medguard.core.port.out.DecisionMetrics;
import medguard.core.service.auth.DefaultRoleCatalog;
import medguard.core.service.common.CommitGuard;
import medguard.core.service.incident.IncidentTracker;
import medguard.core.service.metrics.MetricsAggregator;
import medguard.core.service.threat.DenialAnomalyDetector;
import medguard.core.service.threat.ThreatEngine;

/**
 * Policy facade: the single entry point into the security core.
 *
 * <p>Every access decision and every threat or incident transition emits exactly
 * one audit event and waits for the sink's acknowledgement. For transitions the
 * wait happens under the entity's write lock, before the change is stored, so an
 * unacknowledged event leaves no trace in the stores. Decisions are never
 * returned to the caller before their event is acknowledged. A denial that raises
 * an anomaly threat is followed by that threat's own {@code THREAT_DETECTED} event
 * within the same call.
 *
 * <p>Writes run on a worker executor because they block on the acknowledgement.
 * Decisions are evaluated on the calling thread; they do no I/O apart from the
 * audit emission.
 *
 * <p>The service moves through {@code CREATED -> SERVING -> DISPOSED}. Calls made
 * outside {@code SERVING} fail with {@link IllegalStateException}.
 */
@ApplicationScoped
public class SecurityPolicyService implements SecurityPolicyUseCase {

    private static final Logger LOG = Logger.getLogger(SecurityPolicyService.class);

    static final String DETAIL_PERMISSION = "permission";
    static final String DETAIL_REASON = "reason";
    static final String DETAIL_MATCHED = "matched";
    static final String DETAIL_MODE = "mode";
    static final String DETAIL_OVERRIDE = "override";

    /**
     * Lifecycle states.
     */
    public enum State {
        CREATED,
        SERVING,
        DISPOSED
    }

    private final AccessControlManagement accessControl;
    private final ThreatEngine threats;
    private final IncidentTracker incidents;
    private final MetricsAggregator aggregator;
    private final DenialAnomalyDetector anomalies;
    private final AuditLogger auditLogger;
    private final DecisionMetrics metrics;
    private final DefaultRoleCatalog roleCatalog;
    private final Duration ackTimeout;
    private final boolean emergencyOverrideEnabled;
    private final boolean seedDefaultRoles;
    private final Executor executor;
    private final Clock clock;
    private final AtomicReference<State> state = new AtomicReference<>(State.CREATED);

    @Inject
    public SecurityPolicyService(
            AccessControlManagement accessControl,
            ThreatEngine threats,
            IncidentTracker incidents,
            MetricsAggregator aggregator,
            DenialAnomalyDetector anomalies,
            AuditLogger auditLogger,
            DecisionMetrics metrics,
            DefaultRoleCatalog roleCatalog,
            MedguardConfig config) {
        this(
                accessControl,
                threats,
                incidents,
                aggregator,
                anomalies,
                auditLogger,
                metrics,
                roleCatalog,
                config.audit().ackTimeout(),
                config.access().emergencyOverrideEnabled(),
                config.bootstrap().defaultRoles(),
                Infrastructure.getDefaultWorkerPool(),
                Clock.systemUTC());
    }

    public SecurityPolicyService(
            AccessControlManagement accessControl,
            ThreatEngine threats,
            IncidentTracker incidents,
            MetricsAggregator aggregator,
            DenialAnomalyDetector anomalies,
            AuditLogger auditLogger,
            DecisionMetrics metrics,
            DefaultRoleCatalog roleCatalog,
            Duration ackTimeout,
            boolean emergencyOverrideEnabled,
            boolean seedDefaultRoles,
            Executor executor,
            Clock clock) {
        if (ackTimeout == null || ackTimeout.isZero() || ackTimeout.isNegative()) {
            throw new IllegalArgumentException("Audit acknowledgement timeout must be positive");
        }
        this.accessControl = accessControl;
        this.threats = threats;
        this.incidents = incidents;
        this.aggregator = aggregator;
        this.anomalies = anomalies;
        this.auditLogger = auditLogger;
        this.metrics = metrics;
        this.roleCatalog = roleCatalog;
        this.ackTimeout = ackTimeout;
        this.emergencyOverrideEnabled = emergencyOverrideEnabled;
        this.seedDefaultRoles = seedDefaultRoles;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Move to {@code SERVING}, seeding the built-in roles when enabled.
     *
     * @throws IllegalStateException if the service was already started or disposed
     */
    @PostConstruct
    public void init() {
        if (!state.compareAndSet(State.CREATED, State.SERVING)) {
            throw new IllegalStateException("Security policy service cannot start from state " + state.get());
        }
        if (seedDefaultRoles && roleCatalog != null) {
            roleCatalog.seed();
        }
        LOG.infof(
                "Security policy service serving (audit sink %s, ack timeout %s, emergency override %s)",
                auditLogger.name(), ackTimeout, emergencyOverrideEnabled ? "enabled" : "disabled");
    }

    /**
     * Move to {@code DISPOSED} and release the audit sink. Idempotent.
     */
    @PreDestroy
    public void dispose() {
        final var previous = state.getAndSet(State.DISPOSED);
        if (previous == State.DISPOSED) {
            return;
        }
        auditLogger.close();
        LOG.info("Security policy service disposed");
    }

    public State state() {
        return state.get();
    }

    @Override
    public Uni<AccessDecision> checkAccess(String actorId, String permission) {
        return checkAccess(ActorIdentity.of(actorId), permission, AccessMode.STANDARD);
    }

    @Override
    public Uni<AccessDecision> checkAccess(ActorIdentity identity, String permission, AccessMode mode) {
        return Uni.createFrom()
                .item(() -> evaluate(identity, permission, mode == null ? AccessMode.STANDARD : mode))
                .call(evaluation -> audit(evaluation.event()))
                .map(Evaluation::decision)
                .invoke(metrics::recordDecision)
                .call(this::raiseAnomaly);
    }

    @Override
    public Uni<String> reportThreat(ThreatReport report) {
        return write(() -> detect(report).id());
    }

    @Override
    public Uni<SecurityThreat> mitigateThreat(String threatId, List<String> steps, String performedBy) {
        return write(() -> threats.mitigate(
                threatId,
                steps,
                "mitigated by " + actorOrSystem(performedBy),
                audited(AuditEventKind.THREAT_MITIGATED, performedBy, SecurityPolicyService::threatEvent)));
    }

    @Override
    public Uni<SecurityThreat> recordMitigationStep(String threatId, String step, String performedBy) {
        return write(() -> threats.recordStep(
                threatId,
                step,
                audited(
                        AuditEventKind.THREAT_STEP_RECORDED,
                        performedBy,
                        (builder, threat) -> threatEvent(builder, threat).detail("step", step))));
    }

    @Override
    public Uni<SecurityThreat> resolveThreat(String threatId, String performedBy) {
        return write(() -> threats.resolve(
                threatId,
                "resolved by " + actorOrSystem(performedBy),
                audited(AuditEventKind.THREAT_RESOLVED, performedBy, SecurityPolicyService::threatEvent)));
    }

    @Override
    public Uni<String> escalate(String threatId, IncidentRequest incidentData) {
        return write(() -> {
            final var incident = incidents.openIncident(
                    threatId,
                    incidentData,
                    audited(AuditEventKind.INCIDENT_OPENED, null, SecurityPolicyService::incidentEvent));
            metrics.recordIncident(incident);
            return incident.id();
        });
    }

    @Override
    public Uni<SecurityIncident> resolveIncident(String incidentId, List<String> lessons, String performedBy) {
        return write(() -> incidents.resolve(
                incidentId,
                lessons,
                audited(AuditEventKind.INCIDENT_RESOLVED, performedBy, SecurityPolicyService::incidentEvent)));
    }

    @Override
    public Uni<SecurityIncident> recordComplianceViolation(String incidentId, String performedBy) {
        return write(() -> incidents.recordComplianceViolation(
                incidentId,
                audited(
                        AuditEventKind.INCIDENT_UPDATED,
                        performedBy,
                        (builder, incident) ->
                                incidentEvent(builder, incident).detail("change", "compliance-violation"))));
    }

    @Override
    public Uni<SecurityIncident> appendLesson(String incidentId, String lesson, String performedBy) {
        return write(() -> incidents.appendLesson(
                incidentId,
                lesson,
                audited(
                        AuditEventKind.INCIDENT_UPDATED,
                        performedBy,
                        (builder, incident) -> incidentEvent(builder, incident).detail("change", "lesson"))));
    }

    @Override
    public Uni<SecurityMetrics> snapshotMetrics() {
        return read(aggregator::snapshot);
    }

    @Override
    public Uni<List<SecurityThreat>> activeThreats() {
        return read(threats::active);
    }

    @Override
    public Uni<List<SecurityIncident>> openIncidents() {
        return read(incidents::open);
    }

    private Evaluation evaluate(ActorIdentity identity, String permission, AccessMode mode) {
        requireServing();
        if (identity == null || identity.actorId() == null || identity.actorId().isBlank()) {
            throw new ValidationException("Actor identity is required");
        }
        final var requested = Permission.parse(permission);
        final var actorId = identity.actorId();
        final var overrideRequested = mode == AccessMode.EMERGENCY_OVERRIDE;
        final var effectiveMode = emergencyOverrideEnabled ? mode : AccessMode.STANDARD;

        AccessDecision decision;
        try {
            final var record = accessControl.get(actorId);
            if (identity.roleClaim().isPresent() && !identity.roleClaim().get().equals(record.roleId())) {
                LOG.warnf(
                        "Actor %s claims role %s but is assigned %s",
                        actorId, identity.roleClaim().get(), record.roleId());
                decision = AccessDecision.deny(actorId, requested.value(), DecisionReason.ROLE_CLAIM_MISMATCH);
            } else {
                decision = accessControl.authorize(actorId, requested, effectiveMode);
            }
        } catch (NotFoundException e) {
            LOG.debugf("Denying %s for unknown actor %s", requested.value(), actorId);
            decision = AccessDecision.deny(actorId, requested.value(), DecisionReason.ACTOR_NOT_FOUND);
        }

        final var builder = AuditEvent.builder(kindFor(decision), clock.instant())
                .actor(actorId)
                .target(requested.value())
                .detail(DETAIL_PERMISSION, requested.value())
                .detail(DETAIL_REASON, decision.reason().code())
                .detail(DETAIL_MODE, mode.name().toLowerCase());
        decision.matchedPattern().ifPresent(pattern -> builder.detail(DETAIL_MATCHED, pattern.value()));
        identity.roleClaim().ifPresent(claim -> builder.detail("role-claim", claim));

        if (decision.reason() == DecisionReason.EMERGENCY_OVERRIDE) {
            builder.detail(AuditEvent.MARKER, AuditEvent.EMERGENCY_OVERRIDE_MARKER);
        } else if (overrideRequested) {
            final var refusal = emergencyOverrideEnabled ? "refused:not-authorized" : "refused:disabled";
            builder.detail(DETAIL_OVERRIDE, refusal);
            LOG.warnf("Emergency override refused for actor %s on %s", actorId, requested.value());
        }
        return new Evaluation(decision, builder.build());
    }

    private static AuditEventKind kindFor(AccessDecision decision) {
        if (decision.reason() == DecisionReason.EMERGENCY_OVERRIDE) {
            return AuditEventKind.EMERGENCY_OVERRIDE_USED;
        }
        return decision.isAllowed() ? AuditEventKind.ACCESS_ALLOWED : AuditEventKind.ACCESS_DENIED;
    }

    private Uni<Void> raiseAnomaly(AccessDecision decision) {
        final var report = anomalies.record(decision);
        if (report.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        return write(() -> detect(report.get())).replaceWithVoid();
    }

    private SecurityThreat detect(ThreatReport report) {
        final var threat = threats.detect(
                report, audited(AuditEventKind.THREAT_DETECTED, null, SecurityPolicyService::threatEvent));
        metrics.recordThreat(threat);
        return threat;
    }

    /**
     * Emit an event and wait for the acknowledgement, bounded by the configured timeout.
     */
    Uni<Void> audit(AuditEvent event) {
        return Uni.createFrom()
                .deferred(() -> auditLogger.emit(event))
                .ifNoItem()
                .after(ackTimeout)
                .failWith(() -> new AuditException("Audit sink '" + auditLogger.name()
                        + "' did not acknowledge " + event.kind().code() + " within " + ackTimeout))
                .onFailure(failure -> !(failure instanceof AuditException))
                .transform(failure -> new AuditException(
                        "Audit sink '" + auditLogger.name() + "' rejected " + event.kind().code(), failure))
                .onFailure()
                .invoke(failure -> {
                    metrics.recordAuditFailure(event.kind());
                    LOG.errorf(
                            "Audit of %s for %s failed, operation aborted: %s",
                            event.kind().code(), event.targetId(), failure.getMessage());
                });
    }

    private <T> CommitGuard<T> audited(
            AuditEventKind kind, String performedBy, BiFunction<AuditEvent.Builder, T, AuditEvent.Builder> details) {
        return (previous, pending) -> {
            final var builder = AuditEvent.builder(kind, clock.instant()).actor(actorOrSystem(performedBy));
            audit(details.apply(builder, pending).build()).await().indefinitely();
        };
    }

    private static AuditEvent.Builder threatEvent(AuditEvent.Builder builder, SecurityThreat threat) {
        return builder.target(threat.id())
                .detail("type", threat.type().code())
                .detail("severity", threat.severity().name().toLowerCase())
                .detail("status", threat.status().name().toLowerCase())
                .detail("source", threat.sourceId())
                .detail("patient-data-at-risk", threat.patientDataAtRisk())
                .detail("mitigation-steps", threat.mitigationSteps().size());
    }

    private static AuditEvent.Builder incidentEvent(AuditEvent.Builder builder, SecurityIncident incident) {
        return builder.target(incident.id())
                .detail("threat", incident.threatId())
                .detail("impact", incident.impact().name().toLowerCase())
                .detail("affected-patients", incident.affectedPatients())
                .detail("compliance-violation", incident.complianceViolation())
                .detail("reporting-required", incident.reportingRequired())
                .detail("status", incident.status().name().toLowerCase());
    }

    private <T> Uni<T> write(Supplier<T> operation) {
        return Uni.createFrom()
                .item(() -> {
                    requireServing();
                    return operation.get();
                })
                .runSubscriptionOn(executor);
    }

    private <T> Uni<T> read(Supplier<T> query) {
        return Uni.createFrom().item(() -> {
            requireServing();
            return query.get();
        });
    }

    private void requireServing() {
        final var current = state.get();
        if (current != State.SERVING) {
            throw new IllegalStateException("Security policy service is not serving (state " + current + ")");
        }
    }

    private static String actorOrSystem(String performedBy) {
        return performedBy == null || performedBy.isBlank() ? AuditEvent.SYSTEM_ACTOR : performedBy;
    }

    private record Evaluation(AccessDecision decision, AuditEvent event) {}
}
