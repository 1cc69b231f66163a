package medguard.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import medguard.core.model.auth.AccessDecision;
import medguard.core.model.auth.AccessMode;
import medguard.core.model.auth.ActorIdentity;
import medguard.core.model.incident.IncidentRequest;
import medguard.core.model.incident.SecurityIncident;
import medguard.core.model.metrics.SecurityMetrics;
import medguard.core.model.threat.SecurityThreat;
import medguard.core.model.threat.ThreatReport;

/**
 * The decision API: the only calls a presentation layer or HTTP handler makes into the core.
 *
 * <p>Each allow/deny decision and each state transition emits exactly one audit
 * event, and the call waits for every acknowledgement before completing. A denial
 * that pushes an actor over the anomaly threshold also opens a threat, so that
 * call emits two events: the {@code ACCESS_DENIED} event for the decision and the
 * {@code THREAT_DETECTED} event for the new threat. If the audit sink fails, the
 * call fails with {@link medguard.core.exception.AuditException} and the failed
 * transition is not committed.
 */
public interface SecurityPolicyUseCase {

    /**
     * Decide whether an actor may use a capability.
     *
     * <p>An unknown actor yields a deny with reason {@code ACTOR_NOT_FOUND}; it never fails.
     *
     * @param actorId    the actor
     * @param permission the requested capability
     * @return Uni with the decision
     */
    Uni<AccessDecision> checkAccess(String actorId, String permission);

    /**
     * Decide using identity-provider claims and an explicit mode.
     */
    Uni<AccessDecision> checkAccess(ActorIdentity identity, String permission, AccessMode mode);

    /**
     * Ingest a detected threat and apply the automatic response policy.
     *
     * @return Uni with the new threat id
     */
    Uni<String> reportThreat(ThreatReport report);

    Uni<SecurityThreat> mitigateThreat(String threatId, List<String> steps, String performedBy);

    Uni<SecurityThreat> recordMitigationStep(String threatId, String step, String performedBy);

    Uni<SecurityThreat> resolveThreat(String threatId, String performedBy);

    /**
     * Escalate a threat into an incident.
     *
     * @return Uni with the new incident id; fails with ReferenceException for an unknown threat
     */
    Uni<String> escalate(String threatId, IncidentRequest incidentData);

    Uni<SecurityIncident> resolveIncident(String incidentId, List<String> lessons, String performedBy);

    Uni<SecurityIncident> recordComplianceViolation(String incidentId, String performedBy);

    Uni<SecurityIncident> appendLesson(String incidentId, String lesson, String performedBy);

    /**
     * Recompute metrics from current state.
     */
    Uni<SecurityMetrics> snapshotMetrics();

    /**
     * Active threats, most severe first.
     */
    Uni<List<SecurityThreat>> activeThreats();

    Uni<List<SecurityIncident>> openIncidents();
}
