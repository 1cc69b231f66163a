package medguard.core.model.audit;

/**
 * Kinds of audit events emitted by the policy facade.
 */
public enum AuditEventKind {
    ACCESS_ALLOWED("access.allowed"),
    ACCESS_DENIED("access.denied"),
    EMERGENCY_OVERRIDE_USED("access.emergency_override"),
    THREAT_DETECTED("threat.detected"),
    THREAT_MITIGATED("threat.mitigated"),
    THREAT_STEP_RECORDED("threat.step_recorded"),
    THREAT_RESOLVED("threat.resolved"),
    INCIDENT_OPENED("incident.opened"),
    INCIDENT_UPDATED("incident.updated"),
    INCIDENT_RESOLVED("incident.resolved");

    private final String code;

    AuditEventKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
