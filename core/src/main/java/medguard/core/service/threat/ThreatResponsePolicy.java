package medguard.core.service.threat;

import jakarta.enterprise.context.ApplicationScoped;

import medguard.core.model.threat.ThreatReport;
import medguard.core.model.threat.ThreatSeverity;

/**
 * Automatic response applied when a threat is detected.
 *
 * <p>A threat is blocked immediately when it is critical or puts patient data at
 * risk. Everything else stays detected until someone mitigates it.
 */
@ApplicationScoped
public class ThreatResponsePolicy {

    /**
     * Decide whether a freshly detected threat is blocked on detection.
     *
     * @param report the detection report
     * @return true if the threat must be blocked immediately
     */
    public boolean shouldBlock(ThreatReport report) {
        if (report.patientDataAtRisk()) {
            return true;
        }
        return blocksAutomatically(report.severity());
    }

    private boolean blocksAutomatically(ThreatSeverity severity) {
        return switch (severity) {
            case CRITICAL -> true;
            case HIGH, MEDIUM, LOW -> false;
        };
    }

    /**
     * Note recorded in the status history when a threat is auto-blocked.
     */
    public String blockNote(ThreatReport report) {
        if (report.severity() == ThreatSeverity.CRITICAL && report.patientDataAtRisk()) {
            return "auto-blocked: critical severity with patient data at risk";
        }
        if (report.patientDataAtRisk()) {
            return "auto-blocked: patient data at risk";
        }
        return "auto-blocked: critical severity";
    }
}
