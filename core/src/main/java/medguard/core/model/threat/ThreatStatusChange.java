package medguard.core.model.threat;

import java.time.Instant;

/**
 * One entry in a threat's append-only status history.
 *
 * @param status the status entered
 * @param at     when it was entered
 * @param note   short free-text note (policy reason, operator, etc.)
 */
public record ThreatStatusChange(ThreatStatus status, Instant at, String note) {

    public ThreatStatusChange {
        if (note == null) {
            note = "";
        }
    }
}
