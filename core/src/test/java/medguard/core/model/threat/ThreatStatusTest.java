package medguard.core.model.threat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("ThreatStatus")
class ThreatStatusTest {

    private static final Map<ThreatStatus, Set<ThreatStatus>> ALLOWED = Map.of(
            ThreatStatus.DETECTED, EnumSet.of(ThreatStatus.BLOCKED, ThreatStatus.MITIGATED),
            ThreatStatus.BLOCKED, EnumSet.of(ThreatStatus.MITIGATED),
            ThreatStatus.MITIGATED, EnumSet.of(ThreatStatus.RESOLVED),
            ThreatStatus.RESOLVED, EnumSet.noneOf(ThreatStatus.class));

    @ParameterizedTest
    @EnumSource(ThreatStatus.class)
    @DisplayName("each status should allow exactly its forward transitions")
    void shouldFollowTransitionTable(ThreatStatus from) {
        for (var to : ThreatStatus.values()) {
            assertEquals(ALLOWED.get(from).contains(to), from.canTransitionTo(to), from + " -> " + to);
        }
    }

    @ParameterizedTest
    @EnumSource(ThreatStatus.class)
    @DisplayName("no status should transition to itself")
    void shouldNotTransitionToSelf(ThreatStatus status) {
        assertFalse(status.canTransitionTo(status));
    }
}
