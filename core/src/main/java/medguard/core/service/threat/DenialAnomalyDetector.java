package medguard.core.service.threat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import medguard.core.config.MedguardConfig;
import medguard.core.model.auth.AccessDecision;
import medguard.core.model.auth.DecisionReason;
import medguard.core.model.threat.ThreatReport;
import medguard.core.model.threat.ThreatSeverity;
import medguard.core.model.threat.ThreatType;

/**
 * Detects bursts of denied requests from one actor.
 *
 * <p>Denials are counted per actor in a fixed window. When an actor reaches the
 * threshold the detector returns a threat report once; further denials in the
 * same window are counted but not reported again. Denials for unknown actors are
 * reported as intrusion attempts, denials for known actors as insider threats.
 *
 * <p>Windows live in a bounded Caffeine cache that expires each entry one window
 * after it was created and holds at most {@code maxTrackedActors} entries, so a
 * stream of distinct actor ids cannot grow memory without limit. The cache ticks
 * on the injected clock.
 */
@ApplicationScoped
public class DenialAnomalyDetector {

    private static final Logger LOG = Logger.getLogger(DenialAnomalyDetector.class);

    static final String TARGET = "access-control";
    static final long DEFAULT_MAX_TRACKED_ACTORS = 10_000;

    private final boolean enabled;
    private final int threshold;
    private final Duration window;
    private final Clock clock;
    private final Cache<String, DenialWindow> windows;

    @Inject
    public DenialAnomalyDetector(MedguardConfig config) {
        this(
                config.anomaly().enabled(),
                config.anomaly().denialThreshold(),
                config.anomaly().window(),
                config.anomaly().maxTrackedActors(),
                Clock.systemUTC());
    }

    public DenialAnomalyDetector(boolean enabled, int threshold, Duration window, Clock clock) {
        this(enabled, threshold, window, DEFAULT_MAX_TRACKED_ACTORS, clock);
    }

    public DenialAnomalyDetector(
            boolean enabled, int threshold, Duration window, long maxTrackedActors, Clock clock) {
        if (threshold < 1) {
            throw new IllegalArgumentException("Denial threshold must be positive");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Denial window must be positive");
        }
        if (maxTrackedActors < 1) {
            throw new IllegalArgumentException("Max tracked actors must be positive");
        }
        this.enabled = enabled;
        this.threshold = threshold;
        this.window = window;
        this.clock = clock;
        this.windows = Caffeine.newBuilder()
                .expireAfterWrite(window)
                .maximumSize(maxTrackedActors)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Record a decision and report a threat if the actor's denials crossed the threshold.
     *
     * @param decision the decision just made
     * @return a threat report the first time the threshold is reached in a window
     */
    public Optional<ThreatReport> record(AccessDecision decision) {
        if (!enabled || decision.isAllowed()) {
            return Optional.empty();
        }

        final var actorId = decision.actorId() == null ? "unknown" : decision.actorId();
        final var counter = windows.get(actorId, k -> new DenialWindow(window));
        final var count = counter.increment(clock.instant());
        if (count != threshold) {
            return Optional.empty();
        }

        final var unknownActor = decision.reason() == DecisionReason.ACTOR_NOT_FOUND;
        LOG.warnf(
                "Actor %s reached %d denied request(s) within %s, raising %s threat",
                actorId, count, window, unknownActor ? "intrusion" : "insider");
        return Optional.of(ThreatReport.builder(
                        unknownActor ? ThreatType.INTRUSION : ThreatType.INSIDER, ThreatSeverity.HIGH)
                .source(actorId)
                .target(TARGET)
                .title("Repeated access denials for " + actorId)
                .description(String.format(
                        "%d denied request(s) within %s; last request %s denied with %s",
                        count, window, decision.permission(), decision.reason().code()))
                .build());
    }

    /**
     * Forget an actor's denial history.
     */
    public void reset(String actorId) {
        windows.invalidate(actorId);
    }

    long trackedActors() {
        windows.cleanUp();
        return windows.estimatedSize();
    }

    /**
     * Fixed window denial counter.
     */
    static class DenialWindow {
        private final Duration length;
        private Instant start;
        private int count;

        DenialWindow(Duration length) {
            this.length = length;
        }

        synchronized int increment(Instant now) {
            if (start == null || !now.isBefore(start.plus(length))) {
                start = now;
                count = 0;
            }
            count++;
            return count;
        }
    }
}
