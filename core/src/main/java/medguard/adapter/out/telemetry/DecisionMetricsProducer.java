package medguard.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.MeterRegistry;
import org.jboss.logging.Logger;

import medguard.core.port.out.DecisionMetrics;

/**
 * Produces Micrometer-backed metrics when a registry bean exists, no-op metrics otherwise.
 */
@ApplicationScoped
public class DecisionMetricsProducer {

    private static final Logger LOG = Logger.getLogger(DecisionMetricsProducer.class);

    private final Instance<MeterRegistry> registries;

    @Inject
    public DecisionMetricsProducer(Instance<MeterRegistry> registries) {
        this.registries = registries;
    }

    @Produces
    @ApplicationScoped
    public DecisionMetrics decisionMetrics() {
        if (registries.isResolvable()) {
            return new MicrometerDecisionMetrics(registries.get());
        }
        LOG.info("No meter registry available, decision metrics disabled");
        return NoopDecisionMetrics.INSTANCE;
    }
}
