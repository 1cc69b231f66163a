package medguard.adapter.out.compliance;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import medguard.core.config.MedguardConfig;
import medguard.core.model.metrics.ComplianceScores;
import medguard.core.port.out.ComplianceScoreSource;

/**
 * Compliance scores read from {@code medguard.compliance.*}.
 *
 * <p>Used when no external compliance system is wired in. Values are validated
 * once at construction.
 */
@ApplicationScoped
public class ConfiguredComplianceScoreSource implements ComplianceScoreSource {

    private final ComplianceScores scores;

    @Inject
    public ConfiguredComplianceScoreSource(MedguardConfig config) {
        final var compliance = config.compliance();
        this.scores = new ComplianceScores(
                compliance.score(), compliance.audit(), compliance.dataProtection(), compliance.trainingCompletion());
    }

    @Override
    public ComplianceScores currentScores() {
        return scores;
    }
}
