package medguard.core.port.out;

import medguard.core.model.metrics.ComplianceScores;

/**
 * Port to the external source of compliance and training scores.
 *
 * <p>Scores are opaque inputs; the core never computes them.
 */
@FunctionalInterface
public interface ComplianceScoreSource {

    ComplianceScores currentScores();
}
