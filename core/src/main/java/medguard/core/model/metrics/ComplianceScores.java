package medguard.core.model.metrics;

import medguard.core.exception.ValidationException;

/**
 * Percentage scores supplied by the external compliance source.
 *
 * @param compliance         overall regulatory compliance score
 * @param audit              audit readiness score
 * @param dataProtection     data protection score
 * @param trainingCompletion staff security training completion
 */
public record ComplianceScores(double compliance, double audit, double dataProtection, double trainingCompletion) {

    public ComplianceScores {
        requirePercentage("compliance", compliance);
        requirePercentage("audit", audit);
        requirePercentage("dataProtection", dataProtection);
        requirePercentage("trainingCompletion", trainingCompletion);
    }

    public static ComplianceScores none() {
        return new ComplianceScores(0, 0, 0, 0);
    }

    private static void requirePercentage(String name, double value) {
        if (Double.isNaN(value) || value < 0 || value > 100) {
            throw new ValidationException(name + " score must be between 0 and 100, got " + value);
        }
    }
}
