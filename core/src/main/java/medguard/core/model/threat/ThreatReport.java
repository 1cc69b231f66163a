package medguard.core.model.threat;

import medguard.core.exception.ValidationException;

/**
 * Input describing a newly detected threat.
 *
 * @param type                the threat category
 * @param severity            the assessed severity
 * @param sourceId            where the threat originates (actor, host, address)
 * @param targetId            the system or resource targeted
 * @param title               short headline
 * @param description         free-text description
 * @param protectedDataInvolved whether protected medical data is implicated
 * @param patientDataAtRisk   whether patient data is at risk
 */
public record ThreatReport(
        ThreatType type,
        ThreatSeverity severity,
        String sourceId,
        String targetId,
        String title,
        String description,
        boolean protectedDataInvolved,
        boolean patientDataAtRisk) {

    public ThreatReport {
        if (type == null) {
            throw new ValidationException("Threat type is required");
        }
        if (severity == null) {
            throw new ValidationException("Threat severity is required");
        }
        if (sourceId == null || sourceId.isBlank()) {
            throw new ValidationException("Threat source is required");
        }
        if (targetId == null || targetId.isBlank()) {
            throw new ValidationException("Threat target is required");
        }
        if (title == null || title.isBlank()) {
            title = type.code() + " from " + sourceId;
        }
        if (description == null) {
            description = "";
        }
    }

    public static Builder builder(ThreatType type, ThreatSeverity severity) {
        return new Builder(type, severity);
    }

    public static class Builder {
        private final ThreatType type;
        private final ThreatSeverity severity;
        private String sourceId;
        private String targetId;
        private String title;
        private String description;
        private boolean protectedDataInvolved;
        private boolean patientDataAtRisk;

        private Builder(ThreatType type, ThreatSeverity severity) {
            this.type = type;
            this.severity = severity;
        }

        public Builder source(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder target(String targetId) {
            this.targetId = targetId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder protectedDataInvolved(boolean protectedDataInvolved) {
            this.protectedDataInvolved = protectedDataInvolved;
            return this;
        }

        public Builder patientDataAtRisk(boolean patientDataAtRisk) {
            this.patientDataAtRisk = patientDataAtRisk;
            return this;
        }

        public ThreatReport build() {
            return new ThreatReport(
                    type,
                    severity,
                    sourceId,
                    targetId,
                    title,
                    description,
                    protectedDataInvolved,
                    patientDataAtRisk);
        }
    }
}
