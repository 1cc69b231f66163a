package medguard.core.model.threat;

/**
 * Categories of detected security threats.
 */
public enum ThreatType {
    MALWARE("malware"),
    PHISHING("phishing"),
    INTRUSION("intrusion"),
    DATA_BREACH("data-breach"),
    DENIAL_OF_SERVICE("denial-of-service"),
    INSIDER("insider");

    private final String code;

    ThreatType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
