package medguard.core.exception;

/**
 * Input was rejected: malformed permission pattern, missing mitigation trail,
 * negative duration or an illegal lifecycle transition.
 */
public class ValidationException extends SecurityCoreException {

    public ValidationException(String message) {
        super(message);
    }
}
