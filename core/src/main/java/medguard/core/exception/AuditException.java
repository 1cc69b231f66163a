package medguard.core.exception;

/**
 * The audit sink was unavailable, rejected an event or did not acknowledge it in time.
 *
 * <p>The operation that produced the event is aborted: no decision is returned and
 * no state change is committed.
 */
public class AuditException extends SecurityCoreException {

    public AuditException(String message) {
        super(message);
    }

    public AuditException(String message, Throwable cause) {
        super(message, cause);
    }
}
