package medguard.core.exception;

/**
 * Base type for failures raised by the access-control and threat lifecycle core.
 *
 * <p>All subtypes are unchecked. Asynchronous entry points fail their {@code Uni}
 * with these exceptions rather than throwing them.
 */
public abstract class SecurityCoreException extends RuntimeException {

    protected SecurityCoreException(String message) {
        super(message);
    }

    protected SecurityCoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
