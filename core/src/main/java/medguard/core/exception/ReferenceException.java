package medguard.core.exception;

/**
 * A write referenced another entity that does not exist, such as escalating an
 * unknown threat into an incident. Nothing is created when this is raised.
 */
public class ReferenceException extends SecurityCoreException {

    private final String reference;

    public ReferenceException(String message, String reference) {
        super(message);
        this.reference = reference;
    }

    public String reference() {
        return reference;
    }
}
