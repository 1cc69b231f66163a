package medguard.core.exception;

/**
 * Lookup of an actor, role, threat or incident by id found nothing.
 */
public class NotFoundException extends SecurityCoreException {

    private final String entityType;
    private final String entityId;

    public NotFoundException(String entityType, String entityId) {
        super(entityType + " '" + entityId + "' not found");
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public String entityType() {
        return entityType;
    }

    public String entityId() {
        return entityId;
    }
}
