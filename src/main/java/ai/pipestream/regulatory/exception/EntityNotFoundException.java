package ai.pipestream.regulatory.exception;

/**
 * Thrown when a requested entity cannot be found.
 */
public class EntityNotFoundException extends RegulatoryException {

    public static final String CODE = "NOT_FOUND";

    public EntityNotFoundException(String entityType, Object id) {
        super(CODE, "find" + entityType, String.format("%s not found: %s", entityType, id));
    }

    public static EntityNotFoundException rule(Object id) {
        return new EntityNotFoundException("Rule", id);
    }

    public static EntityNotFoundException conflict(Object id) {
        return new EntityNotFoundException("Conflict", id);
    }

    public static EntityNotFoundException release(Object version) {
        return new EntityNotFoundException("Release", version);
    }

    public static EntityNotFoundException evidence(Object id) {
        return new EntityNotFoundException("Evidence", id);
    }
}
