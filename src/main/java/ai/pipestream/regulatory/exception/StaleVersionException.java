package ai.pipestream.regulatory.exception;

/**
 * A compare-and-set update read a version that another writer has already moved past.
 */
public class StaleVersionException extends RegulatoryException {

    public static final String CODE = "STALE_VERSION";

    public StaleVersionException(String entityType, Object id, long expectedVersion) {
        super(CODE, "update" + entityType,
                String.format("%s %s is no longer at version %d", entityType, id, expectedVersion));
    }
}
