package ai.pipestream.regulatory.exception;

/**
 * Base exception for all pipeline operations.
 * Carries a stable error code and the operation that failed.
 */
public class RegulatoryException extends RuntimeException {

    private final String errorCode;
    private final String operation;

    public RegulatoryException(String errorCode, String operation, String message) {
        super(String.format("[%s] %s: %s", errorCode, operation, message));
        this.errorCode = errorCode;
        this.operation = operation;
    }

    public RegulatoryException(String errorCode, String operation, String message, Throwable cause) {
        super(String.format("[%s] %s: %s", errorCode, operation, message), cause);
        this.errorCode = errorCode;
        this.operation = operation;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getOperation() {
        return operation;
    }
}
