package ai.pipestream.regulatory.contentsync;

import ai.pipestream.regulatory.entity.DeadLetterReason;

/**
 * Failure while applying a content-sync event.
 * <p>
 * {@link ErrorKind#PERMANENT} failures are dead-lettered at once;
 * {@link ErrorKind#TRANSIENT} failures are retried with backoff until the attempt limit.
 */
public class ContentSyncException extends RuntimeException {

    public enum ErrorKind {
        PERMANENT,
        TRANSIENT
    }

    private final ErrorKind kind;
    private final DeadLetterReason reason;

    public ContentSyncException(ErrorKind kind, DeadLetterReason reason, String message) {
        super(message);
        this.kind = kind;
        this.reason = reason;
    }

    public ContentSyncException(ErrorKind kind, DeadLetterReason reason, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.reason = reason;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public DeadLetterReason getReason() {
        return reason;
    }

    public boolean isPermanent() {
        return kind == ErrorKind.PERMANENT;
    }
}
