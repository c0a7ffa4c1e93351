package ai.pipestream.regulatory.contentsync;

import ai.pipestream.regulatory.entity.DeadLetterReason;

/**
 * A database write failed while processing an event. Retried.
 */
public class DbWriteFailedException extends ContentSyncException {

    public DbWriteFailedException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT, DeadLetterReason.DB_WRITE_FAILED, message, cause);
    }
}
