package ai.pipestream.regulatory.contentsync;

import ai.pipestream.regulatory.entity.DeadLetterReason;

/**
 * The content store could not be written. Retried.
 */
public class RepoWriteFailedException extends ContentSyncException {

    public RepoWriteFailedException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT, DeadLetterReason.REPO_WRITE_FAILED, message, cause);
    }
}
