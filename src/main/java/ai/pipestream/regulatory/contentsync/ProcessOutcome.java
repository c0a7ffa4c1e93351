package ai.pipestream.regulatory.contentsync;

public enum ProcessOutcome {
    /** Applied to at least one content file. */
    DONE,
    /** Every target file already carried the event. */
    SKIPPED,
    /** Row missing, terminal, or claimed by another worker. */
    NOT_CLAIMED,
    /** Will be retried after backoff. */
    RETRY_SCHEDULED,
    DEAD_LETTERED
}
