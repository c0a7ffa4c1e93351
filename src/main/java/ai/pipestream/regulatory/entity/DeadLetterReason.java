package ai.pipestream.regulatory.entity;

/**
 * Fixed triage categories for content-sync events removed from the active queue.
 */
public enum DeadLetterReason {
    UNMAPPED_CONCEPT,
    INVALID_PAYLOAD,
    MISSING_POINTERS,
    CONTENT_NOT_FOUND,
    PATCH_CONFLICT,
    REPO_WRITE_FAILED,
    DB_WRITE_FAILED
}
