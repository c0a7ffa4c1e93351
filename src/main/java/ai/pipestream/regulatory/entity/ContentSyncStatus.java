package ai.pipestream.regulatory.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Queue state of a {@link ContentSyncEvent}.
 */
public enum ContentSyncStatus {
    PENDING,
    ENQUEUED,
    PROCESSING,
    DONE,
    FAILED,
    DEAD_LETTERED,
    SKIPPED;

    /**
     * States a worker may claim an event from.
     */
    public static Set<ContentSyncStatus> claimable() {
        return EnumSet.of(PENDING, ENQUEUED, FAILED);
    }

    public boolean isTerminal() {
        return this == DONE || this == DEAD_LETTERED || this == SKIPPED;
    }
}
