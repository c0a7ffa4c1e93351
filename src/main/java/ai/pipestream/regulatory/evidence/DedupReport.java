package ai.pipestream.regulatory.evidence;

/**
 * Outcome of one deduplication pass. {@code remainingDuplicateGroups} comes
 * from a fresh query after all groups were merged and must be zero.
 */
public record DedupReport(int duplicateGroups,
                          int rowsMerged,
                          int pointersMigrated,
                          int agentRunsMigrated,
                          long remainingDuplicateGroups) {

    public boolean clean() {
        return remainingDuplicateGroups == 0;
    }
}
