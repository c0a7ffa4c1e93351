package ai.pipestream.regulatory.contentsync;

/**
 * Downstream content store that rule changes are written into.
 */
public interface ContentTarget {

    /**
     * Appends a changelog entry for the event to one content file.
     *
     * @throws PatchConflictException   when the file already carries the event
     * @throws ContentNotFoundException when the file does not exist
     * @throws RepoWriteFailedException on I/O errors
     */
    void applyChangelog(String relativePath, ContentSyncPayload payload);
}
