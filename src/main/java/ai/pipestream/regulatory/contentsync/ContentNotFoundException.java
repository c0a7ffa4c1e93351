package ai.pipestream.regulatory.contentsync;

import ai.pipestream.regulatory.entity.DeadLetterReason;

public class ContentNotFoundException extends ContentSyncException {

    public ContentNotFoundException(String path) {
        super(ErrorKind.PERMANENT, DeadLetterReason.CONTENT_NOT_FOUND, "Content file not found: " + path);
    }
}
