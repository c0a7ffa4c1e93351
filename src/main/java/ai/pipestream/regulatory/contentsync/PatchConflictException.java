package ai.pipestream.regulatory.contentsync;

import ai.pipestream.regulatory.entity.DeadLetterReason;

public class PatchConflictException extends ContentSyncException {

    public PatchConflictException(String path, String eventId) {
        super(ErrorKind.PERMANENT, DeadLetterReason.PATCH_CONFLICT, "Content file " + path + " already carries event " + eventId);
    }
}
