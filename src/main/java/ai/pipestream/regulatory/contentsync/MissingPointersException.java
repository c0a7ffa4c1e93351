package ai.pipestream.regulatory.contentsync;

import ai.pipestream.regulatory.entity.DeadLetterReason;

public class MissingPointersException extends ContentSyncException {

    public MissingPointersException(String eventId) {
        super(ErrorKind.PERMANENT, DeadLetterReason.MISSING_POINTERS, "Event " + eventId + " carries no source pointers");
    }
}
