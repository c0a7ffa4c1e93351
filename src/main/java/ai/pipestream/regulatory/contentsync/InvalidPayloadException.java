package ai.pipestream.regulatory.contentsync;

import ai.pipestream.regulatory.entity.DeadLetterReason;

public class InvalidPayloadException extends ContentSyncException {

    public InvalidPayloadException(String detail) {
        super(ErrorKind.PERMANENT, DeadLetterReason.INVALID_PAYLOAD, detail);
    }
}
