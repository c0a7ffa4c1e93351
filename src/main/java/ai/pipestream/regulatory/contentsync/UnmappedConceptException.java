package ai.pipestream.regulatory.contentsync;

import ai.pipestream.regulatory.entity.DeadLetterReason;

public class UnmappedConceptException extends ContentSyncException {

    public UnmappedConceptException(String conceptSlug) {
        super(ErrorKind.PERMANENT, DeadLetterReason.UNMAPPED_CONCEPT, "No content files registered for concept " + conceptSlug);
    }
}
