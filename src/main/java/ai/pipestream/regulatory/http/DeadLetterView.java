package ai.pipestream.regulatory.http;

import ai.pipestream.regulatory.entity.ContentSyncEvent;
import ai.pipestream.regulatory.entity.ContentSyncEventType;
import ai.pipestream.regulatory.entity.DeadLetterReason;

import java.time.Instant;
import java.util.UUID;

public record DeadLetterView(String eventId, long version, UUID ruleId, ContentSyncEventType type, String conceptSlug,
                             int attempts, DeadLetterReason reason, String note, Instant processedAt) {

    public static DeadLetterView of(ContentSyncEvent e) {
        return new DeadLetterView(e.eventId, e.lockVersion, e.ruleId, e.type, e.conceptSlug, e.attempts,
                e.deadLetterReason, e.deadLetterNote, e.processedAt);
    }
}
