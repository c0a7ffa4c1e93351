package ai.pipestream.regulatory.contentsync;

import ai.pipestream.regulatory.entity.ContentSyncEventType;
import ai.pipestream.regulatory.util.ContentHashing;

import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * Deterministic content-sync event ids.
 * <p>
 * The id is the SHA-256 of {@code ruleId|type|effectiveFrom} with the date in
 * ISO form, or empty when absent. Never generate these randomly: re-emitting a
 * logical change must produce the same id.
 */
public final class ContentSyncEventIds {

    private ContentSyncEventIds() {
    }

    public static String eventId(UUID ruleId, ContentSyncEventType type, LocalDate effectiveFrom) {
        Objects.requireNonNull(ruleId, "ruleId");
        Objects.requireNonNull(type, "type");
        return ContentHashing.compositeKeyHash(ruleId, type.name(),
                effectiveFrom == null ? "" : effectiveFrom.toString());
    }
}
