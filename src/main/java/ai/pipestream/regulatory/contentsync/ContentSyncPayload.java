package ai.pipestream.regulatory.contentsync;

import ai.pipestream.regulatory.entity.ContentSyncEventType;
import ai.pipestream.regulatory.entity.RiskTier;
import ai.pipestream.regulatory.entity.ValueType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Snapshot of the rule change stored with the queue row, so the worker never
 * depends on the rule's current state.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContentSyncPayload(int schemaVersion,
                                 String eventId,
                                 ContentSyncEventType type,
                                 UUID ruleId,
                                 String conceptSlug,
                                 String title,
                                 String value,
                                 ValueType valueType,
                                 RiskTier riskTier,
                                 LocalDate effectiveFrom,
                                 LocalDate effectiveUntil,
                                 double confidence,
                                 List<UUID> sourcePointerIds,
                                 UUID supersededByRuleId,
                                 String note,
                                 Instant occurredAt) {

    public static final int SCHEMA_VERSION = 1;
}
