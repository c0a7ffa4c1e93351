package ai.pipestream.regulatory.http;

import ai.pipestream.regulatory.entity.ConflictStatus;
import ai.pipestream.regulatory.entity.RegulatoryConflict;
import ai.pipestream.regulatory.entity.ResolutionPolicy;

import java.time.Instant;
import java.util.UUID;

public record ConflictView(UUID id, String conceptSlug, UUID ruleAId, UUID ruleBId, ConflictStatus status,
                           UUID winningRuleId, ResolutionPolicy resolutionPolicy, String escalationReason,
                           String resolvedBy, Instant createdAt, Instant resolvedAt) {

    public static ConflictView of(RegulatoryConflict c) {
        return new ConflictView(c.id, c.conceptSlug, c.ruleAId, c.ruleBId, c.status, c.winningRuleId,
                c.resolutionPolicy, c.escalationReason, c.resolvedBy, c.createdAt, c.resolvedAt);
    }
}
