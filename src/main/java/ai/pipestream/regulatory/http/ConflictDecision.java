package ai.pipestream.regulatory.http;

import java.util.UUID;

public record ConflictDecision(UUID winningRuleId, String resolvedBy) {
}
