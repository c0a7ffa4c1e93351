package ai.pipestream.regulatory.http;

import ai.pipestream.regulatory.entity.RegulatoryRule;
import ai.pipestream.regulatory.entity.RiskTier;
import ai.pipestream.regulatory.entity.RuleStatus;
import ai.pipestream.regulatory.entity.ValueType;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record RuleView(UUID id,
                       String conceptSlug,
                       String title,
                       String value,
                       ValueType valueType,
                       RiskTier riskTier,
                       RuleStatus status,
                       LocalDate effectiveFrom,
                       LocalDate effectiveUntil,
                       double confidence,
                       List<UUID> sourcePointerIds) {

    public static RuleView of(RegulatoryRule rule) {
        return new RuleView(rule.id, rule.conceptSlug, rule.title, rule.value, rule.valueType, rule.riskTier,
                rule.status, rule.effectiveFrom, rule.effectiveUntil, rule.confidence,
                rule.sourcePointers.stream().map(p -> p.id).toList());
    }
}
