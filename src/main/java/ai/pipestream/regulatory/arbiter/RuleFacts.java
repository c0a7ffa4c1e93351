package ai.pipestream.regulatory.arbiter;

import ai.pipestream.regulatory.entity.AuthorityLevel;
import ai.pipestream.regulatory.entity.RegulatoryRule;

import java.time.LocalDate;
import java.util.UUID;

/**
 * The fields of a rule that conflict resolution looks at.
 */
public record RuleFacts(UUID ruleId, AuthorityLevel authority, LocalDate effectiveFrom, double confidence) {

    public static RuleFacts of(RegulatoryRule rule) {
        return new RuleFacts(rule.id, rule.authorityLevel, rule.effectiveFrom, rule.confidence);
    }
}
