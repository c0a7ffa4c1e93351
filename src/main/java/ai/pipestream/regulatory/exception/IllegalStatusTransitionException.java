package ai.pipestream.regulatory.exception;

import ai.pipestream.regulatory.entity.RuleStatus;

import java.util.UUID;

/**
 * Thrown when a rule status change is not in the transition table.
 */
public class IllegalStatusTransitionException extends RegulatoryException {

    public static final String CODE = "ILLEGAL_TRANSITION";

    public IllegalStatusTransitionException(UUID ruleId, RuleStatus from, RuleStatus to) {
        super(CODE, "transition",
                String.format("Rule %s cannot move from %s to %s", ruleId, from, to));
    }

    public IllegalStatusTransitionException(UUID ruleId, String reason) {
        super(CODE, "transition", String.format("Rule %s: %s", ruleId, reason));
    }
}
