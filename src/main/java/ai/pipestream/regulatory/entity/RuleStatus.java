package ai.pipestream.regulatory.entity;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a {@link RegulatoryRule}.
 * <p>
 * Forward moves are listed in a single transition table. The only backward
 * move is {@link #canResetToDraft()}, used when supporting evidence is
 * invalidated.
 */
public enum RuleStatus {
    DRAFT,
    PENDING_REVIEW,
    APPROVED,
    PUBLISHED,
    REJECTED,
    SUPERSEDED;

    private static final Map<RuleStatus, Set<RuleStatus>> TRANSITIONS = Map.of(
            DRAFT, EnumSet.of(PENDING_REVIEW, REJECTED),
            PENDING_REVIEW, EnumSet.of(APPROVED, REJECTED),
            APPROVED, EnumSet.of(PUBLISHED, REJECTED),
            PUBLISHED, EnumSet.of(SUPERSEDED),
            REJECTED, EnumSet.noneOf(RuleStatus.class),
            SUPERSEDED, EnumSet.noneOf(RuleStatus.class));

    public boolean canTransitionTo(RuleStatus target) {
        return target != null && TRANSITIONS.get(this).contains(target);
    }

    public Set<RuleStatus> allowedTargets() {
        return EnumSet.copyOf(TRANSITIONS.get(this));
    }

    public boolean canResetToDraft() {
        return this == PENDING_REVIEW || this == APPROVED || this == PUBLISHED;
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /**
     * Statuses in which a rule still takes part in conflict detection.
     */
    public static Set<RuleStatus> live() {
        return EnumSet.of(DRAFT, PENDING_REVIEW, APPROVED, PUBLISHED);
    }
}
