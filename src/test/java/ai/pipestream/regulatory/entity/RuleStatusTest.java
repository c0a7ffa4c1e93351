package ai.pipestream.regulatory.entity;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RuleStatusTest {

    @Test
    void testForwardTransitions() {
        assertTrue(RuleStatus.DRAFT.canTransitionTo(RuleStatus.PENDING_REVIEW));
        assertTrue(RuleStatus.PENDING_REVIEW.canTransitionTo(RuleStatus.APPROVED));
        assertTrue(RuleStatus.APPROVED.canTransitionTo(RuleStatus.PUBLISHED));
        assertTrue(RuleStatus.PUBLISHED.canTransitionTo(RuleStatus.SUPERSEDED));
    }

    @Test
    void testSkippingStepsIsRejected() {
        assertFalse(RuleStatus.DRAFT.canTransitionTo(RuleStatus.APPROVED));
        assertFalse(RuleStatus.DRAFT.canTransitionTo(RuleStatus.PUBLISHED));
        assertFalse(RuleStatus.PENDING_REVIEW.canTransitionTo(RuleStatus.PUBLISHED));
        assertFalse(RuleStatus.PUBLISHED.canTransitionTo(RuleStatus.REJECTED));
        assertFalse(RuleStatus.DRAFT.canTransitionTo(null));
    }

    @Test
    void testTerminalStatuses() {
        assertTrue(RuleStatus.REJECTED.isTerminal());
        assertTrue(RuleStatus.SUPERSEDED.isTerminal());
        assertFalse(RuleStatus.PUBLISHED.isTerminal());
        assertTrue(RuleStatus.REJECTED.allowedTargets().isEmpty());
    }

    @Test
    void testResetToDraft() {
        assertTrue(RuleStatus.PUBLISHED.canResetToDraft());
        assertTrue(RuleStatus.APPROVED.canResetToDraft());
        assertTrue(RuleStatus.PENDING_REVIEW.canResetToDraft());
        assertFalse(RuleStatus.DRAFT.canResetToDraft());
        assertFalse(RuleStatus.SUPERSEDED.canResetToDraft());
    }

    @Test
    void testLiveStatuses() {
        assertTrue(RuleStatus.live().contains(RuleStatus.PUBLISHED));
        assertFalse(RuleStatus.live().contains(RuleStatus.REJECTED));
        assertFalse(RuleStatus.live().contains(RuleStatus.SUPERSEDED));
    }
}
