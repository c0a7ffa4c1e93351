package ai.pipestream.regulatory.compose;

import ai.pipestream.regulatory.entity.MatchType;
import ai.pipestream.regulatory.entity.SourcePointer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for deriving a rule's confidence from its pointers.
 */
class RuleConfidenceTest {

    @Test
    void testMinimumOfGroundedPointers() {
        List<SourcePointer> pointers = List.of(
                pointer(0.9, MatchType.GROUNDED),
                pointer(0.95, MatchType.GROUNDED),
                pointer(0.99, MatchType.NOT_FOUND));

        assertEquals(0.9, RuleConfidence.derive(pointers), 1e-9);
        assertEquals(2, RuleConfidence.groundedCount(pointers));
    }

    @Test
    void testWeakGroundedSourceIsNotMasked() {
        List<SourcePointer> pointers = List.of(
                pointer(0.99, MatchType.GROUNDED),
                pointer(0.55, MatchType.GROUNDED),
                pointer(0.3, MatchType.PENDING_VERIFICATION));

        assertEquals(0.55, RuleConfidence.derive(pointers), 1e-9);
    }

    @Test
    void testNothingGroundedIsZero() {
        assertEquals(0.0, RuleConfidence.derive(List.of(pointer(0.9, MatchType.NOT_FOUND))));
        assertEquals(0.0, RuleConfidence.derive(List.of()));
        assertEquals(0.0, RuleConfidence.derive(null));
    }

    private static SourcePointer pointer(double confidence, MatchType matchType) {
        SourcePointer pointer = new SourcePointer();
        pointer.confidence = confidence;
        pointer.matchType = matchType;
        return pointer;
    }
}
