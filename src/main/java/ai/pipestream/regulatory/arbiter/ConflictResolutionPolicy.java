package ai.pipestream.regulatory.arbiter;

import ai.pipestream.regulatory.entity.AuthorityLevel;
import ai.pipestream.regulatory.entity.ResolutionPolicy;

import java.time.LocalDate;

/**
 * Automated conflict resolution. Criteria in order: source authority, later
 * effectiveFrom, higher confidence. A tie on all three is never broken
 * automatically.
 */
public final class ConflictResolutionPolicy {

    private static final double CONFIDENCE_EPSILON = 1e-9;

    private ConflictResolutionPolicy() {
    }

    public static Resolution decide(RuleFacts a, RuleFacts b) {
        int authority = compareAuthority(a.authority(), b.authority());
        if (authority != 0) {
            return new Resolution(authority > 0 ? a.ruleId() : b.ruleId(), ResolutionPolicy.AUTHORITY, null);
        }
        int recency = compareDates(a.effectiveFrom(), b.effectiveFrom());
        if (recency != 0) {
            return new Resolution(recency > 0 ? a.ruleId() : b.ruleId(), ResolutionPolicy.RECENCY, null);
        }
        double delta = a.confidence() - b.confidence();
        if (Math.abs(delta) > CONFIDENCE_EPSILON) {
            return new Resolution(delta > 0 ? a.ruleId() : b.ruleId(), ResolutionPolicy.CONFIDENCE, null);
        }
        return new Resolution(null, ResolutionPolicy.HUMAN,
                String.format("Tie on authority (%s), effectiveFrom (%s) and confidence (%.4f)",
                        a.authority(), a.effectiveFrom(), a.confidence()));
    }

    // Positive when a carries more authority. Unknown authority ranks below every level.
    static int compareAuthority(AuthorityLevel a, AuthorityLevel b) {
        int scoreA = a == null ? Integer.MAX_VALUE : a.score();
        int scoreB = b == null ? Integer.MAX_VALUE : b.score();
        return Integer.compare(scoreB, scoreA);
    }

    // Positive when a is later. A missing date counts as earliest.
    static int compareDates(LocalDate a, LocalDate b) {
        if (a == null && b == null) {
            return 0;
        }
        if (a == null) {
            return -1;
        }
        if (b == null) {
            return 1;
        }
        return a.compareTo(b);
    }
}
