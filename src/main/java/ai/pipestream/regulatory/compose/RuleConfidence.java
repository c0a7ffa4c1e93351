package ai.pipestream.regulatory.compose;

import ai.pipestream.regulatory.entity.MatchType;
import ai.pipestream.regulatory.entity.SourcePointer;

import java.util.Collection;

/**
 * Derived confidence of a rule: the minimum confidence over its GROUNDED pointers.
 * Pointers that are not grounded cannot be cited and take no part in it. A rule
 * without any grounded pointer has confidence 0.
 */
public final class RuleConfidence {

    private RuleConfidence() {
    }

    public static double derive(Collection<SourcePointer> pointers) {
        if (pointers == null || pointers.isEmpty()) {
            return 0.0;
        }
        return pointers.stream()
                .filter(p -> p.matchType == MatchType.GROUNDED)
                .mapToDouble(p -> p.confidence)
                .min()
                .orElse(0.0);
    }

    public static long groundedCount(Collection<SourcePointer> pointers) {
        return pointers.stream().filter(p -> p.matchType == MatchType.GROUNDED).count();
    }
}
