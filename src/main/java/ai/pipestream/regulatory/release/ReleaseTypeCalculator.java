package ai.pipestream.regulatory.release;

import ai.pipestream.regulatory.entity.RegulatoryRule;
import ai.pipestream.regulatory.entity.ReleaseType;
import ai.pipestream.regulatory.entity.RiskTier;

import java.util.Collection;

/**
 * Bump type over the rules a release changes. Unchanged members never count.
 */
public final class ReleaseTypeCalculator {

    private ReleaseTypeCalculator() {
    }

    public static ReleaseType forChanges(Collection<RegulatoryRule> changed) {
        ReleaseType type = ReleaseType.PATCH;
        for (RegulatoryRule rule : changed) {
            if (rule.riskTier == RiskTier.T0) {
                return ReleaseType.MAJOR;
            }
            if (rule.riskTier == RiskTier.T1) {
                type = ReleaseType.MINOR;
            }
        }
        return type;
    }
}
