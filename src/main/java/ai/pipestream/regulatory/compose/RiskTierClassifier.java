package ai.pipestream.regulatory.compose;

import ai.pipestream.regulatory.config.PipelineConfiguration;
import ai.pipestream.regulatory.entity.RiskTier;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;

/**
 * Assigns a risk tier from the concept slug. Deadlines, thresholds, rates and
 * penalties are T0; obligations and amounts T1; procedures T2; the rest T3.
 */
@ApplicationScoped
public class RiskTierClassifier {

    @Inject
    PipelineConfiguration config;

    public RiskTier classify(String conceptSlug) {
        PipelineConfiguration.Tiers tiers = config.tiers();
        return classify(conceptSlug, tiers.t0Keywords(), tiers.t1Keywords(), tiers.t2Keywords());
    }

    public static RiskTier classify(String conceptSlug, List<String> t0, List<String> t1, List<String> t2) {
        if (conceptSlug == null) {
            return RiskTier.T3;
        }
        if (matchesAny(conceptSlug, t0)) {
            return RiskTier.T0;
        }
        if (matchesAny(conceptSlug, t1)) {
            return RiskTier.T1;
        }
        if (matchesAny(conceptSlug, t2)) {
            return RiskTier.T2;
        }
        return RiskTier.T3;
    }

    private static boolean matchesAny(String slug, List<String> keywords) {
        for (String keyword : keywords) {
            String trimmed = keyword.trim();
            if (!trimmed.isEmpty() && slug.contains(trimmed)) {
                return true;
            }
        }
        return false;
    }
}
