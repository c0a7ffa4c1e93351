package ai.pipestream.regulatory.review;

import ai.pipestream.regulatory.config.PipelineConfiguration;
import ai.pipestream.regulatory.entity.RegulatoryConflict;
import ai.pipestream.regulatory.entity.RegulatoryRule;
import ai.pipestream.regulatory.entity.RuleStatus;
import ai.pipestream.regulatory.exception.EntityNotFoundException;
import ai.pipestream.regulatory.exception.IllegalStatusTransitionException;
import ai.pipestream.regulatory.metrics.PipelineMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.UUID;

/**
 * Approval of rules under review.
 * <p>
 * T0/T1 rules always wait for a human. T2/T3 rules at or above the configured
 * confidence floor are approved automatically. Nothing is approved while it
 * takes part in an OPEN conflict.
 */
@ApplicationScoped
public class RuleReviewer {

    private static final Logger LOG = Logger.getLogger(RuleReviewer.class);
    static final String AUTO_REVIEWER = "auto-policy";

    @Inject
    RuleStatusService statusService;

    @Inject
    PipelineConfiguration config;

    @Inject
    PipelineMetrics metrics;

    @Transactional
    public int autoReview() {
        double floor = config.review().autoApproveConfidenceFloor();
        List<RegulatoryRule> pending = RegulatoryRule.listByStatus(RuleStatus.PENDING_REVIEW);
        int approved = 0;
        for (RegulatoryRule rule : pending) {
            if (rule.riskTier.requiresHumanApproval() || rule.confidence < floor) {
                continue;
            }
            if (RegulatoryConflict.countOpenForRule(rule.id) > 0) {
                LOG.debugf("Auto-approval held back by open conflict: ruleId=%s", rule.id);
                continue;
            }
            statusService.transition(rule, RuleStatus.APPROVED, AUTO_REVIEWER,
                    String.format("confidence %.2f >= %.2f", rule.confidence, floor));
            metrics.recordAutoApproved();
            approved++;
        }
        if (approved > 0) {
            LOG.infof("Auto-review approved %d of %d pending rules", approved, pending.size());
        }
        return approved;
    }

    @Transactional
    public RegulatoryRule approve(UUID ruleId, String reviewer, String note) {
        RegulatoryRule rule = load(ruleId);
        if (rule.status != RuleStatus.PENDING_REVIEW) {
            throw new IllegalStatusTransitionException(ruleId, rule.status, RuleStatus.APPROVED);
        }
        long openConflicts = RegulatoryConflict.countOpenForRule(ruleId);
        if (openConflicts > 0) {
            throw new IllegalStatusTransitionException(ruleId,
                    "rule has " + openConflicts + " open conflict(s)");
        }
        statusService.transition(rule, RuleStatus.APPROVED, reviewer, note);
        return rule;
    }

    @Transactional
    public RegulatoryRule reject(UUID ruleId, String reviewer, String note) {
        RegulatoryRule rule = load(ruleId);
        statusService.transition(rule, RuleStatus.REJECTED, reviewer, note);
        return rule;
    }

    private static RegulatoryRule load(UUID ruleId) {
        RegulatoryRule rule = RegulatoryRule.findById(ruleId);
        if (rule == null) {
            throw EntityNotFoundException.rule(ruleId);
        }
        return rule;
    }
}
