package ai.pipestream.regulatory.arbiter;

import ai.pipestream.regulatory.entity.ConflictStatus;
import ai.pipestream.regulatory.entity.RegulatoryConflict;
import ai.pipestream.regulatory.entity.RegulatoryRule;
import ai.pipestream.regulatory.entity.ResolutionPolicy;
import ai.pipestream.regulatory.entity.RuleStatus;
import ai.pipestream.regulatory.exception.EntityNotFoundException;
import ai.pipestream.regulatory.exception.IllegalStatusTransitionException;
import ai.pipestream.regulatory.metrics.PipelineMetrics;
import ai.pipestream.regulatory.review.RuleStatusService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Detects contradictory rules for a concept and resolves them.
 * <p>
 * Two live rules conflict when their [effectiveFrom, effectiveUntil) periods
 * overlap and their normalized values differ. Each unordered pair is stored
 * once, so detection can be re-run freely.
 */
@ApplicationScoped
public class ConflictArbiter {

    private static final Logger LOG = Logger.getLogger(ConflictArbiter.class);

    @Inject
    RuleStatusService statusService;

    @Inject
    PipelineMetrics metrics;

    /**
     * @return the OPEN conflicts of the concept after detection
     */
    @Transactional
    public List<RegulatoryConflict> detectConflicts(String conceptSlug) {
        List<RegulatoryRule> rules = RegulatoryRule.listLiveByConcept(conceptSlug);
        int opened = 0;
        for (int i = 0; i < rules.size(); i++) {
            for (int j = i + 1; j < rules.size(); j++) {
                RegulatoryRule a = rules.get(i);
                RegulatoryRule b = rules.get(j);
                if (!inConflict(a, b)) {
                    continue;
                }
                boolean aFirst = a.id.toString().compareTo(b.id.toString()) < 0;
                UUID first = aFirst ? a.id : b.id;
                UUID second = aFirst ? b.id : a.id;
                if (RegulatoryConflict.findByPair(first, second).isPresent()) {
                    continue;
                }
                RegulatoryConflict conflict = new RegulatoryConflict();
                conflict.conceptSlug = conceptSlug;
                conflict.ruleAId = first;
                conflict.ruleBId = second;
                conflict.status = ConflictStatus.OPEN;
                conflict.createdAt = Instant.now();
                conflict.persist();
                opened++;
                LOG.infof("Conflict opened: conflictId=%s, concept=%s, rules=%s/%s, values=%s/%s",
                        conflict.id, conceptSlug, a.id, b.id, a.value, b.value);
            }
        }
        metrics.recordConflictsDetected(opened);
        return RegulatoryConflict.listOpenByConcept(conceptSlug);
    }

    /**
     * Runs detection for every concept that has live rules.
     */
    @Transactional
    public int detectAll() {
        List<String> concepts = RegulatoryRule.find(
                        "select distinct r.conceptSlug from RegulatoryRule r where r.status in ?1", RuleStatus.live())
                .project(String.class)
                .list();
        int open = 0;
        for (String concept : concepts) {
            open += detectConflicts(concept).size();
        }
        return open;
    }

    static boolean inConflict(RegulatoryRule a, RegulatoryRule b) {
        if (!Objects.equals(a.conceptSlug, b.conceptSlug)) {
            return false;
        }
        if (Objects.equals(a.normalizedValue, b.normalizedValue)) {
            return false;
        }
        if (a.status == RuleStatus.PUBLISHED && b.status == RuleStatus.PUBLISHED) {
            return false;
        }
        if (a.id.equals(b.supersededByRuleId) || b.id.equals(a.supersededByRuleId)) {
            return false;
        }
        return overlaps(a.effectiveFrom, a.effectiveUntil, b.effectiveFrom, b.effectiveUntil);
    }

    /**
     * Half-open intervals; a null bound is unbounded on that side.
     */
    static boolean overlaps(LocalDate fromA, LocalDate untilA, LocalDate fromB, LocalDate untilB) {
        boolean aStartsBeforeBEnds = untilB == null || fromA == null || fromA.isBefore(untilB);
        boolean bStartsBeforeAEnds = untilA == null || fromB == null || fromB.isBefore(untilA);
        return aStartsBeforeBEnds && bStartsBeforeAEnds;
    }

    /**
     * Applies the automated policy to every OPEN conflict of the concept.
     * Ties stay OPEN with the escalation reason recorded.
     *
     * @return number of conflicts resolved
     */
    @Transactional
    public int autoResolve(String conceptSlug) {
        int resolved = 0;
        for (RegulatoryConflict conflict : RegulatoryConflict.listOpenByConcept(conceptSlug)) {
            RegulatoryRule a = RegulatoryRule.findById(conflict.ruleAId);
            RegulatoryRule b = RegulatoryRule.findById(conflict.ruleBId);
            if (a == null || b == null) {
                LOG.warnf("Conflict references a missing rule: conflictId=%s", conflict.id);
                continue;
            }
            Resolution resolution = ConflictResolutionPolicy.decide(RuleFacts.of(a), RuleFacts.of(b));
            if (resolution.escalated()) {
                if (!Objects.equals(conflict.escalationReason, resolution.escalationReason())) {
                    conflict.escalationReason = resolution.escalationReason();
                    LOG.infof("Conflict escalated to human review: conflictId=%s, reason=%s",
                            conflict.id, resolution.escalationReason());
                }
                continue;
            }
            applyResolution(conflict, resolution.winner(), resolution.policy(), "auto-policy");
            resolved++;
        }
        return resolved;
    }

    @Transactional
    public int autoResolveAll() {
        List<String> concepts = RegulatoryConflict.find(
                        "select distinct c.conceptSlug from RegulatoryConflict c where c.status = ?1", ConflictStatus.OPEN)
                .project(String.class)
                .list();
        int resolved = 0;
        for (String concept : concepts) {
            resolved += autoResolve(concept);
        }
        return resolved;
    }

    /**
     * Resolves a conflict with an explicitly chosen winner.
     */
    @Transactional
    public RegulatoryConflict resolve(UUID conflictId, UUID winningRuleId, ResolutionPolicy policy, String resolvedBy) {
        RegulatoryConflict conflict = RegulatoryConflict.findById(conflictId);
        if (conflict == null) {
            throw EntityNotFoundException.conflict(conflictId);
        }
        if (conflict.status != ConflictStatus.OPEN) {
            throw new IllegalStatusTransitionException(winningRuleId,
                    "conflict " + conflictId + " is already " + conflict.status);
        }
        if (!conflict.involves(winningRuleId)) {
            throw new IllegalStatusTransitionException(winningRuleId,
                    "rule is not part of conflict " + conflictId);
        }
        applyResolution(conflict, winningRuleId, policy, resolvedBy);
        return conflict;
    }

    private void applyResolution(RegulatoryConflict conflict, UUID winnerId, ResolutionPolicy policy, String resolvedBy) {
        UUID loserId = conflict.otherRule(winnerId);
        RegulatoryRule loser = RegulatoryRule.findById(loserId);
        if (loser == null) {
            throw EntityNotFoundException.rule(loserId);
        }
        String note = "Lost conflict " + conflict.id + " (" + policy + ")";
        switch (loser.status) {
            case DRAFT, PENDING_REVIEW, APPROVED -> statusService.transition(loser, RuleStatus.REJECTED, resolvedBy, note);
            case PUBLISHED -> {
                loser.supersededByRuleId = winnerId;
                loser.updatedAt = Instant.now();
            }
            default -> {
                // already terminal
            }
        }

        conflict.status = ConflictStatus.RESOLVED;
        conflict.winningRuleId = winnerId;
        conflict.resolutionPolicy = policy;
        conflict.resolvedBy = resolvedBy;
        conflict.resolvedAt = Instant.now();
        LOG.infof("Conflict resolved: conflictId=%s, concept=%s, winner=%s, loser=%s, policy=%s, by=%s",
                conflict.id, conflict.conceptSlug, winnerId, loserId, policy, resolvedBy);
    }
}
