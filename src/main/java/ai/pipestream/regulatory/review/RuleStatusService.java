package ai.pipestream.regulatory.review;

import ai.pipestream.regulatory.contentsync.ContentSyncEmitter;
import ai.pipestream.regulatory.entity.ContentSyncEventType;
import ai.pipestream.regulatory.entity.RegulatoryRule;
import ai.pipestream.regulatory.entity.RuleStatus;
import ai.pipestream.regulatory.exception.IllegalStatusTransitionException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Optional;

/**
 * Single place where rule status changes. Every change that downstream content
 * cares about inserts its content-sync event in the caller's transaction.
 */
@ApplicationScoped
public class RuleStatusService {

    private static final Logger LOG = Logger.getLogger(RuleStatusService.class);

    @Inject
    ContentSyncEmitter contentSync;

    @Transactional(Transactional.TxType.MANDATORY)
    public void transition(RegulatoryRule rule, RuleStatus target, String actor, String note) {
        RuleStatus from = rule.status;
        if (!from.canTransitionTo(target)) {
            throw new IllegalStatusTransitionException(rule.id, from, target);
        }
        rule.status = target;
        rule.updatedAt = Instant.now();
        if (actor != null) {
            rule.reviewedBy = actor;
        }
        if (note != null) {
            rule.reviewNote = note;
        }
        eventFor(target).ifPresent(type -> contentSync.enqueue(rule, type, note));
        LOG.infof("Rule status changed: ruleId=%s, concept=%s, %s -> %s, actor=%s",
                rule.id, rule.conceptSlug, from, target, actor);
    }

    /**
     * Sends a rule back to DRAFT after its evidence was invalidated.
     *
     * @return false when the rule was already DRAFT or is in a terminal status
     */
    @Transactional(Transactional.TxType.MANDATORY)
    public boolean resetToDraft(RegulatoryRule rule, String reason) {
        if (!rule.status.canResetToDraft()) {
            return false;
        }
        RuleStatus from = rule.status;
        rule.status = RuleStatus.DRAFT;
        rule.updatedAt = Instant.now();
        rule.reviewNote = reason;
        if (from == RuleStatus.PUBLISHED) {
            contentSync.enqueue(rule, ContentSyncEventType.SOURCE_CHANGED, reason);
        }
        LOG.warnf("Rule reset to DRAFT: ruleId=%s, concept=%s, from=%s, reason=%s",
                rule.id, rule.conceptSlug, from, reason);
        return true;
    }

    private static Optional<ContentSyncEventType> eventFor(RuleStatus target) {
        return switch (target) {
            case PUBLISHED -> Optional.of(ContentSyncEventType.RULE_RELEASED);
            case SUPERSEDED -> Optional.of(ContentSyncEventType.RULE_SUPERSEDED);
            default -> Optional.empty();
        };
    }
}
