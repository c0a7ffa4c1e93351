package ai.pipestream.regulatory.contentsync;

import ai.pipestream.regulatory.entity.ContentSyncEventType;
import ai.pipestream.regulatory.entity.RegulatoryRule;
import ai.pipestream.regulatory.entity.RuleStatus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.LocalDate;
import java.util.List;

/**
 * Queues RULE_EFFECTIVE once a published rule's effective date has arrived.
 * The event id already encodes the date, so repeated runs add nothing.
 */
@ApplicationScoped
public class EffectiveRuleAnnouncer {

    private static final Logger LOG = Logger.getLogger(EffectiveRuleAnnouncer.class);

    @Inject
    ContentSyncEmitter emitter;

    @Transactional
    public int announceDue(LocalDate today) {
        List<RegulatoryRule> due = RegulatoryRule.list("status = ?1 and effectiveFrom <= ?2",
                RuleStatus.PUBLISHED, today);
        int queued = 0;
        for (RegulatoryRule rule : due) {
            if (emitter.enqueue(rule, ContentSyncEventType.RULE_EFFECTIVE, "Effective from " + rule.effectiveFrom).created()) {
                queued++;
            }
        }
        if (queued > 0) {
            LOG.infof("Queued %d RULE_EFFECTIVE events for %s", queued, today);
        }
        return queued;
    }
}
