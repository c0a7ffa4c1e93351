package ai.pipestream.regulatory.review;

import ai.pipestream.regulatory.compose.RuleConfidence;
import ai.pipestream.regulatory.contentsync.ContentSyncEmitter;
import ai.pipestream.regulatory.entity.ContentSyncEventType;
import ai.pipestream.regulatory.entity.RegulatoryRule;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Re-evaluates rules after some of their source pointers were re-verified.
 * <ul>
 *   <li>No grounded pointer left: the rule goes back to DRAFT.</li>
 *   <li>Lower derived confidence on a PUBLISHED rule: a CONFIDENCE_DROPPED event is queued,
 *       the published row itself is left alone.</li>
 *   <li>Lower derived confidence while under review: back to DRAFT for another look.</li>
 * </ul>
 */
@ApplicationScoped
public class EvidenceInvalidationService {

    private static final Logger LOG = Logger.getLogger(EvidenceInvalidationService.class);

    @Inject
    RuleStatusService statusService;

    @Inject
    ContentSyncEmitter contentSync;

    @Transactional
    public InvalidationReport invalidateForPointers(Collection<UUID> pointerIds) {
        if (pointerIds == null || pointerIds.isEmpty()) {
            return InvalidationReport.empty();
        }
        Map<UUID, RegulatoryRule> affected = new LinkedHashMap<>();
        for (UUID pointerId : pointerIds) {
            for (RegulatoryRule rule : RegulatoryRule.listBySourcePointer(pointerId)) {
                affected.putIfAbsent(rule.id, rule);
            }
        }

        int reset = 0;
        int drops = 0;
        int recomputed = 0;
        for (RegulatoryRule rule : affected.values()) {
            if (rule.status.isTerminal()) {
                continue;
            }
            long grounded = RuleConfidence.groundedCount(rule.sourcePointers);
            double derived = RuleConfidence.derive(rule.sourcePointers);
            if (grounded == 0) {
                rule.confidence = 0.0;
                if (statusService.resetToDraft(rule, "All source pointers lost grounding")) {
                    reset++;
                }
                continue;
            }
            if (derived >= rule.confidence) {
                continue;
            }
            switch (rule.status) {
                case PUBLISHED -> {
                    contentSync.enqueue(rule, ContentSyncEventType.CONFIDENCE_DROPPED,
                            String.format("Confidence dropped from %.2f to %.2f", rule.confidence, derived), derived);
                    drops++;
                }
                case PENDING_REVIEW, APPROVED -> {
                    statusService.resetToDraft(rule, String.format(
                            "Confidence dropped from %.2f to %.2f", rule.confidence, derived));
                    rule.confidence = derived;
                    reset++;
                }
                default -> {
                    rule.confidence = derived;
                    rule.updatedAt = Instant.now();
                    recomputed++;
                }
            }
        }

        if (!affected.isEmpty()) {
            LOG.infof("Evidence invalidation: pointers=%d, rules=%d, reset=%d, confidenceDrops=%d, recomputed=%d",
                    pointerIds.size(), affected.size(), reset, drops, recomputed);
        }
        return new InvalidationReport(reset, drops, recomputed);
    }
}
