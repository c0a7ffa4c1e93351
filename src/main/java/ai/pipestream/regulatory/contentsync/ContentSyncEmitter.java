package ai.pipestream.regulatory.contentsync;

import ai.pipestream.regulatory.entity.ContentSyncEvent;
import ai.pipestream.regulatory.entity.ContentSyncEventType;
import ai.pipestream.regulatory.entity.ContentSyncStatus;
import ai.pipestream.regulatory.entity.RegulatoryRule;
import ai.pipestream.regulatory.metrics.PipelineMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Inserts content-sync queue rows inside the caller's transaction.
 * <p>
 * Enqueue is idempotent: when a row with the derived event id exists, nothing
 * is written and the existing id is returned.
 */
@ApplicationScoped
public class ContentSyncEmitter {

    private static final Logger LOG = Logger.getLogger(ContentSyncEmitter.class);

    @Inject
    ObjectMapper objectMapper;

    @Inject
    PipelineMetrics metrics;

    @Transactional(Transactional.TxType.MANDATORY)
    public EnqueueResult enqueue(RegulatoryRule rule, ContentSyncEventType type, String note) {
        return enqueue(rule, type, note, rule.confidence);
    }

    /**
     * @param confidence confidence to report, for changes that do not touch the rule row
     */
    @Transactional(Transactional.TxType.MANDATORY)
    public EnqueueResult enqueue(RegulatoryRule rule, ContentSyncEventType type, String note, double confidence) {
        String eventId = ContentSyncEventIds.eventId(rule.id, type, rule.effectiveFrom);
        ContentSyncEvent existing = ContentSyncEvent.findById(eventId);
        if (existing != null) {
            LOG.debugf("Content-sync event already queued: eventId=%s, status=%s", eventId, existing.status);
            return new EnqueueResult(eventId, false);
        }

        Instant now = Instant.now();
        List<UUID> pointerIds = rule.sourcePointers.stream().map(p -> p.id).toList();
        ContentSyncPayload payload = new ContentSyncPayload(ContentSyncPayload.SCHEMA_VERSION, eventId, type,
                rule.id, rule.conceptSlug, rule.title, rule.value, rule.valueType, rule.riskTier,
                rule.effectiveFrom, rule.effectiveUntil, confidence, pointerIds, rule.supersededByRuleId,
                note, now);

        ContentSyncEvent event = new ContentSyncEvent();
        event.eventId = eventId;
        event.lockVersion = 0;
        event.ruleId = rule.id;
        event.type = type;
        event.effectiveFrom = rule.effectiveFrom;
        event.conceptSlug = rule.conceptSlug;
        event.status = ContentSyncStatus.PENDING;
        event.attempts = 0;
        event.payload = toJson(payload);
        event.createdAt = now;
        event.persist();

        metrics.recordContentSyncEnqueued(type);
        LOG.infof("Queued content-sync event: eventId=%s, type=%s, ruleId=%s, concept=%s",
                eventId, type, rule.id, rule.conceptSlug);
        return new EnqueueResult(eventId, true);
    }

    private String toJson(ContentSyncPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize content-sync payload " + payload.eventId(), e);
        }
    }
}
