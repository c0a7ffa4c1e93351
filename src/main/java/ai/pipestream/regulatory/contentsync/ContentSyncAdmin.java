package ai.pipestream.regulatory.contentsync;

import ai.pipestream.regulatory.entity.ContentSyncEvent;
import ai.pipestream.regulatory.entity.ContentSyncStatus;
import ai.pipestream.regulatory.exception.EntityNotFoundException;
import ai.pipestream.regulatory.exception.IllegalStatusTransitionException;
import ai.pipestream.regulatory.exception.StaleVersionException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Operator access to dead-lettered content-sync events.
 */
@ApplicationScoped
public class ContentSyncAdmin {

    private static final Logger LOG = Logger.getLogger(ContentSyncAdmin.class);

    @Transactional
    public List<ContentSyncEvent> listDeadLetters(int limit) {
        return ContentSyncEvent.find("status = ?1 order by processedAt desc", ContentSyncStatus.DEAD_LETTERED)
                .page(0, limit)
                .list();
    }

    /**
     * Puts a dead-lettered event back to PENDING with a fresh attempt budget.
     *
     * @param expectedVersion version the operator looked at
     * @throws StaleVersionException when the row changed since
     */
    @Transactional
    public void requeue(String eventId, long expectedVersion, String operator) {
        ContentSyncEvent event = ContentSyncEvent.findById(eventId);
        if (event == null) {
            throw new EntityNotFoundException("ContentSyncEvent", eventId);
        }
        if (event.status != ContentSyncStatus.DEAD_LETTERED) {
            throw new IllegalStatusTransitionException(event.ruleId,
                    "content-sync event " + eventId + " is " + event.status + ", not DEAD_LETTERED");
        }
        boolean updated = ContentSyncEvent.compareAndSet(eventId, expectedVersion,
                "status = ?3, attempts = 0, nextAttemptAt = null, deadLetterReason = null, deadLetterNote = null",
                ContentSyncStatus.PENDING);
        if (!updated) {
            throw new StaleVersionException("ContentSyncEvent", eventId, expectedVersion);
        }
        LOG.infof("Dead-lettered content-sync event requeued: eventId=%s, by=%s", eventId, operator);
    }
}
