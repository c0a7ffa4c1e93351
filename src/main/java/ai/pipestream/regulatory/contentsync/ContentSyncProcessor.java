package ai.pipestream.regulatory.contentsync;

import ai.pipestream.regulatory.config.PipelineConfiguration;
import ai.pipestream.regulatory.entity.ContentSyncEvent;
import ai.pipestream.regulatory.entity.ContentSyncEventType;
import ai.pipestream.regulatory.entity.ContentSyncStatus;
import ai.pipestream.regulatory.metrics.PipelineMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;

/**
 * Applies one content-sync event to the downstream content files.
 * <p>
 * The row is claimed with a compare-and-set to PROCESSING, so two deliveries
 * of the same job never both do the work. A PROCESSING row whose lease ran out
 * belongs to a worker that died and may be claimed again. The file writes happen
 * outside any database transaction.
 */
@ApplicationScoped
public class ContentSyncProcessor {

    private static final Logger LOG = Logger.getLogger(ContentSyncProcessor.class);
    private static final int MAX_ERROR_LENGTH = 2000;

    @Inject
    ConceptRegistry registry;

    @Inject
    ContentTarget contentTarget;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    PipelineConfiguration config;

    @Inject
    PipelineMetrics metrics;

    public ProcessOutcome process(String eventId) {
        Claim claim = QuarkusTransaction.requiringNew().call(() -> claim(eventId));
        if (claim == null) {
            LOG.debugf("Content-sync event not claimable: eventId=%s", eventId);
            return ProcessOutcome.NOT_CLAIMED;
        }

        try {
            ContentSyncPayload payload = parse(claim);
            List<String> paths = registry.pathsFor(payload.conceptSlug());
            if (paths.isEmpty()) {
                throw new UnmappedConceptException(payload.conceptSlug());
            }
            int applied = 0;
            for (String path : paths) {
                try {
                    contentTarget.applyChangelog(path, payload);
                    applied++;
                } catch (PatchConflictException e) {
                    LOG.infof("Content file already carries event, skipping: eventId=%s, path=%s", eventId, path);
                }
            }
            ContentSyncStatus finalStatus = applied == 0 ? ContentSyncStatus.SKIPPED : ContentSyncStatus.DONE;
            complete(claim, finalStatus);
            LOG.infof("Content-sync event applied: eventId=%s, type=%s, files=%d, status=%s",
                    eventId, payload.type(), applied, finalStatus);
            return finalStatus == ContentSyncStatus.DONE ? ProcessOutcome.DONE : ProcessOutcome.SKIPPED;
        } catch (RuntimeException e) {
            return fail(claim, ContentSyncErrors.classify(e));
        }
    }

    private Claim claim(String eventId) {
        ContentSyncEvent event = ContentSyncEvent.findById(eventId);
        Instant now = Instant.now();
        if (event == null || !event.isClaimable(now.minus(config.contentSync().processingLease()))) {
            return null;
        }
        if (event.status == ContentSyncStatus.PROCESSING) {
            LOG.warnf("Reclaiming content-sync event after expired lease: eventId=%s, claimedAt=%s",
                    eventId, event.claimedAt);
        }
        boolean claimed = ContentSyncEvent.compareAndSet(eventId, event.lockVersion,
                "status = ?3, attempts = attempts + 1, claimedAt = ?4", ContentSyncStatus.PROCESSING, now);
        if (!claimed) {
            return null;
        }
        return new Claim(eventId, event.lockVersion + 1, event.attempts + 1, event.payload);
    }

    private ContentSyncPayload parse(Claim claim) {
        ContentSyncPayload payload;
        try {
            payload = objectMapper.readValue(claim.payload(), ContentSyncPayload.class);
        } catch (JsonProcessingException e) {
            throw new InvalidPayloadException("Unreadable payload: " + e.getOriginalMessage());
        }
        validate(claim.eventId(), payload);
        return payload;
    }

    static void validate(String eventId, ContentSyncPayload payload) {
        if (payload.schemaVersion() != ContentSyncPayload.SCHEMA_VERSION) {
            throw new InvalidPayloadException("Unsupported schema version " + payload.schemaVersion());
        }
        if (payload.ruleId() == null || payload.type() == null
                || payload.conceptSlug() == null || payload.conceptSlug().isBlank()) {
            throw new InvalidPayloadException("Payload is missing ruleId, type or conceptSlug");
        }
        if (!eventId.equals(payload.eventId())) {
            throw new InvalidPayloadException("Payload event id " + payload.eventId()
                    + " does not match row " + eventId);
        }
        boolean needsPointers = payload.type() == ContentSyncEventType.RULE_RELEASED
                || payload.type() == ContentSyncEventType.RULE_EFFECTIVE;
        if (needsPointers && (payload.sourcePointerIds() == null || payload.sourcePointerIds().isEmpty())) {
            throw new MissingPointersException(eventId);
        }
    }

    private void complete(Claim claim, ContentSyncStatus status) {
        Instant now = Instant.now();
        boolean updated = QuarkusTransaction.requiringNew().call(() -> ContentSyncEvent.compareAndSet(
                claim.eventId(), claim.version(), "status = ?3, processedAt = ?4, lastError = null",
                status, now));
        if (!updated) {
            LOG.warnf("Content-sync event changed while processing: eventId=%s", claim.eventId());
        }
    }

    private ProcessOutcome fail(Claim claim, ContentSyncException error) {
        String message = truncate(error.getMessage());
        int maxAttempts = config.contentSync().maxAttempts();
        Instant now = Instant.now();

        if (error.isPermanent() || claim.attempts() >= maxAttempts) {
            QuarkusTransaction.requiringNew().call(() -> ContentSyncEvent.compareAndSet(
                    claim.eventId(), claim.version(),
                    "status = ?3, deadLetterReason = ?4, deadLetterNote = ?5, lastError = ?5, processedAt = ?6",
                    ContentSyncStatus.DEAD_LETTERED, error.getReason(), message, now));
            metrics.recordDeadLetter(error.getReason());
            LOG.errorf(error, "Content-sync event dead-lettered: eventId=%s, reason=%s, attempts=%d",
                    claim.eventId(), error.getReason(), claim.attempts());
            return ProcessOutcome.DEAD_LETTERED;
        }

        RetryBackoff backoff = new RetryBackoff(config.contentSync().initialBackoff(), config.contentSync().maxBackoff());
        Instant nextAttempt = now.plus(backoff.delayFor(claim.attempts()));
        QuarkusTransaction.requiringNew().call(() -> ContentSyncEvent.compareAndSet(
                claim.eventId(), claim.version(), "status = ?3, nextAttemptAt = ?4, lastError = ?5",
                ContentSyncStatus.FAILED, nextAttempt, message));
        LOG.warnf("Content-sync event failed, retry at %s: eventId=%s, attempt=%d/%d, error=%s",
                nextAttempt, claim.eventId(), claim.attempts(), maxAttempts, message);
        return ProcessOutcome.RETRY_SCHEDULED;
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }

    private record Claim(String eventId, long version, int attempts, String payload) {
    }
}
