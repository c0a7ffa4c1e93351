package ai.pipestream.regulatory.contentsync;

import ai.pipestream.regulatory.config.PipelineConfiguration;
import ai.pipestream.regulatory.entity.ContentSyncEvent;
import ai.pipestream.regulatory.entity.ContentSyncStatus;
import ai.pipestream.regulatory.metrics.PipelineMetrics;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;

/**
 * Moves drainable queue rows to the queue backend: PENDING rows, FAILED rows
 * whose backoff elapsed, and ENQUEUED or PROCESSING rows whose lease expired.
 * <p>
 * No transaction is held while publishing. A row is marked ENQUEUED only after
 * the backend acknowledged it, through a compare-and-set on the version read
 * before publishing.
 */
@ApplicationScoped
public class ContentSyncDispatcher {

    private static final Logger LOG = Logger.getLogger(ContentSyncDispatcher.class);

    @Inject
    ContentSyncJobPublisher publisher;

    @Inject
    PipelineConfiguration config;

    @Inject
    PipelineMetrics metrics;

    public DrainReport drainPending() {
        int batchSize = config.contentSync().drainBatchSize();
        Instant start = Instant.now();
        Instant leaseExpiredBefore = start.minus(config.contentSync().processingLease());
        List<Snapshot> batch = QuarkusTransaction.requiringNew().call(() ->
                ContentSyncEvent.listDrainable(start, leaseExpiredBefore, batchSize).stream()
                        .map(e -> new Snapshot(e.eventId, e.lockVersion))
                        .toList());

        int enqueued = 0;
        int stale = 0;
        int failed = 0;
        for (Snapshot snapshot : batch) {
            try {
                publisher.enqueueContentSyncJob(snapshot.eventId());
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to publish content-sync job: eventId=%s", snapshot.eventId());
                failed++;
                continue;
            }
            Instant now = Instant.now();
            boolean marked = QuarkusTransaction.requiringNew().call(() -> ContentSyncEvent.compareAndSet(
                    snapshot.eventId(), snapshot.version(), "status = ?3, enqueuedAt = ?4",
                    ContentSyncStatus.ENQUEUED, now));
            if (marked) {
                enqueued++;
            } else {
                stale++;
                LOG.debugf("Content-sync event moved on while draining: eventId=%s", snapshot.eventId());
            }
        }

        if (!batch.isEmpty()) {
            LOG.infof("Content-sync drain: enqueued=%d, stale=%d, failed=%d", enqueued, stale, failed);
        }
        metrics.recordDrain(enqueued);
        return new DrainReport(enqueued, stale, failed);
    }

    private record Snapshot(String eventId, long version) {
    }
}
