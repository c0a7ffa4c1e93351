package ai.pipestream.regulatory.contentsync;

import io.smallrye.reactive.messaging.MutinyEmitter;
import io.smallrye.reactive.messaging.kafka.api.OutgoingKafkaRecordMetadata;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;

/**
 * Hands content-sync jobs to the queue backend. Messages are keyed by event id,
 * so repeated hand-offs of one event land on the same partition and are
 * de-duplicated by the worker.
 */
@ApplicationScoped
public class ContentSyncJobPublisher {

    private static final Logger LOG = Logger.getLogger(ContentSyncJobPublisher.class);

    @Inject
    @Channel("content-sync-jobs-out")
    MutinyEmitter<String> emitter;

    /**
     * Blocks until the backend acknowledged the job.
     */
    public void enqueueContentSyncJob(String eventId) {
        Message<String> message = Message.of(eventId)
                .addMetadata(OutgoingKafkaRecordMetadata.<String>builder()
                        .withKey(eventId)
                        .build());
        emitter.sendMessageAndAwait(message);
        LOG.debugf("Published content-sync job: eventId=%s", eventId);
    }
}
