package ai.pipestream.regulatory.contentsync;

import io.smallrye.common.annotation.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.jboss.logging.Logger;

/**
 * Consumes content-sync jobs. The message body is the event id; everything else
 * is read from the queue row.
 */
@ApplicationScoped
public class ContentSyncWorker {

    private static final Logger LOG = Logger.getLogger(ContentSyncWorker.class);

    @Inject
    ContentSyncProcessor processor;

    @Incoming("content-sync-jobs-in")
    @Blocking
    public void onJob(String eventId) {
        ProcessOutcome outcome = processor.process(eventId);
        LOG.debugf("Content-sync job handled: eventId=%s, outcome=%s", eventId, outcome);
    }
}
