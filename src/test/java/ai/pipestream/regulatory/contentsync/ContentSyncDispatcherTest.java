package ai.pipestream.regulatory.contentsync;

import ai.pipestream.regulatory.entity.ContentSyncEvent;
import ai.pipestream.regulatory.entity.ContentSyncEventType;
import ai.pipestream.regulatory.entity.ContentSyncStatus;
import ai.pipestream.regulatory.entity.RegulatoryRule;
import ai.pipestream.regulatory.entity.RiskTier;
import ai.pipestream.regulatory.entity.RuleStatus;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static ai.pipestream.regulatory.PipelineFixtures.rule;
import static ai.pipestream.regulatory.PipelineFixtures.unique;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

/**
 * Tests for queueing content-sync events and draining them to the job backend.
 */
@QuarkusTest
public class ContentSyncDispatcherTest {

    private static final Logger LOG = Logger.getLogger(ContentSyncDispatcherTest.class);

    @Inject
    ContentSyncEmitter emitter;

    @Inject
    ContentSyncDispatcher dispatcher;

    @Inject
    MockContentSyncJobPublisher publisher;

    @Test
    void testEnqueue_SameChangeTwiceKeepsOneRow() {
        LOG.info("Testing enqueue - duplicate change");

        EnqueueResult[] results = QuarkusTransaction.requiringNew().call(() -> {
            RegulatoryRule rule = rule(unique("pdv-prag"), "60000 EUR", RuleStatus.PUBLISHED, RiskTier.T0,
                    LocalDate.of(2025, 1, 1), 0.9);
            return new EnqueueResult[]{
                    emitter.enqueue(rule, ContentSyncEventType.RULE_RELEASED, "first"),
                    emitter.enqueue(rule, ContentSyncEventType.RULE_RELEASED, "second")};
        });

        assertThat(results[0].created(), is(true));
        assertThat("Second enqueue is a no-op", results[1].created(), is(false));
        assertThat(results[1].eventId(), is(results[0].eventId()));
        QuarkusTransaction.requiringNew().run(() -> {
            ContentSyncEvent event = ContentSyncEvent.findById(results[0].eventId());
            assertThat(event.status, is(ContentSyncStatus.PENDING));
            assertThat(event.lockVersion, is(0L));
            assertThat(event.payload, containsString("\"note\":\"first\""));
        });
    }

    @Test
    void testDrain_MarksEnqueuedOnce() {
        LOG.info("Testing drain - published once, then ENQUEUED");

        String eventId = queue(unique("pdv-prag"));

        DrainReport report = dispatcher.drainPending();

        assertThat(report.enqueued(), is(greaterThanOrEqualTo(1)));
        assertThat(publisher.getPublished(), hasItem(eventId));
        QuarkusTransaction.requiringNew().run(() -> {
            ContentSyncEvent event = ContentSyncEvent.findById(eventId);
            assertThat(event.status, is(ContentSyncStatus.ENQUEUED));
            assertThat(event.lockVersion, is(1L));
            assertThat(event.enqueuedAt, is(notNullValue()));
        });

        dispatcher.drainPending();

        long handOffs = publisher.getPublished().stream().filter(eventId::equals).count();
        assertThat("ENQUEUED rows are not drained again", handOffs, is(1L));
    }

    @Test
    void testDrain_BackendFailureLeavesRowPending() {
        LOG.info("Testing drain - backend refuses the job");

        String eventId = queue(unique("pdv-prag"));
        publisher.failFor(eventId);

        DrainReport report = dispatcher.drainPending();

        assertThat(report.failed(), is(greaterThanOrEqualTo(1)));
        assertThat(publisher.getPublished(), not(hasItem(eventId)));
        QuarkusTransaction.requiringNew().run(() -> {
            ContentSyncEvent event = ContentSyncEvent.findById(eventId);
            assertThat(event.status, is(ContentSyncStatus.PENDING));
            assertThat(event.lockVersion, is(0L));
        });
    }

    private String queue(String concept) {
        return QuarkusTransaction.requiringNew().call(() -> {
            RegulatoryRule rule = rule(concept, "60000 EUR", RuleStatus.PUBLISHED, RiskTier.T0,
                    LocalDate.of(2025, 1, 1), 0.9);
            return emitter.enqueue(rule, ContentSyncEventType.RULE_RELEASED, null).eventId();
        });
    }
}
