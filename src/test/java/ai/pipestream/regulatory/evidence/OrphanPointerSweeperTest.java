package ai.pipestream.regulatory.evidence;

import ai.pipestream.regulatory.contentsync.ContentSyncEventIds;
import ai.pipestream.regulatory.entity.ContentSyncEvent;
import ai.pipestream.regulatory.entity.ContentSyncEventType;
import ai.pipestream.regulatory.entity.MatchType;
import ai.pipestream.regulatory.entity.RegulatoryRule;
import ai.pipestream.regulatory.entity.RiskTier;
import ai.pipestream.regulatory.entity.RuleStatus;
import ai.pipestream.regulatory.entity.SourcePointer;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.UUID;

import static ai.pipestream.regulatory.PipelineFixtures.pointer;
import static ai.pipestream.regulatory.PipelineFixtures.rule;
import static ai.pipestream.regulatory.PipelineFixtures.unique;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

/**
 * Tests for sweeping pointers whose evidence disappeared.
 */
@QuarkusTest
public class OrphanPointerSweeperTest {

    private static final Logger LOG = Logger.getLogger(OrphanPointerSweeperTest.class);
    private static final LocalDate JAN_2025 = LocalDate.of(2025, 1, 1);

    @Inject
    OrphanPointerSweeper sweeper;

    @Test
    void testSweep_OrphanInvalidatesPublishedRule() {
        LOG.info("Testing sweep - grounded pointer without evidence");

        UUID[] ids = QuarkusTransaction.requiringNew().call(() -> {
            SourcePointer orphan = pointer(UUID.randomUUID(), unique("doprinos"), "20%", "stopa 20%", 0.9, JAN_2025);
            orphan.matchType = MatchType.GROUNDED;
            RegulatoryRule rule = rule(orphan.conceptSlug, "20%", RuleStatus.PUBLISHED, RiskTier.T1, JAN_2025, 0.9, orphan);
            return new UUID[]{orphan.id, rule.id};
        });

        int swept = sweeper.sweep();

        assertThat(swept, is(greaterThanOrEqualTo(1)));
        QuarkusTransaction.requiringNew().run(() -> {
            SourcePointer pointer = SourcePointer.findById(ids[0]);
            assertThat(pointer.matchType, is(MatchType.NOT_FOUND));
            assertThat(pointer.verificationNote, containsString("no longer exists"));
            assertThat(RegulatoryRule.<RegulatoryRule>findById(ids[1]).status, is(RuleStatus.DRAFT));
            assertThat(ContentSyncEvent.findById(ContentSyncEventIds.eventId(ids[1],
                    ContentSyncEventType.SOURCE_CHANGED, JAN_2025)), is(notNullValue()));
        });
    }
}
