package ai.pipestream.regulatory.contentsync;

import ai.pipestream.regulatory.entity.AuthorityLevel;
import ai.pipestream.regulatory.entity.ContentSyncEvent;
import ai.pipestream.regulatory.entity.ContentSyncEventType;
import ai.pipestream.regulatory.entity.ContentSyncStatus;
import ai.pipestream.regulatory.entity.DeadLetterReason;
import ai.pipestream.regulatory.entity.Evidence;
import ai.pipestream.regulatory.entity.RegulatoryRule;
import ai.pipestream.regulatory.entity.RiskTier;
import ai.pipestream.regulatory.entity.RuleStatus;
import ai.pipestream.regulatory.entity.SourcePointer;
import ai.pipestream.regulatory.exception.StaleVersionException;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static ai.pipestream.regulatory.PipelineFixtures.evidence;
import static ai.pipestream.regulatory.PipelineFixtures.groundedPointer;
import static ai.pipestream.regulatory.PipelineFixtures.rule;
import static ai.pipestream.regulatory.PipelineFixtures.unique;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for applying content-sync events to content files on disk.
 */
@QuarkusTest
public class ContentSyncProcessorTest {

    private static final Logger LOG = Logger.getLogger(ContentSyncProcessorTest.class);
    private static final Path CONTENT_DIR = Path.of("target/content-sync-test");
    private static final String THRESHOLD_PAGE = "porezi/pdv/prag-za-ulazak-u-sustav.mdx";
    private static final String FLAT_RATE_PAGE = "pausalni-obrt/granice-prihoda.mdx";

    @Inject
    ContentSyncProcessor processor;

    @Inject
    ContentSyncEmitter emitter;

    @Inject
    ContentSyncAdmin admin;

    @BeforeEach
    void setUp() throws IOException {
        for (String page : List.of(THRESHOLD_PAGE, FLAT_RATE_PAGE)) {
            Path file = CONTENT_DIR.resolve(page);
            Files.createDirectories(file.getParent());
            Files.writeString(file, "# " + page + "\n", StandardCharsets.UTF_8);
        }
        Files.deleteIfExists(CONTENT_DIR.resolve("doprinosi/mirovinsko.mdx"));
    }

    @Test
    void testProcess_AppliesToEveryMappedFile() throws IOException {
        LOG.info("Testing process - registered concept with two content files");

        String eventId = queue("pdv-prag", true);

        ProcessOutcome outcome = processor.process(eventId);

        assertThat(outcome, is(ProcessOutcome.DONE));
        for (String page : List.of(THRESHOLD_PAGE, FLAT_RATE_PAGE)) {
            String content = Files.readString(CONTENT_DIR.resolve(page), StandardCharsets.UTF_8);
            assertThat(page, content, containsString(FileSystemContentTarget.marker(eventId)));
            assertThat(page, content, containsString("- **RULE_RELEASED** `pdv-prag`: 60000 EUR (effective 2025-01-01)"));
        }
        QuarkusTransaction.requiringNew().run(() -> {
            ContentSyncEvent event = ContentSyncEvent.findById(eventId);
            assertThat(event.status, is(ContentSyncStatus.DONE));
            assertThat(event.attempts, is(1));
            assertThat(event.lockVersion, is(2L));
            assertThat(event.processedAt, is(notNullValue()));
        });
    }

    @Test
    void testProcess_RedeliveryIsNotClaimed() throws IOException {
        LOG.info("Testing process - second delivery of a finished event");

        String eventId = queue("pdv-prag", true);
        assertThat(processor.process(eventId), is(ProcessOutcome.DONE));

        assertThat(processor.process(eventId), is(ProcessOutcome.NOT_CLAIMED));
        assertThat(processor.process("no-such-event"), is(ProcessOutcome.NOT_CLAIMED));

        String content = Files.readString(CONTENT_DIR.resolve(THRESHOLD_PAGE), StandardCharsets.UTF_8);
        assertThat("Entry written once", content.split(FileSystemContentTarget.marker(eventId), -1).length, is(2));
    }

    @Test
    void testProcess_AlreadyAppliedIsSkipped() throws IOException {
        LOG.info("Testing process - content files already carry the event");

        String eventId = queue("pdv-prag", true);
        for (String page : List.of(THRESHOLD_PAGE, FLAT_RATE_PAGE)) {
            Files.writeString(CONTENT_DIR.resolve(page),
                    "# page\n" + FileSystemContentTarget.marker(eventId) + "\n", StandardCharsets.UTF_8);
        }

        assertThat(processor.process(eventId), is(ProcessOutcome.SKIPPED));
        QuarkusTransaction.requiringNew().run(() ->
                assertThat(ContentSyncEvent.<ContentSyncEvent>findById(eventId).status, is(ContentSyncStatus.SKIPPED)));
    }

    @Test
    void testProcess_UnmappedConceptIsDeadLettered() {
        LOG.info("Testing process - concept without content files");

        String eventId = queue(unique("nepoznat-pojam"), true);

        assertThat(processor.process(eventId), is(ProcessOutcome.DEAD_LETTERED));
        assertDeadLettered(eventId, DeadLetterReason.UNMAPPED_CONCEPT);
    }

    @Test
    void testProcess_ReleaseWithoutPointersIsDeadLettered() {
        LOG.info("Testing process - released rule without evidence");

        String eventId = queue("pdv-prag", false);

        assertThat(processor.process(eventId), is(ProcessOutcome.DEAD_LETTERED));
        assertDeadLettered(eventId, DeadLetterReason.MISSING_POINTERS);
    }

    @Test
    void testProcess_MissingContentFileIsDeadLettered() {
        LOG.info("Testing process - registered file does not exist");

        String eventId = queue("doprinosi-mirovinsko-osiguranje", true);

        assertThat(processor.process(eventId), is(ProcessOutcome.DEAD_LETTERED));
        assertDeadLettered(eventId, DeadLetterReason.CONTENT_NOT_FOUND);
    }

    @Test
    void testRequeue_NeedsCurrentVersion() {
        LOG.info("Testing requeue of a dead-lettered event");

        String eventId = queue(unique("nepoznat-pojam"), true);
        processor.process(eventId);

        List<String> deadLetters = QuarkusTransaction.requiringNew().call(() ->
                admin.listDeadLetters(1000).stream().map(e -> e.eventId).toList());
        assertThat(deadLetters, hasItem(eventId));

        long version = QuarkusTransaction.requiringNew().call(() ->
                ContentSyncEvent.<ContentSyncEvent>findById(eventId).lockVersion);
        assertThrows(StaleVersionException.class, () -> admin.requeue(eventId, version - 1, "operator"));

        admin.requeue(eventId, version, "operator");

        QuarkusTransaction.requiringNew().run(() -> {
            ContentSyncEvent event = ContentSyncEvent.findById(eventId);
            assertThat(event.status, is(ContentSyncStatus.PENDING));
            assertThat(event.attempts, is(0));
            assertThat(event.deadLetterReason, is(nullValue()));
            assertThat(event.lockVersion, is(version + 1));
        });
    }

    private String queue(String concept, boolean withPointer) {
        return QuarkusTransaction.requiringNew().call(() -> {
            LocalDate from = LocalDate.of(2025, 1, 1);
            SourcePointer[] pointers = new SourcePointer[0];
            if (withPointer) {
                Evidence evidence = evidence(unique("https://narodne-novine.nn.hr/clanci/sluzbeni/pdv"),
                        "Prag za ulazak u sustav PDV-a iznosi 60.000,00 eura.", AuthorityLevel.LAW);
                pointers = new SourcePointer[]{groundedPointer(evidence, concept, "60000 EUR",
                        "Prag za ulazak u sustav PDV-a iznosi 60.000,00 eura", 0.95, from)};
            }
            RegulatoryRule rule = rule(concept, "60000 EUR", RuleStatus.PUBLISHED, RiskTier.T0, from, 0.95, pointers);
            return emitter.enqueue(rule, ContentSyncEventType.RULE_RELEASED, null).eventId();
        });
    }

    private static void assertDeadLettered(String eventId, DeadLetterReason reason) {
        QuarkusTransaction.requiringNew().run(() -> {
            ContentSyncEvent event = ContentSyncEvent.findById(eventId);
            assertThat(event.status, is(ContentSyncStatus.DEAD_LETTERED));
            assertThat(event.deadLetterReason, is(reason));
            assertThat(event.deadLetterNote, is(notNullValue()));
        });
    }
}
