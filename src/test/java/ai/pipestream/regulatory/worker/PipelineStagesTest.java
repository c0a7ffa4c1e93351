package ai.pipestream.regulatory.worker;

import ai.pipestream.regulatory.entity.AuthorityLevel;
import ai.pipestream.regulatory.entity.ContentClass;
import ai.pipestream.regulatory.entity.MatchType;
import ai.pipestream.regulatory.entity.ParsedDocument;
import ai.pipestream.regulatory.entity.RegulatoryRule;
import ai.pipestream.regulatory.entity.RiskTier;
import ai.pipestream.regulatory.entity.RuleStatus;
import ai.pipestream.regulatory.entity.SourcePointer;
import ai.pipestream.regulatory.evidence.EvidenceStore;
import ai.pipestream.regulatory.evidence.FetchedSource;
import ai.pipestream.regulatory.extraction.ExtractedCandidate;
import ai.pipestream.regulatory.extraction.ExtractionRequest;
import ai.pipestream.regulatory.extraction.ExtractionResult;
import ai.pipestream.regulatory.extraction.Extractor;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static ai.pipestream.regulatory.PipelineFixtures.unique;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Runs one pipeline pass from fetched evidence to a rule waiting for review.
 */
@QuarkusTest
public class PipelineStagesTest {

    private static final Logger LOG = Logger.getLogger(PipelineStagesTest.class);
    private static final String TEXT = String.join("\n",
            "Članak 90.",
            "(1) Obveznik može ući u sustav PDV-a ako vrijednost isporuka prijeđe 60.000,00 eura.");

    @InjectMock
    Extractor extractor;

    @Inject
    EvidenceStore evidenceStore;

    @Inject
    PipelineStages stages;

    @Test
    void testRunOnce_EvidenceBecomesRuleUnderReview() {
        LOG.info("Testing runOnce - evidence to rule");

        String concept = unique("obveznik-ulaz-u-sustav-pdv");
        String url = unique("https://narodne-novine.nn.hr/clanci/sluzbeni/2024_12_152_2500");
        UUID evidenceId = evidenceStore.ingest(new FetchedSource(url, ContentClass.PDF_TEXT, TEXT,
                AuthorityLevel.LAW, Instant.now())).evidence().id;
        when(extractor.extract(any(ExtractionRequest.class))).thenAnswer(invocation -> {
            ExtractionRequest request = invocation.getArgument(0);
            if (!url.equals(request.url())) {
                return new ExtractionResult(List.of(), List.of());
            }
            return new ExtractionResult(List.of(ExtractedCandidate.of(concept, "60000 EUR",
                    "prijeđe 60.000,00 eura", 0.8)), List.of());
        });

        List<StageOutcome> outcomes = stages.runOnce();

        assertThat(outcomes.stream().map(StageOutcome::stage).toList(), contains(
                "parse", "extract", "verify", "orphan-sweep", "compose", "resubmit",
                "detect-conflicts", "resolve-conflicts", "auto-review", "announce-effective", "drain-content-sync"));
        assertThat(outcomes.stream().filter(o -> !o.succeeded()).toList(), is(empty()));
        QuarkusTransaction.requiringNew().run(() -> {
            assertThat(ParsedDocument.findLatest(evidenceId).isPresent(), is(true));
            List<SourcePointer> pointers = SourcePointer.listByEvidence(evidenceId);
            assertThat(pointers, hasSize(1));
            SourcePointer pointer = pointers.get(0);
            assertThat(pointer.matchType, is(MatchType.GROUNDED));
            assertThat(pointer.composedAt, is(notNullValue()));

            List<RegulatoryRule> rules = RegulatoryRule.list("conceptSlug", concept);
            assertThat(rules, hasSize(1));
            RegulatoryRule rule = rules.get(0);
            assertThat("Confidence below the auto-approval floor waits for review",
                    rule.status, is(RuleStatus.PENDING_REVIEW));
            assertThat(rule.riskTier, is(RiskTier.T3));
            assertThat(rule.confidence, is(0.8));
            assertThat(rule.authorityLevel, is(AuthorityLevel.LAW));
            assertThat(rule.sourcePointers, contains(pointer));
        });
    }
}
