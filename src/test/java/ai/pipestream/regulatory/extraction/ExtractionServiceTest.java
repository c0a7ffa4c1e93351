package ai.pipestream.regulatory.extraction;

import ai.pipestream.regulatory.entity.AgentRun;
import ai.pipestream.regulatory.entity.AgentRunStatus;
import ai.pipestream.regulatory.entity.AuthorityLevel;
import ai.pipestream.regulatory.entity.Evidence;
import ai.pipestream.regulatory.entity.MatchType;
import ai.pipestream.regulatory.entity.SourcePointer;
import ai.pipestream.regulatory.entity.ValueType;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static ai.pipestream.regulatory.PipelineFixtures.evidence;
import static ai.pipestream.regulatory.PipelineFixtures.unique;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for turning extractor candidates into unverified source pointers.
 */
@QuarkusTest
public class ExtractionServiceTest {

    private static final Logger LOG = Logger.getLogger(ExtractionServiceTest.class);
    private static final String TEXT = "Članak 90.\nPrag za ulazak u sustav PDV-a iznosi 60.000,00 eura.";

    @InjectMock
    Extractor extractor;

    @Inject
    ExtractionService extractionService;

    @Test
    void testExtractEvidence_StoresCandidatesAsPendingPointers() {
        LOG.info("Testing extractEvidence - two usable candidates and one without quote");

        UUID evidenceId = newEvidence();
        ExtractedCandidate dated = new ExtractedCandidate("VAT threshold", " 60000 EUR ",
                "Prag za ulazak u sustav PDV-a iznosi 60.000,00 eura", 1.3, "currency", "čl. 90.", "NN 73/2013",
                LocalDate.of(2025, 1, 1), null);
        when(extractor.extract(any(ExtractionRequest.class))).thenReturn(new ExtractionResult(List.of(
                dated,
                ExtractedCandidate.of("prag-pdv", "60000 EUR", "iznosi 60.000,00 eura", 0.8),
                ExtractedCandidate.of("pdv-prag", "60000 EUR", " ", 0.9)), List.of("low OCR quality")));

        ExtractionOutcome outcome = extractionService.extractEvidence(evidenceId);

        assertThat(outcome.status(), is(AgentRunStatus.COMPLETED));
        assertThat(outcome.pointersCreated(), is(3));
        QuarkusTransaction.requiringNew().run(() -> {
            List<SourcePointer> all = SourcePointer.listByEvidence(evidenceId);
            assertThat(all, hasSize(3));
            List<SourcePointer> pointers = all.stream()
                    .filter(p -> p.matchType == MatchType.PENDING_VERIFICATION)
                    .toList();
            assertThat(pointers, hasSize(2));

            SourcePointer unquoted = all.stream()
                    .filter(p -> p.matchType == MatchType.NOT_FOUND)
                    .findFirst()
                    .orElseThrow();
            assertThat("Claim without quote is kept", unquoted.conceptSlug, is("pdv-prag"));
            assertThat(unquoted.verificationNote, containsString("quote"));
            assertThat(unquoted.verifiedAt, is(notNullValue()));
            assertThat(unquoted.confidence, is(0.9));

            for (SourcePointer pointer : pointers) {
                assertThat(pointer.conceptSlug, is("pdv-prag"));
                assertThat(pointer.matchType, is(MatchType.PENDING_VERIFICATION));
                assertThat(pointer.agentRunId, is(outcome.runId()));
                assertThat(pointer.extractedValue, is("60000 EUR"));
                assertThat(pointer.confidence, is(both(greaterThanOrEqualTo(0.0)).and(lessThanOrEqualTo(1.0))));
            }
            SourcePointer fromDated = pointers.stream().filter(p -> "VAT threshold".equals(p.domain)).findFirst().orElseThrow();
            assertThat(fromDated.valueType, is(ValueType.CURRENCY));
            assertThat("Confidence is clamped", fromDated.confidence, is(1.0));
            assertThat(fromDated.effectiveFrom, is(LocalDate.of(2025, 1, 1)));

            AgentRun run = AgentRun.findById(outcome.runId());
            assertThat(run.status, is(AgentRunStatus.COMPLETED));
            assertThat(run.candidateCount, is(3));
            assertThat(run.warnings, containsString("low OCR quality"));
            assertThat(run.warnings, containsString("recorded as NOT_FOUND"));
        });
    }

    @Test
    void testExtractEvidence_SameContentIsExtractedOnce() {
        LOG.info("Testing extractEvidence - second call for unchanged content");

        UUID evidenceId = newEvidence();
        when(extractor.extract(any(ExtractionRequest.class))).thenReturn(new ExtractionResult(List.of(), List.of()));

        ExtractionOutcome first = extractionService.extractEvidence(evidenceId);
        ExtractionOutcome second = extractionService.extractEvidence(evidenceId);

        assertThat(first.skipped(), is(false));
        assertThat(second.skipped(), is(true));
        assertThat(second.note(), startsWith("already extracted"));
        verify(extractor, times(1)).extract(any(ExtractionRequest.class));
        assertThat(extractionService.findPendingEvidence(10_000), not(hasItem(evidenceId)));
    }

    @Test
    void testExtractEvidence_ExtractorFailureFailsRun() {
        LOG.info("Testing extractEvidence - extractor throws");

        UUID evidenceId = newEvidence();
        when(extractor.extract(any(ExtractionRequest.class))).thenThrow(new IllegalStateException("extractor timed out"));

        ExtractionOutcome outcome = extractionService.extractEvidence(evidenceId);

        assertThat(outcome.status(), is(AgentRunStatus.FAILED));
        QuarkusTransaction.requiringNew().run(() -> {
            AgentRun run = AgentRun.findById(outcome.runId());
            assertThat(run.status, is(AgentRunStatus.FAILED));
            assertThat(run.errorMessage, is("extractor timed out"));
            assertThat(run.completedAt, is(notNullValue()));
        });
        assertThat("Failed runs are retried", extractionService.findPendingEvidence(10_000), hasItem(evidenceId));
    }

    @Test
    void testExtractEvidence_UnknownEvidenceIsSkipped() {
        LOG.info("Testing extractEvidence - unknown evidence id");

        ExtractionOutcome outcome = extractionService.extractEvidence(UUID.randomUUID());

        assertThat(outcome.skipped(), is(true));
        assertThat(outcome.note(), is("evidence not found"));
        verify(extractor, never()).extract(any(ExtractionRequest.class));
    }

    private static UUID newEvidence() {
        return QuarkusTransaction.requiringNew().call(() ->
                evidence(unique("https://narodne-novine.nn.hr/clanci/sluzbeni/2024_12_152"), TEXT, AuthorityLevel.LAW).id);
    }
}
