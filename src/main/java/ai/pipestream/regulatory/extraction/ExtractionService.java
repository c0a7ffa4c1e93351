package ai.pipestream.regulatory.extraction;

import ai.pipestream.regulatory.compose.ConceptResolver;
import ai.pipestream.regulatory.entity.AgentRun;
import ai.pipestream.regulatory.entity.AgentRunStatus;
import ai.pipestream.regulatory.entity.Evidence;
import ai.pipestream.regulatory.entity.MatchKind;
import ai.pipestream.regulatory.entity.MatchType;
import ai.pipestream.regulatory.entity.SourcePointer;
import ai.pipestream.regulatory.entity.ValueType;
import ai.pipestream.regulatory.evidence.EvidenceLookup;
import ai.pipestream.regulatory.evidence.EvidenceRef;
import ai.pipestream.regulatory.metrics.PipelineMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Calls the extractor for evidence rows and stores its candidates as unverified pointers.
 * A candidate lacking its domain, value or quote cannot be verified; it is stored
 * as a NOT_FOUND pointer with a note so the failed claim stays on record.
 * <p>
 * The extractor call happens between two short transactions: one that opens an
 * {@link AgentRun}, and one that stores the candidates and closes the run.
 */
@ApplicationScoped
public class ExtractionService {

    private static final Logger LOG = Logger.getLogger(ExtractionService.class);

    static final String UNCLASSIFIED = "unclassified";

    @Inject
    Extractor extractor;

    @Inject
    EvidenceLookup evidenceLookup;

    @Inject
    ConceptResolver conceptResolver;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    PipelineMetrics metrics;

    /**
     * Live evidence whose current content has no completed or running extraction.
     */
    public List<UUID> findPendingEvidence(int limit) {
        return QuarkusTransaction.requiringNew().call(() -> Evidence.getEntityManager()
                .createQuery("select e.id from Evidence e where e.deletedAt is null and not exists ("
                        + "select r.id from AgentRun r where r.evidenceId = e.id "
                        + "and r.evidenceContentHash = e.contentHash and r.status in :statuses) "
                        + "order by e.fetchedAt", UUID.class)
                .setParameter("statuses", List.of(AgentRunStatus.COMPLETED, AgentRunStatus.RUNNING))
                .setMaxResults(limit)
                .getResultList());
    }

    public ExtractionOutcome extractEvidence(UUID evidenceId) {
        Prepared prepared = QuarkusTransaction.requiringNew().call(() -> prepare(evidenceId));
        if (prepared.skipNote() != null) {
            LOG.debugf("Extraction skipped: evidenceId=%s, reason=%s", evidenceId, prepared.skipNote());
            return ExtractionOutcome.skipped(evidenceId, prepared.skipNote());
        }

        ExtractionResult result;
        try {
            result = extractor.extract(new ExtractionRequest(evidenceId.toString(), prepared.url(), prepared.text()));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Extractor call failed: evidenceId=%s, runId=%s", evidenceId, prepared.runId());
            QuarkusTransaction.requiringNew().run(() -> failRun(prepared.runId(), e));
            metrics.recordExtraction(AgentRunStatus.FAILED);
            return new ExtractionOutcome(evidenceId, prepared.runId(), AgentRunStatus.FAILED, 0, e.getMessage());
        }

        int created = QuarkusTransaction.requiringNew().call(() -> complete(prepared, result));
        metrics.recordExtraction(AgentRunStatus.COMPLETED);
        LOG.infof("Extraction completed: evidenceId=%s, runId=%s, candidates=%d, pointers=%d, warnings=%d",
                evidenceId, prepared.runId(), result.extractions().size(), created, result.warnings().size());
        return new ExtractionOutcome(evidenceId, prepared.runId(), AgentRunStatus.COMPLETED, created, null);
    }

    private Prepared prepare(UUID evidenceId) {
        Optional<Evidence> resolved = evidenceLookup.resolve(new EvidenceRef(evidenceId));
        if (resolved.isEmpty()) {
            return Prepared.skip("evidence not found");
        }
        Evidence evidence = resolved.get();
        if (AgentRun.findCompleted(evidence.id, evidence.contentHash).isPresent()) {
            return Prepared.skip("already extracted for content " + evidence.contentHash);
        }
        if (AgentRun.count("evidenceId = ?1 and evidenceContentHash = ?2 and status = ?3",
                evidence.id, evidence.contentHash, AgentRunStatus.RUNNING) > 0) {
            return Prepared.skip("extraction already running");
        }
        Optional<String> text = evidenceLookup.groundingText(evidence);
        if (text.isEmpty()) {
            return Prepared.skip("no text available yet");
        }

        AgentRun run = new AgentRun();
        run.evidenceId = evidence.id;
        run.evidenceContentHash = evidence.contentHash;
        run.status = AgentRunStatus.RUNNING;
        run.startedAt = Instant.now();
        run.persist();

        LocalDate fetchDate = LocalDate.ofInstant(evidence.fetchedAt, ZoneOffset.UTC);
        return new Prepared(run.id, evidence.id, evidence.url, text.get(), fetchDate, null);
    }

    private int complete(Prepared prepared, ExtractionResult result) {
        AgentRun run = AgentRun.findById(prepared.runId());
        List<String> warnings = new ArrayList<>(result.warnings());
        Instant now = Instant.now();
        int created = 0;
        for (ExtractedCandidate candidate : result.extractions()) {
            List<String> missing = missingFields(candidate);
            SourcePointer pointer = new SourcePointer();
            pointer.evidenceId = prepared.evidenceId();
            pointer.agentRunId = run.id;
            pointer.domain = isBlank(candidate.domain()) ? UNCLASSIFIED : candidate.domain().trim();
            pointer.conceptSlug = isBlank(candidate.domain()) ? UNCLASSIFIED : conceptResolver.resolve(candidate.domain());
            pointer.extractedValue = isBlank(candidate.extractedValue()) ? "" : candidate.extractedValue().trim();
            pointer.valueType = ValueType.fromExternal(candidate.valueType());
            pointer.exactQuote = isBlank(candidate.exactQuote()) ? "" : candidate.exactQuote();
            pointer.articleReference = candidate.articleReference();
            pointer.lawReference = candidate.lawReference();
            pointer.confidence = Math.max(0.0, Math.min(1.0, candidate.confidence()));
            pointer.effectiveFrom = candidate.effectiveFrom() != null ? candidate.effectiveFrom() : prepared.fetchDate();
            pointer.effectiveUntil = candidate.effectiveUntil();
            pointer.matchType = MatchType.PENDING_VERIFICATION;
            if (!missing.isEmpty()) {
                pointer.matchType = MatchType.NOT_FOUND;
                pointer.matchKind = MatchKind.NONE;
                pointer.verificationNote = "extractor candidate without " + String.join(", ", missing);
                pointer.verifiedAt = now;
                warnings.add("unverifiable candidate recorded as NOT_FOUND: " + pointer.domain
                        + " (missing " + String.join(", ", missing) + ")");
                metrics.recordPointerVerified(MatchType.NOT_FOUND);
            }
            pointer.createdAt = now;
            pointer.persist();
            created++;
        }
        run.status = AgentRunStatus.COMPLETED;
        run.candidateCount = result.extractions().size();
        run.warnings = toJson(warnings);
        run.completedAt = now;
        return created;
    }

    private void failRun(UUID runId, RuntimeException failure) {
        AgentRun run = AgentRun.findById(runId);
        run.status = AgentRunStatus.FAILED;
        String message = String.valueOf(failure.getMessage());
        run.errorMessage = message.length() > 2000 ? message.substring(0, 2000) : message;
        run.completedAt = Instant.now();
    }

    private String toJson(List<String> warnings) {
        try {
            return objectMapper.writeValueAsString(warnings);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize extraction warnings", e);
        }
    }

    private static List<String> missingFields(ExtractedCandidate candidate) {
        List<String> missing = new ArrayList<>();
        if (isBlank(candidate.domain())) {
            missing.add("domain");
        }
        if (isBlank(candidate.extractedValue())) {
            missing.add("value");
        }
        if (isBlank(candidate.exactQuote())) {
            missing.add("quote");
        }
        return missing;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record Prepared(UUID runId, UUID evidenceId, String url, String text, LocalDate fetchDate, String skipNote) {

        static Prepared skip(String note) {
            return new Prepared(null, null, null, null, null, note);
        }
    }
}
