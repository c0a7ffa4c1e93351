package ai.pipestream.regulatory.evidence;

import ai.pipestream.regulatory.entity.ArtifactKind;
import ai.pipestream.regulatory.entity.AuthorityLevel;
import ai.pipestream.regulatory.entity.ContentClass;
import ai.pipestream.regulatory.entity.Evidence;
import ai.pipestream.regulatory.entity.EvidenceArtifact;
import ai.pipestream.regulatory.entity.MatchKind;
import ai.pipestream.regulatory.entity.MatchType;
import ai.pipestream.regulatory.entity.OcrStatus;
import ai.pipestream.regulatory.entity.SourcePointer;
import ai.pipestream.regulatory.entity.StalenessStatus;
import ai.pipestream.regulatory.exception.EntityNotFoundException;
import ai.pipestream.regulatory.parser.HtmlText;
import ai.pipestream.regulatory.util.ContentHashing;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Content-addressed store of fetched sources and their derived text artifacts.
 */
@ApplicationScoped
public class EvidenceStore implements EvidenceLookup {

    private static final Logger LOG = Logger.getLogger(EvidenceStore.class);

    /**
     * Stores a fetched source.
     * <p>
     * Fetching content that is already stored for the url returns the existing row.
     * New content for a known url marks the older versions STALE and moves their
     * pointers onto the new row for re-verification.
     */
    @Transactional
    public IngestResult ingest(FetchedSource source) {
        String contentHash = ContentHashing.sha256Hex(source.rawContent());

        Optional<Evidence> existing = Evidence.findLiveByUrlAndHash(source.url(), contentHash);
        if (existing.isPresent()) {
            Evidence evidence = existing.get();
            evidence.stalenessStatus = StalenessStatus.FRESH;
            LOG.debugf("Evidence unchanged: id=%s, url=%s", evidence.id, source.url());
            return new IngestResult(evidence, false, 0);
        }

        List<Evidence> previous = Evidence.listLiveByUrl(source.url());

        Evidence evidence = new Evidence();
        evidence.url = source.url();
        evidence.contentClass = source.contentClass();
        evidence.rawContent = source.rawContent();
        evidence.contentHash = contentHash;
        evidence.authorityLevel = source.authorityLevel() != null ? source.authorityLevel() : AuthorityLevel.PRACTICE;
        evidence.stalenessStatus = StalenessStatus.FRESH;
        evidence.ocrStatus = source.contentClass() == ContentClass.PDF_SCANNED ? OcrStatus.PENDING : OcrStatus.NOT_REQUIRED;
        evidence.fetchedAt = source.fetchedAt() != null ? source.fetchedAt() : Instant.now();
        evidence.createdAt = Instant.now();
        evidence.persist();

        int migrated = 0;
        for (Evidence old : previous) {
            old.stalenessStatus = StalenessStatus.STALE;
            for (SourcePointer pointer : SourcePointer.listByEvidence(old.id)) {
                pointer.evidenceId = evidence.id;
                pointer.matchType = MatchType.PENDING_VERIFICATION;
                pointer.matchKind = MatchKind.NONE;
                pointer.matchStart = null;
                pointer.matchEnd = null;
                pointer.verifiedContentHash = null;
                migrated++;
            }
        }

        if (previous.isEmpty()) {
            LOG.infof("Stored evidence: id=%s, url=%s, class=%s", evidence.id, evidence.url, evidence.contentClass);
        } else {
            LOG.infof("Stored new evidence version: id=%s, url=%s, staleVersions=%d, pointersForReverification=%d",
                    evidence.id, evidence.url, previous.size(), migrated);
        }
        return new IngestResult(evidence, true, migrated);
    }

    /**
     * Adds a derived artifact. Artifacts are immutable; the same content for the
     * same evidence and kind returns the stored row.
     */
    @Transactional
    public EvidenceArtifact addArtifact(UUID evidenceId, ArtifactKind kind, String content, Double ocrConfidence) {
        Evidence.findLive(evidenceId).orElseThrow(() -> EntityNotFoundException.evidence(evidenceId));
        String hash = ContentHashing.sha256Hex(content);
        Optional<EvidenceArtifact> existing = EvidenceArtifact.findByHash(evidenceId, kind, hash);
        if (existing.isPresent()) {
            return existing.get();
        }
        EvidenceArtifact artifact = new EvidenceArtifact();
        artifact.evidenceId = evidenceId;
        artifact.kind = kind;
        artifact.content = content;
        artifact.contentHash = hash;
        artifact.ocrConfidence = ocrConfidence;
        artifact.createdAt = Instant.now();
        artifact.persist();
        LOG.debugf("Stored artifact: evidenceId=%s, kind=%s, hash=%s", evidenceId, kind, hash);
        return artifact;
    }

    /**
     * Records text produced by the OCR collaborator for a scanned PDF.
     */
    @Transactional
    public EvidenceArtifact recordOcrText(UUID evidenceId, String text, double confidence) {
        EvidenceArtifact artifact = addArtifact(evidenceId, ArtifactKind.OCR_TEXT, text, confidence);
        Evidence evidence = Evidence.findById(evidenceId);
        evidence.ocrStatus = OcrStatus.COMPLETED;
        return artifact;
    }

    @Transactional
    public void recordOcrFailure(UUID evidenceId, String reason) {
        Evidence evidence = Evidence.findLive(evidenceId)
                .orElseThrow(() -> EntityNotFoundException.evidence(evidenceId));
        evidence.ocrStatus = OcrStatus.FAILED;
        LOG.warnf("OCR failed: evidenceId=%s, url=%s, reason=%s", evidenceId, evidence.url, reason);
    }

    @Override
    public Optional<Evidence> resolve(EvidenceRef ref) {
        return Evidence.findLive(ref.id());
    }

    @Override
    public Optional<String> groundingText(Evidence evidence) {
        if (evidence.contentClass == ContentClass.PDF_SCANNED) {
            return EvidenceArtifact.findLatest(evidence.id, ArtifactKind.OCR_TEXT).map(a -> a.content);
        }
        Optional<EvidenceArtifact> clean = EvidenceArtifact.findLatest(evidence.id, ArtifactKind.CLEAN_TEXT);
        if (clean.isPresent()) {
            return Optional.of(clean.get().content);
        }
        if (evidence.contentClass == ContentClass.HTML) {
            return Optional.of(HtmlText.toPlainText(evidence.rawContent));
        }
        return Optional.of(evidence.rawContent);
    }
}
