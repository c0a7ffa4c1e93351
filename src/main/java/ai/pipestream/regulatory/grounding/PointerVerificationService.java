package ai.pipestream.regulatory.grounding;

import ai.pipestream.regulatory.entity.Evidence;
import ai.pipestream.regulatory.entity.MatchKind;
import ai.pipestream.regulatory.entity.MatchType;
import ai.pipestream.regulatory.entity.SourcePointer;
import ai.pipestream.regulatory.evidence.EvidenceLookup;
import ai.pipestream.regulatory.metrics.PipelineMetrics;
import ai.pipestream.regulatory.review.EvidenceInvalidationService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Checks PENDING_VERIFICATION pointers against the text of their evidence.
 * NOT_FOUND pointers are kept. Every rule citing a checked pointer is
 * re-evaluated, since a re-grounded pointer may be weaker than before.
 */
@ApplicationScoped
public class PointerVerificationService {

    private static final Logger LOG = Logger.getLogger(PointerVerificationService.class);

    @Inject
    EvidenceLookup evidenceLookup;

    @Inject
    EvidenceInvalidationService invalidationService;

    @Inject
    PipelineMetrics metrics;

    @Transactional
    public VerificationReport verifyPending(int limit) {
        List<SourcePointer> pending = SourcePointer.listPendingVerification(limit);
        List<UUID> lost = new ArrayList<>();
        List<UUID> checked = new ArrayList<>();
        int grounded = 0;
        int waiting = 0;
        Instant now = Instant.now();

        for (SourcePointer pointer : pending) {
            Optional<Evidence> evidence = evidenceLookup.resolve(pointer.evidenceRef());
            if (evidence.isEmpty()) {
                markNotFound(pointer, "evidence " + pointer.evidenceId + " does not exist", now);
                lost.add(pointer.id);
                checked.add(pointer.id);
                continue;
            }
            Optional<String> text = evidenceLookup.groundingText(evidence.get());
            if (text.isEmpty()) {
                waiting++;
                continue;
            }

            GroundingResult result = GroundingVerifier.verify(text.get(), pointer.exactQuote);
            pointer.matchType = result.matchType();
            pointer.matchKind = result.matchKind();
            pointer.matchStart = result.found() ? result.start() : null;
            pointer.matchEnd = result.found() ? result.end() : null;
            pointer.verifiedContentHash = evidence.get().contentHash;
            pointer.verificationNote = result.describe();
            pointer.verifiedAt = now;
            metrics.recordPointerVerified(pointer.matchType);
            checked.add(pointer.id);

            if (result.found()) {
                grounded++;
            } else {
                lost.add(pointer.id);
                LOG.warnf("Quote not grounded: pointerId=%s, evidenceId=%s, concept=%s, %s",
                        pointer.id, pointer.evidenceId, pointer.conceptSlug, result.describe());
            }
        }

        if (!checked.isEmpty()) {
            invalidationService.invalidateForPointers(checked);
        }
        if (!pending.isEmpty()) {
            LOG.infof("Pointer verification: checked=%d, grounded=%d, notFound=%d, waitingForText=%d",
                    pending.size(), grounded, lost.size(), waiting);
        }
        return new VerificationReport(pending.size(), grounded, lost.size(), waiting);
    }

    private void markNotFound(SourcePointer pointer, String note, Instant now) {
        pointer.matchType = MatchType.NOT_FOUND;
        pointer.matchKind = MatchKind.NONE;
        pointer.matchStart = null;
        pointer.matchEnd = null;
        pointer.verificationNote = note;
        pointer.verifiedAt = now;
        metrics.recordPointerVerified(MatchType.NOT_FOUND);
        LOG.warnf("Pointer lost its evidence: pointerId=%s, evidenceId=%s", pointer.id, pointer.evidenceId);
    }
}
