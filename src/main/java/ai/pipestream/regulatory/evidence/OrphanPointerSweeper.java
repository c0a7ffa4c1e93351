package ai.pipestream.regulatory.evidence;

import ai.pipestream.regulatory.entity.MatchKind;
import ai.pipestream.regulatory.entity.MatchType;
import ai.pipestream.regulatory.entity.SourcePointer;
import ai.pipestream.regulatory.review.EvidenceInvalidationService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Marks pointers whose evidence reference no longer resolves as NOT_FOUND and
 * invalidates the rules that cite them.
 */
@ApplicationScoped
public class OrphanPointerSweeper {

    private static final Logger LOG = Logger.getLogger(OrphanPointerSweeper.class);

    @Inject
    EvidenceLookup evidenceLookup;

    @Inject
    EvidenceInvalidationService invalidationService;

    @Transactional
    public int sweep() {
        List<UUID> evidenceIds = SourcePointer.getEntityManager()
                .createQuery("select distinct p.evidenceId from SourcePointer p where p.matchType <> :notFound",
                        UUID.class)
                .setParameter("notFound", MatchType.NOT_FOUND)
                .getResultList();

        List<UUID> orphaned = new ArrayList<>();
        Instant now = Instant.now();
        for (UUID evidenceId : evidenceIds) {
            if (evidenceLookup.resolve(new EvidenceRef(evidenceId)).isPresent()) {
                continue;
            }
            for (SourcePointer pointer : SourcePointer.listByEvidence(evidenceId)) {
                if (pointer.matchType == MatchType.NOT_FOUND) {
                    continue;
                }
                pointer.matchType = MatchType.NOT_FOUND;
                pointer.matchKind = MatchKind.NONE;
                pointer.verificationNote = "evidence " + evidenceId + " no longer exists";
                pointer.verifiedAt = now;
                orphaned.add(pointer.id);
            }
        }

        if (!orphaned.isEmpty()) {
            LOG.warnf("Orphan sweep: %d pointers lost their evidence", orphaned.size());
            invalidationService.invalidateForPointers(orphaned);
        }
        return orphaned.size();
    }
}
