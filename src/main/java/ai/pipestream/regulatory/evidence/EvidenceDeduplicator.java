package ai.pipestream.regulatory.evidence;

import ai.pipestream.regulatory.entity.AgentRun;
import ai.pipestream.regulatory.entity.Evidence;
import ai.pipestream.regulatory.entity.SourcePointer;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;

/**
 * Merges live evidence rows that share (url, contentHash) into the newest one.
 * <p>
 * Each duplicate group is migrated and soft-deleted in its own transaction, so
 * a failure leaves earlier groups merged and the failed group untouched.
 */
@ApplicationScoped
public class EvidenceDeduplicator {

    private static final Logger LOG = Logger.getLogger(EvidenceDeduplicator.class);

    private static final String DUPLICATE_GROUPS =
            "select e.url, e.contentHash from Evidence e where e.deletedAt is null "
                    + "group by e.url, e.contentHash having count(e) > 1";

    public DedupReport deduplicate() {
        List<Object[]> groups = QuarkusTransaction.requiringNew().call(this::findDuplicateGroups);
        LOG.infof("Evidence dedup: %d duplicate groups found", groups.size());

        int merged = 0;
        int pointers = 0;
        int runs = 0;
        for (Object[] group : groups) {
            String url = (String) group[0];
            String contentHash = (String) group[1];
            GroupOutcome outcome = QuarkusTransaction.requiringNew().call(() -> mergeGroup(url, contentHash));
            merged += outcome.rowsMerged();
            pointers += outcome.pointersMigrated();
            runs += outcome.agentRunsMigrated();
        }

        long remaining = QuarkusTransaction.requiringNew().call(() -> (long) findDuplicateGroups().size());
        if (remaining > 0) {
            LOG.warnf("Evidence dedup post-check found %d duplicate groups remaining", remaining);
        }
        LOG.infof("Evidence dedup complete: groups=%d, merged=%d, pointersMigrated=%d, agentRunsMigrated=%d",
                groups.size(), merged, pointers, runs);
        return new DedupReport(groups.size(), merged, pointers, runs, remaining);
    }

    public long countDuplicateGroups() {
        return QuarkusTransaction.requiringNew().call(() -> (long) findDuplicateGroups().size());
    }

    private List<Object[]> findDuplicateGroups() {
        return Evidence.getEntityManager().createQuery(DUPLICATE_GROUPS, Object[].class).getResultList();
    }

    private GroupOutcome mergeGroup(String url, String contentHash) {
        List<Evidence> rows = Evidence.list(
                "url = ?1 and contentHash = ?2 and deletedAt is null order by fetchedAt desc, id desc",
                url, contentHash);
        if (rows.size() < 2) {
            return new GroupOutcome(0, 0, 0);
        }
        Evidence survivor = rows.get(0);
        Instant now = Instant.now();
        int pointers = 0;
        int runs = 0;
        for (Evidence duplicate : rows.subList(1, rows.size())) {
            pointers += SourcePointer.update("evidenceId = ?1 where evidenceId = ?2", survivor.id, duplicate.id);
            runs += AgentRun.update("evidenceId = ?1 where evidenceId = ?2", survivor.id, duplicate.id);
            duplicate.deletedAt = now;
            duplicate.mergedIntoId = survivor.id;
            LOG.debugf("Merged evidence %s into %s", duplicate.id, survivor.id);
        }
        LOG.infof("Merged duplicate evidence: url=%s, survivor=%s, merged=%d, pointers=%d, agentRuns=%d",
                url, survivor.id, rows.size() - 1, pointers, runs);
        return new GroupOutcome(rows.size() - 1, pointers, runs);
    }

    private record GroupOutcome(int rowsMerged, int pointersMigrated, int agentRunsMigrated) {
    }
}
