package ai.pipestream.regulatory.health;

import ai.pipestream.regulatory.config.PipelineConfiguration;
import ai.pipestream.regulatory.entity.AgentRun;
import ai.pipestream.regulatory.entity.ConflictStatus;
import ai.pipestream.regulatory.entity.ContentClass;
import ai.pipestream.regulatory.entity.ContentSyncEvent;
import ai.pipestream.regulatory.entity.ContentSyncStatus;
import ai.pipestream.regulatory.entity.Evidence;
import ai.pipestream.regulatory.entity.OcrStatus;
import ai.pipestream.regulatory.entity.RegulatoryConflict;
import ai.pipestream.regulatory.release.ReleaseVerifier;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the health gates over persisted pipeline state.
 */
@ApplicationScoped
public class HealthGateService {

    private static final Logger LOG = Logger.getLogger(HealthGateService.class);

    static final String OCR_FAILURE_RATE = "ocr-failure-rate";
    static final String STUCK_RUNS = "stuck-extraction-runs";
    static final String SYNC_BACKLOG = "content-sync-backlog";
    static final String STALLED_SYNC = "stalled-content-sync";
    static final String OPEN_CONFLICTS = "open-conflicts";
    static final String DEAD_LETTERS = "dead-letters";
    static final String RELEASE_INTEGRITY = "release-integrity";

    @Inject
    PipelineConfiguration config;

    @Inject
    ReleaseVerifier releaseVerifier;

    @Transactional
    public GateReport evaluate() {
        PipelineConfiguration.Health health = config.health();
        List<GateResult> results = new ArrayList<>();

        long scanned = Evidence.count("contentClass = ?1 and deletedAt is null", ContentClass.PDF_SCANNED);
        long ocrFailed = Evidence.count("contentClass = ?1 and deletedAt is null and ocrStatus = ?2",
                ContentClass.PDF_SCANNED, OcrStatus.FAILED);
        results.add(HealthGateEvaluator.rate(OCR_FAILURE_RATE, ocrFailed, scanned,
                health.ocrFailureRateWarn(), health.ocrFailureRateFail()));

        Instant stuckBefore = Instant.now().minus(health.stuckRunThreshold());
        results.add(HealthGateEvaluator.mustBeZero(STUCK_RUNS, AgentRun.listStuck(stuckBefore).size(),
                GateStatus.FAIL));

        results.add(HealthGateEvaluator.threshold(SYNC_BACKLOG, ContentSyncEvent.countBacklog(),
                health.backlogWarn(), health.backlogFail()));

        Instant leaseExpiredBefore = Instant.now().minus(config.contentSync().processingLease());
        results.add(HealthGateEvaluator.mustBeZero(STALLED_SYNC, ContentSyncEvent.countStalled(leaseExpiredBefore),
                GateStatus.WARN));

        results.add(HealthGateEvaluator.mustBeZero(OPEN_CONFLICTS,
                RegulatoryConflict.count("status", ConflictStatus.OPEN), GateStatus.WARN));

        results.add(HealthGateEvaluator.mustBeZero(DEAD_LETTERS,
                ContentSyncEvent.count("status", ContentSyncStatus.DEAD_LETTERED), GateStatus.WARN));

        long invalidReleases = releaseVerifier.verifyAll().stream().filter(r -> !r.valid()).count();
        results.add(HealthGateEvaluator.mustBeZero(RELEASE_INTEGRITY, invalidReleases, GateStatus.FAIL));

        GateReport report = new GateReport(results);
        if (report.overall() != GateStatus.PASS) {
            LOG.warnf("Health gates %s: %s", report.overall(), report.summary());
        }
        return report;
    }
}
