package ai.pipestream.regulatory.worker;

import ai.pipestream.regulatory.arbiter.ConflictArbiter;
import ai.pipestream.regulatory.compose.RuleComposer;
import ai.pipestream.regulatory.config.PipelineConfiguration;
import ai.pipestream.regulatory.contentsync.ContentSyncDispatcher;
import ai.pipestream.regulatory.contentsync.EffectiveRuleAnnouncer;
import ai.pipestream.regulatory.evidence.OrphanPointerSweeper;
import ai.pipestream.regulatory.extraction.ExtractionService;
import ai.pipestream.regulatory.grounding.PointerVerificationService;
import ai.pipestream.regulatory.metrics.PipelineMetrics;
import ai.pipestream.regulatory.parser.ParsedDocumentService;
import ai.pipestream.regulatory.review.RuleReviewer;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.IntSupplier;

/**
 * One pass over every persisted stage, in pipeline order.
 * <p>
 * Stages only talk through the database, so a failing stage is logged and the
 * pass moves on; whatever it left behind is picked up on the next pass.
 */
@ApplicationScoped
public class PipelineStages {

    private static final Logger LOG = Logger.getLogger(PipelineStages.class);

    @Inject
    PipelineConfiguration config;

    @Inject
    ParsedDocumentService parsedDocuments;

    @Inject
    ExtractionService extraction;

    @Inject
    PointerVerificationService pointerVerification;

    @Inject
    OrphanPointerSweeper orphanSweeper;

    @Inject
    RuleComposer composer;

    @Inject
    ConflictArbiter arbiter;

    @Inject
    RuleReviewer reviewer;

    @Inject
    EffectiveRuleAnnouncer effectiveAnnouncer;

    @Inject
    ContentSyncDispatcher dispatcher;

    @Inject
    PipelineMetrics metrics;

    public List<StageOutcome> runOnce() {
        int batch = config.drainer().batchSize();
        List<StageOutcome> outcomes = new ArrayList<>();
        outcomes.add(stage("parse", () -> parseUnparsed(batch)));
        outcomes.add(stage("extract", () -> extractPending(batch)));
        outcomes.add(stage("verify", () -> pointerVerification.verifyPending(batch).checked()));
        outcomes.add(stage("orphan-sweep", orphanSweeper::sweep));
        outcomes.add(stage("compose", () -> composer.composePending(batch).pointersComposed()));
        outcomes.add(stage("resubmit", () -> composer.submitDrafts(batch)));
        outcomes.add(stage("detect-conflicts", arbiter::detectAll));
        outcomes.add(stage("resolve-conflicts", arbiter::autoResolveAll));
        outcomes.add(stage("auto-review", reviewer::autoReview));
        outcomes.add(stage("announce-effective", () -> effectiveAnnouncer.announceDue(LocalDate.now(ZoneOffset.UTC))));
        outcomes.add(stage("drain-content-sync", () -> dispatcher.drainPending().enqueued()));
        return outcomes;
    }

    private int parseUnparsed(int batch) {
        int parsed = 0;
        for (UUID evidenceId : parsedDocuments.findUnparsedEvidence(batch)) {
            if (parsedDocuments.parseLatest(evidenceId).isPresent()) {
                parsed++;
            }
        }
        return parsed;
    }

    private int extractPending(int batch) {
        int extracted = 0;
        for (UUID evidenceId : extraction.findPendingEvidence(batch)) {
            extraction.extractEvidence(evidenceId);
            extracted++;
        }
        return extracted;
    }

    private StageOutcome stage(String name, IntSupplier work) {
        Timer.Sample sample = metrics.startStageTimer();
        try {
            int processed = work.getAsInt();
            if (processed > 0) {
                LOG.debugf("Stage %s processed %d item(s)", name, processed);
            }
            return StageOutcome.ok(name, processed);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Pipeline stage %s failed", name);
            return StageOutcome.failed(name, e);
        } finally {
            metrics.stopStageTimer(sample, name);
        }
    }
}
