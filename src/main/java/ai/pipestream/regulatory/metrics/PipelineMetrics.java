package ai.pipestream.regulatory.metrics;

import ai.pipestream.regulatory.entity.AgentRunStatus;
import ai.pipestream.regulatory.entity.ContentSyncEventType;
import ai.pipestream.regulatory.entity.DeadLetterReason;
import ai.pipestream.regulatory.entity.MatchType;
import ai.pipestream.regulatory.entity.ReleaseType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Pipeline counters and stage timers, exposed via Micrometer.
 */
@ApplicationScoped
public class PipelineMetrics {

    @Inject
    MeterRegistry registry;

    private Counter rulesComposedTotal;
    private Counter conflictsDetectedTotal;
    private Counter autoApprovedTotal;
    private Counter contentSyncDrainedTotal;

    @PostConstruct
    void init() {
        rulesComposedTotal = Counter.builder("rtl_rules_composed_total")
                .description("Draft rules created from grounded pointers")
                .register(registry);

        conflictsDetectedTotal = Counter.builder("rtl_conflicts_detected_total")
                .description("Conflicts opened between overlapping rules")
                .register(registry);

        autoApprovedTotal = Counter.builder("rtl_rules_auto_approved_total")
                .description("Rules approved by the automatic review policy")
                .register(registry);

        contentSyncDrainedTotal = Counter.builder("rtl_content_sync_drained_total")
                .description("Content-sync events handed to the job queue")
                .register(registry);
    }

    public void recordExtraction(AgentRunStatus status) {
        Counter.builder("rtl_extraction_runs_total")
                .description("Extraction runs by final status")
                .tag("status", status.name())
                .register(registry)
                .increment();
    }

    public void recordPointerVerified(MatchType matchType) {
        Counter.builder("rtl_pointers_verified_total")
                .description("Source pointers verified against evidence text")
                .tag("result", matchType.name())
                .register(registry)
                .increment();
    }

    public void recordRulesComposed(int created) {
        rulesComposedTotal.increment(created);
    }

    public void recordConflictsDetected(int opened) {
        conflictsDetectedTotal.increment(opened);
    }

    public void recordAutoApproved() {
        autoApprovedTotal.increment();
    }

    public void recordRelease(ReleaseType type) {
        Counter.builder("rtl_releases_total")
                .description("Rule releases by bump type")
                .tag("type", type.name())
                .register(registry)
                .increment();
    }

    public void recordContentSyncEnqueued(ContentSyncEventType type) {
        Counter.builder("rtl_content_sync_enqueued_total")
                .description("Content-sync events inserted into the queue")
                .tag("type", type.name())
                .register(registry)
                .increment();
    }

    public void recordDrain(int enqueued) {
        contentSyncDrainedTotal.increment(enqueued);
    }

    public void recordDeadLetter(DeadLetterReason reason) {
        Counter.builder("rtl_content_sync_dead_lettered_total")
                .description("Content-sync events removed from the active queue")
                .tag("reason", reason.name())
                .register(registry)
                .increment();
    }

    public Timer.Sample startStageTimer() {
        return Timer.start(registry);
    }

    public void stopStageTimer(Timer.Sample sample, String stage) {
        sample.stop(Timer.builder("rtl_pipeline_stage_latency")
                .description("Duration of one pipeline stage")
                .tag("stage", stage)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry));
    }
}
