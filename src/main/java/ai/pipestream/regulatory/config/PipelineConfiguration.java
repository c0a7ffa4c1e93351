package ai.pipestream.regulatory.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Tunables for the regulatory truth pipeline.
 * All keys are namespaced under {@code rtl.*}.
 */
@ConfigMapping(prefix = "rtl")
public interface PipelineConfiguration {

    Review review();

    ContentSync contentSync();

    Drainer drainer();

    Health health();

    Tiers tiers();

    Parser parser();

    Concepts concepts();

    interface Review {
        /**
         * T2/T3 rules at or above this confidence are approved without a human.
         * Default: 0.90.
         */
        @WithDefault("0.90")
        double autoApproveConfidenceFloor();
    }

    interface ContentSync {
        /**
         * Attempts before a transiently failing event is dead-lettered.
         * Default: 8.
         */
        @WithDefault("8")
        int maxAttempts();

        @WithDefault("PT30S")
        Duration initialBackoff();

        @WithDefault("PT30M")
        Duration maxBackoff();

        /**
         * Maximum events handed to the queue per drain.
         */
        @WithDefault("500")
        int drainBatchSize();

        /**
         * How long an event may sit ENQUEUED or PROCESSING before it is handed out
         * again. Covers lost queue messages and workers that died mid-event.
         */
        @WithDefault("PT15M")
        Duration processingLease();

        /**
         * Root directory of the downstream content files.
         */
        @WithDefault("content")
        String contentDir();

        /**
         * Classpath resource mapping concepts to content files.
         */
        @WithDefault("concept-registry.json")
        String registryResource();
    }

    interface Drainer {
        @WithDefault("true")
        boolean enabled();

        /**
         * Scheduler period, read by the drainer's {@code @Scheduled} expression.
         */
        @WithDefault("60s")
        String interval();

        /**
         * Items per stage per drainer tick.
         */
        @WithDefault("200")
        int batchSize();
    }

    interface Health {
        @WithDefault("0.10")
        double ocrFailureRateWarn();

        @WithDefault("0.25")
        double ocrFailureRateFail();

        /**
         * Extraction runs still RUNNING after this long are reported as stuck.
         */
        @WithDefault("PT30M")
        Duration stuckRunThreshold();

        @WithDefault("1000")
        long backlogWarn();

        @WithDefault("5000")
        long backlogFail();
    }

    interface Tiers {
        @WithDefault("rok,deadline,prag,threshold,stopa,rate,kazna,penalty")
        List<String> t0Keywords();

        @WithDefault("obveza,obligation,limit,iznos,amount,doprinos,contribution")
        List<String> t1Keywords();

        @WithDefault("postupak,procedure,obrazac,form,evidencija,record")
        List<String> t2Keywords();
    }

    interface Parser {
        @WithDefault("legal-text-parser")
        String id();

        @WithDefault("1.0.0")
        String version();
    }

    interface Concepts {
        /**
         * Alias slug to canonical concept slug.
         */
        Map<String, String> aliases();
    }
}
