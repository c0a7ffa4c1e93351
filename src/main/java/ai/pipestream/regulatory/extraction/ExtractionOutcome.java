package ai.pipestream.regulatory.extraction;

import ai.pipestream.regulatory.entity.AgentRunStatus;

import java.util.UUID;

/**
 * @param runId  null when the evidence was skipped
 * @param status null when the evidence was skipped
 */
public record ExtractionOutcome(UUID evidenceId, UUID runId, AgentRunStatus status, int pointersCreated, String note) {

    static ExtractionOutcome skipped(UUID evidenceId, String note) {
        return new ExtractionOutcome(evidenceId, null, null, 0, note);
    }

    public boolean skipped() {
        return runId == null;
    }
}
