package ai.pipestream.regulatory.entity;

public enum AgentRunStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
