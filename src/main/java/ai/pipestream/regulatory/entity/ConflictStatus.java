package ai.pipestream.regulatory.entity;

public enum ConflictStatus {
    OPEN,
    RESOLVED
}
