package ai.pipestream.regulatory.entity;

public enum ParseStatus {
    SUCCESS,
    PARTIAL,
    FAILED
}
