package ai.pipestream.regulatory.entity;

public enum StalenessStatus {
    FRESH,
    STALE,
    UNAVAILABLE
}
