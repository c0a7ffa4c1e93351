package ai.pipestream.regulatory.entity;

public enum ReleaseType {
    MAJOR,
    MINOR,
    PATCH
}
