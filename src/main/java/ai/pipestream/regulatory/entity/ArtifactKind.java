package ai.pipestream.regulatory.entity;

public enum ArtifactKind {
    CLEAN_TEXT,
    OCR_TEXT,
    PARSED_CLEAN_TEXT
}
