package ai.pipestream.regulatory.entity;

/**
 * OCR state of an evidence row. Only scanned PDFs ever leave NOT_REQUIRED.
 */
public enum OcrStatus {
    NOT_REQUIRED,
    PENDING,
    COMPLETED,
    FAILED
}
