package ai.pipestream.regulatory.entity;

/**
 * Kind of source material an {@link Evidence} snapshot was fetched as.
 */
public enum ContentClass {
    HTML,
    PDF_TEXT,
    PDF_SCANNED,
    JSON
}
