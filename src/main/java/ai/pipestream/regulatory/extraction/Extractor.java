package ai.pipestream.regulatory.extraction;

/**
 * Black-box producer of candidate assertions. Only the result shape is relied upon.
 */
public interface Extractor {

    ExtractionResult extract(ExtractionRequest request);
}
