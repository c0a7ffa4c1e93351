package ai.pipestream.regulatory.grounding;

/**
 * @param stillPending pointers whose evidence has no usable text yet
 */
public record VerificationReport(int checked, int grounded, int notFound, int stillPending) {
}
