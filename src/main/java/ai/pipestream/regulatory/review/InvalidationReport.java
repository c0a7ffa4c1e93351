package ai.pipestream.regulatory.review;

/**
 * @param rulesReset        rules sent back to DRAFT
 * @param confidenceDrops   published rules reported downstream with lower confidence
 * @param draftsRecomputed  DRAFT rules whose confidence was lowered in place
 */
public record InvalidationReport(int rulesReset, int confidenceDrops, int draftsRecomputed) {

    public static InvalidationReport empty() {
        return new InvalidationReport(0, 0, 0);
    }
}
