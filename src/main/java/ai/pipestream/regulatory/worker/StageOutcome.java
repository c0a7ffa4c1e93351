package ai.pipestream.regulatory.worker;

public record StageOutcome(String stage, boolean succeeded, int processed, String error) {

    static StageOutcome ok(String stage, int processed) {
        return new StageOutcome(stage, true, processed, null);
    }

    static StageOutcome failed(String stage, RuntimeException e) {
        return new StageOutcome(stage, false, 0, e.getClass().getSimpleName() + ": " + e.getMessage());
    }
}
