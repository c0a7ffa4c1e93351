package ai.pipestream.regulatory.compose;

public record ComposeReport(int pointersComposed, int rulesCreated, int rulesExtended, int draftsSubmitted) {
}
