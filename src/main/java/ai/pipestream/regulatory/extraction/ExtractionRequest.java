package ai.pipestream.regulatory.extraction;

public record ExtractionRequest(String evidenceId, String url, String text) {
}
