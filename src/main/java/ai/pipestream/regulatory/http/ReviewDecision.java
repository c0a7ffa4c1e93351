package ai.pipestream.regulatory.http;

public record ReviewDecision(String reviewer, String note) {
}
