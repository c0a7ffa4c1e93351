package ai.pipestream.regulatory.http;

public record ErrorResponse(String errorCode, String operation, String message) {
}
