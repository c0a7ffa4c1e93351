package ai.pipestream.regulatory.release;

public record VerificationResult(String version, boolean valid, String storedHash, String recomputedHash) {
}
