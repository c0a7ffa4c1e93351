package ai.pipestream.regulatory.exception;

/**
 * A recomputed content hash does not match the stored one.
 * The affected release must not be served.
 */
public class IntegrityException extends RegulatoryException {

    public static final String CODE = "INTEGRITY_VIOLATION";

    public IntegrityException(String releaseVersion, String storedHash, String recomputedHash) {
        super(CODE, "verifyRelease",
                String.format("Release %s hash mismatch: stored=%s, recomputed=%s",
                        releaseVersion, storedHash, recomputedHash));
    }
}
