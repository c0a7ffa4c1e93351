package ai.pipestream.regulatory.exception;

/**
 * A release request was refused.
 */
public class ReleaseException extends RegulatoryException {

    public static final String CODE = "RELEASE_REJECTED";

    public ReleaseException(String message) {
        super(CODE, "release", message);
    }

    public static ReleaseException nothingToRelease() {
        return new ReleaseException("No approved rule changes to release");
    }
}
