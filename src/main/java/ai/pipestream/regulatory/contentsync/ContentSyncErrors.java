package ai.pipestream.regulatory.contentsync;

import jakarta.persistence.PersistenceException;

import java.sql.SQLException;

/**
 * Maps arbitrary failures onto the fixed dead-letter categories.
 */
public final class ContentSyncErrors {

    private ContentSyncErrors() {
    }

    public static ContentSyncException classify(Throwable error) {
        if (error instanceof ContentSyncException known) {
            return known;
        }
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof PersistenceException || t instanceof SQLException) {
                return new DbWriteFailedException(describe(error), error);
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return new RepoWriteFailedException(describe(error), error);
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
