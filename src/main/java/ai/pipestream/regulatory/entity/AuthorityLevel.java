package ai.pipestream.regulatory.entity;

/**
 * Legal weight of a source. A lower score carries more authority.
 */
public enum AuthorityLevel {
    LAW(1),
    GUIDANCE(2),
    PROCEDURE(3),
    PRACTICE(4);

    private final int score;

    AuthorityLevel(int score) {
        this.score = score;
    }

    public int score() {
        return score;
    }

    public boolean outranks(AuthorityLevel other) {
        return other == null || score < other.score;
    }

    /**
     * Returns the more authoritative of two levels, treating null as unknown.
     */
    public static AuthorityLevel strongest(AuthorityLevel a, AuthorityLevel b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.outranks(b) ? a : b;
    }
}
