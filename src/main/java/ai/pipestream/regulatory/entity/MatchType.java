package ai.pipestream.regulatory.entity;

/**
 * Grounding state of a {@link SourcePointer}. Only GROUNDED pointers are citable.
 */
public enum MatchType {
    GROUNDED,
    NOT_FOUND,
    PENDING_VERIFICATION
}
