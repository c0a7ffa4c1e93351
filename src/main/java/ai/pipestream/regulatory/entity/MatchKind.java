package ai.pipestream.regulatory.entity;

/**
 * How a grounded quote was found: verbatim, or only after normalization.
 */
public enum MatchKind {
    EXACT,
    NORMALIZED,
    NONE
}
