package ai.pipestream.regulatory.entity;

/**
 * The rule that decided a conflict. Automated policies are tried in declaration order.
 */
public enum ResolutionPolicy {
    AUTHORITY,
    RECENCY,
    CONFIDENCE,
    HUMAN
}
