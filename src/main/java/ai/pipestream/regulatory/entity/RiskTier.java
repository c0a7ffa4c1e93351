package ai.pipestream.regulatory.entity;

/**
 * Criticality of a rule. T0 is the most critical.
 */
public enum RiskTier {
    T0,
    T1,
    T2,
    T3;

    /**
     * T0 and T1 rules are never approved without a human.
     */
    public boolean requiresHumanApproval() {
        return this == T0 || this == T1;
    }
}
