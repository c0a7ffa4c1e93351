package ai.pipestream.regulatory.health;

/**
 * Threshold checks behind the health gates.
 */
public final class HealthGateEvaluator {

    private HealthGateEvaluator() {
    }

    /**
     * Failure rate gate. An empty population passes.
     */
    public static GateResult rate(String gate, long failed, long total, double warnAt, double failAt) {
        if (total <= 0) {
            return new GateResult(gate, GateStatus.PASS, "no samples");
        }
        double rate = (double) failed / total;
        String detail = String.format("%d/%d failed (%.1f%%)", failed, total, rate * 100);
        if (rate >= failAt) {
            return new GateResult(gate, GateStatus.FAIL, detail);
        }
        if (rate >= warnAt) {
            return new GateResult(gate, GateStatus.WARN, detail);
        }
        return new GateResult(gate, GateStatus.PASS, detail);
    }

    /**
     * Backlog style gate: WARN at or above {@code warnAt}, FAIL at or above {@code failAt}.
     */
    public static GateResult threshold(String gate, long value, long warnAt, long failAt) {
        String detail = String.format("%d (warn>=%d, fail>=%d)", value, warnAt, failAt);
        if (value >= failAt) {
            return new GateResult(gate, GateStatus.FAIL, detail);
        }
        if (value >= warnAt) {
            return new GateResult(gate, GateStatus.WARN, detail);
        }
        return new GateResult(gate, GateStatus.PASS, detail);
    }

    /**
     * Any non-zero count yields {@code whenPresent}.
     */
    public static GateResult mustBeZero(String gate, long value, GateStatus whenPresent) {
        GateStatus status = value > 0 ? whenPresent : GateStatus.PASS;
        return new GateResult(gate, status, String.valueOf(value));
    }
}
