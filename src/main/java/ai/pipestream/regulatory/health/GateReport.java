package ai.pipestream.regulatory.health;

import java.util.List;

/**
 * Aggregated health gate outcome. Any FAIL makes the whole report fail.
 */
public record GateReport(List<GateResult> results) {

    public GateReport {
        results = List.copyOf(results);
    }

    public long count(GateStatus status) {
        return results.stream().filter(r -> r.status() == status).count();
    }

    public GateStatus overall() {
        if (count(GateStatus.FAIL) > 0) {
            return GateStatus.FAIL;
        }
        return count(GateStatus.WARN) > 0 ? GateStatus.WARN : GateStatus.PASS;
    }

    public int exitCode() {
        return overall() == GateStatus.FAIL ? 1 : 0;
    }

    public String summary() {
        return String.format("pass=%d warn=%d fail=%d", count(GateStatus.PASS), count(GateStatus.WARN),
                count(GateStatus.FAIL));
    }
}
