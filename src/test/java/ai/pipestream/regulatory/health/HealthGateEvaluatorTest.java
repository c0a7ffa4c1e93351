package ai.pipestream.regulatory.health;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for HealthGateEvaluator and GateReport aggregation.
 */
class HealthGateEvaluatorTest {

    @Test
    void testRateWithoutSamplesPasses() {
        GateResult result = HealthGateEvaluator.rate("ocr", 0, 0, 0.05, 0.2);

        assertEquals(GateStatus.PASS, result.status());
        assertEquals("no samples", result.detail());
    }

    @Test
    void testRateThresholds() {
        assertEquals(GateStatus.PASS, HealthGateEvaluator.rate("ocr", 4, 100, 0.05, 0.2).status());
        assertEquals(GateStatus.WARN, HealthGateEvaluator.rate("ocr", 5, 100, 0.05, 0.2).status());
        assertEquals(GateStatus.FAIL, HealthGateEvaluator.rate("ocr", 20, 100, 0.05, 0.2).status());
        assertEquals("20/100 failed (20.0%)", HealthGateEvaluator.rate("ocr", 20, 100, 0.05, 0.2).detail());
    }

    @Test
    void testBacklogThreshold() {
        assertEquals(GateStatus.PASS, HealthGateEvaluator.threshold("backlog", 99, 100, 1000).status());
        assertEquals(GateStatus.WARN, HealthGateEvaluator.threshold("backlog", 100, 100, 1000).status());
        assertEquals(GateStatus.FAIL, HealthGateEvaluator.threshold("backlog", 1000, 100, 1000).status());
    }

    @Test
    void testMustBeZero() {
        assertEquals(GateStatus.PASS, HealthGateEvaluator.mustBeZero("dead", 0, GateStatus.FAIL).status());
        assertEquals(GateStatus.WARN, HealthGateEvaluator.mustBeZero("dead", 3, GateStatus.WARN).status());
    }

    @Test
    void testReportAggregation() {
        GateReport warnOnly = new GateReport(List.of(
                new GateResult("a", GateStatus.PASS, ""),
                new GateResult("b", GateStatus.WARN, "")));
        assertEquals(GateStatus.WARN, warnOnly.overall());
        assertEquals(0, warnOnly.exitCode());

        GateReport failing = new GateReport(List.of(
                new GateResult("a", GateStatus.WARN, ""),
                new GateResult("b", GateStatus.FAIL, "")));
        assertEquals(GateStatus.FAIL, failing.overall());
        assertEquals(1, failing.exitCode());
        assertEquals("pass=0 warn=1 fail=1", failing.summary());
    }
}
