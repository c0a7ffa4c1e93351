package ai.pipestream.regulatory.release;

import ai.pipestream.regulatory.entity.RegulatoryRule;
import ai.pipestream.regulatory.entity.ReleaseType;
import ai.pipestream.regulatory.entity.RiskTier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for version parsing, bumping and the bump type calculation.
 */
class SemanticVersionTest {

    @Test
    void testParseAndFormat() {
        SemanticVersion version = SemanticVersion.parse("1.4.12");

        assertEquals(new SemanticVersion(1, 4, 12), version);
        assertEquals("1.4.12", version.toString());
    }

    @Test
    void testParseRejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> SemanticVersion.parse("1.4"));
        assertThrows(IllegalArgumentException.class, () -> SemanticVersion.parse("a.b.c"));
        assertThrows(IllegalArgumentException.class, () -> SemanticVersion.parse(null));
        assertThrows(IllegalArgumentException.class, () -> new SemanticVersion(-1, 0, 0));
    }

    @Test
    void testBump() {
        SemanticVersion version = new SemanticVersion(1, 2, 3);

        assertEquals("2.0.0", version.bump(ReleaseType.MAJOR).toString());
        assertEquals("1.3.0", version.bump(ReleaseType.MINOR).toString());
        assertEquals("1.2.4", version.bump(ReleaseType.PATCH).toString());
        assertEquals("1.0.0", SemanticVersion.BASELINE.bump(ReleaseType.MAJOR).toString());
    }

    @Test
    void testOrdering() {
        assertTrue(SemanticVersion.parse("1.10.0").compareTo(SemanticVersion.parse("1.9.9")) > 0);
        assertTrue(SemanticVersion.parse("2.0.0").compareTo(SemanticVersion.parse("10.0.0")) < 0);
    }

    @Test
    void testReleaseTypeFromHighestTier() {
        assertEquals(ReleaseType.MAJOR, ReleaseTypeCalculator.forChanges(List.of(rule(RiskTier.T3), rule(RiskTier.T0))));
        assertEquals(ReleaseType.MINOR, ReleaseTypeCalculator.forChanges(List.of(rule(RiskTier.T2), rule(RiskTier.T1))));
        assertEquals(ReleaseType.PATCH, ReleaseTypeCalculator.forChanges(List.of(rule(RiskTier.T2), rule(RiskTier.T3))));
        assertEquals(ReleaseType.PATCH, ReleaseTypeCalculator.forChanges(List.of()));
    }

    private static RegulatoryRule rule(RiskTier tier) {
        RegulatoryRule rule = new RegulatoryRule();
        rule.riskTier = tier;
        return rule;
    }
}
