package ai.pipestream.regulatory.grounding;

import ai.pipestream.regulatory.entity.MatchKind;
import ai.pipestream.regulatory.entity.MatchType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GroundingVerifier.
 * Covers exact and normalized matches and the prefix diagnosis on misses.
 */
class GroundingVerifierTest {

    private static final String VAT_RATE = "Opća stopa PDV-a iznosi 25%.";

    @Test
    void testExactMatch() {
        GroundingResult result = GroundingVerifier.verify(VAT_RATE, "stopa PDV-a iznosi 25");

        assertTrue(result.found());
        assertEquals(MatchKind.EXACT, result.matchKind());
        assertEquals(MatchType.GROUNDED, result.matchType());
        assertEquals(5, result.start());
        assertEquals(26, result.end());
        assertEquals(-1, result.divergenceIndex());
    }

    @Test
    void testNormalizedMatchOnTypographicQuotes() {
        String text = "Porez se plaća „po stopi“ od 25%.";

        GroundingResult result = GroundingVerifier.verify(text, "se plaća \"po stopi\" od");

        assertTrue(result.found());
        assertEquals(MatchKind.NORMALIZED, result.matchKind());
        assertEquals(6, result.start());
        assertEquals(6 + "se plaća \"po stopi\" od".length(), result.end());
    }

    @Test
    void testNormalizedMatchAcrossLineBreak() {
        String text = "Prag iznosi 40.000,00\neura godišnje.";

        GroundingResult result = GroundingVerifier.verify(text, "iznosi 40.000,00 eura");

        assertTrue(result.found());
        assertEquals(MatchKind.NORMALIZED, result.matchKind());
    }

    @Test
    void testMismatchedDigitReportsDivergence() {
        GroundingResult result = GroundingVerifier.verify(VAT_RATE, "stopa PDV-a iznosi 22");

        assertFalse(result.found());
        assertEquals(MatchKind.NONE, result.matchKind());
        assertEquals(MatchType.NOT_FOUND, result.matchType());
        assertEquals(20, result.longestPrefixLength());
        assertEquals(20, result.divergenceIndex());
        assertEquals(5, result.prefixMatchStart());
        assertTrue(result.describe().contains("diverges at quote index 20"));
    }

    @Test
    void testNoCommonPrefix() {
        GroundingResult result = GroundingVerifier.verify(VAT_RATE, "qqq");

        assertFalse(result.found());
        assertEquals(0, result.longestPrefixLength());
        assertEquals(-1, result.prefixMatchStart());
        assertEquals("quote not found, no common prefix with evidence", result.describe());
    }

    @Test
    void testBlankQuoteIsNeverGrounded() {
        assertFalse(GroundingVerifier.verify(VAT_RATE, "   ").found());
        assertFalse(GroundingVerifier.verify(VAT_RATE, "").found());
    }

    @Test
    void testMissingEvidenceText() {
        GroundingResult result = GroundingVerifier.verify(null, "stopa");

        assertFalse(result.found());
        assertEquals(-1, result.start());
    }
}
