package ai.pipestream.regulatory.grounding;

import ai.pipestream.regulatory.entity.MatchKind;
import ai.pipestream.regulatory.entity.MatchType;

/**
 * Outcome of checking one quote against one evidence text.
 *
 * @param found               whether the quote occurs in the text
 * @param matchKind           EXACT when found verbatim, NORMALIZED when found only after normalization
 * @param start               start offset of the match; in the original text for EXACT, in the
 *                            normalized text for NORMALIZED; -1 when not found
 * @param end                 exclusive end offset, same frame as {@code start}
 * @param longestPrefixLength length of the longest prefix of the normalized quote that occurs in
 *                            the normalized text
 * @param divergenceIndex     first position in the normalized quote that could not be matched,
 *                            -1 when found
 * @param prefixMatchStart    position in the normalized text where the longest prefix occurs,
 *                            -1 when no prefix matched
 */
public record GroundingResult(boolean found,
                              MatchKind matchKind,
                              int start,
                              int end,
                              int longestPrefixLength,
                              int divergenceIndex,
                              int prefixMatchStart) {

    static GroundingResult exact(int start, int end, int normalizedQuoteLength) {
        return new GroundingResult(true, MatchKind.EXACT, start, end, normalizedQuoteLength, -1, -1);
    }

    static GroundingResult normalized(int start, int end) {
        return new GroundingResult(true, MatchKind.NORMALIZED, start, end, end - start, -1, start);
    }

    static GroundingResult notFound(int longestPrefixLength, int prefixMatchStart) {
        return new GroundingResult(false, MatchKind.NONE, -1, -1,
                longestPrefixLength, longestPrefixLength, prefixMatchStart);
    }

    public MatchType matchType() {
        return found ? MatchType.GROUNDED : MatchType.NOT_FOUND;
    }

    /**
     * Short diagnosis for operators.
     */
    public String describe() {
        if (found) {
            return String.format("%s match at [%d, %d)", matchKind, start, end);
        }
        if (longestPrefixLength == 0) {
            return "quote not found, no common prefix with evidence";
        }
        return String.format("quote not found, longest prefix %d chars at evidence position %d, diverges at quote index %d",
                longestPrefixLength, prefixMatchStart, divergenceIndex);
    }
}
