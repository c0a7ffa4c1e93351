package ai.pipestream.regulatory.grounding;

/**
 * Proves that a claimed quotation occurs in the evidence text it cites.
 * Pure function of its two inputs.
 */
public final class GroundingVerifier {

    private GroundingVerifier() {
    }

    public static GroundingResult verify(String evidenceText, String claimedQuote) {
        String normalizedQuote = QuoteNormalizer.normalize(claimedQuote);
        if (evidenceText == null || normalizedQuote.isEmpty()) {
            return GroundingResult.notFound(0, -1);
        }

        int exact = claimedQuote.isBlank() ? -1 : evidenceText.indexOf(claimedQuote);
        if (exact >= 0) {
            return GroundingResult.exact(exact, exact + claimedQuote.length(), normalizedQuote.length());
        }

        String normalizedText = QuoteNormalizer.normalize(evidenceText);
        int normalized = normalizedText.indexOf(normalizedQuote);
        if (normalized >= 0) {
            return GroundingResult.normalized(normalized, normalized + normalizedQuote.length());
        }

        return diagnose(normalizedText, normalizedQuote);
    }

    /**
     * Finds the longest quote prefix present in the text. Presence is monotone in
     * prefix length, so a binary search over the length is enough.
     */
    private static GroundingResult diagnose(String normalizedText, String normalizedQuote) {
        int low = 0;
        int high = normalizedQuote.length();
        int position = -1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            int at = normalizedText.indexOf(normalizedQuote.substring(0, mid));
            if (at >= 0) {
                low = mid;
                position = at;
            } else {
                high = mid - 1;
            }
        }
        return GroundingResult.notFound(low, low == 0 ? -1 : position);
    }
}
