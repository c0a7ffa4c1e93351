package ai.pipestream.regulatory.grounding;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Normalization applied to both evidence text and claimed quotes before comparison.
 * <p>
 * Order matters: NFKC first, then NBSP and soft hyphen, then quote and apostrophe
 * variants, then whitespace collapse and trim.
 */
public final class QuoteNormalizer {

    private static final Pattern DOUBLE_QUOTES = Pattern.compile(
            "[\u201C\u201D\u201E\u201F\u00AB\u00BB\u2039\u203A\u275D\u275E\u276E\u276F\uFF02]");
    private static final Pattern APOSTROPHES = Pattern.compile(
            "[\u2018\u2019\u201A\u201B\u2032\uFF07]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private QuoteNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String result = Normalizer.normalize(text, Normalizer.Form.NFKC);
        result = result.replace('\u00A0', ' ');
        result = result.replace("\u00AD", "");
        result = DOUBLE_QUOTES.matcher(result).replaceAll("\"");
        result = APOSTROPHES.matcher(result).replaceAll("'");
        result = WHITESPACE.matcher(result).replaceAll(" ");
        return result.trim();
    }
}
