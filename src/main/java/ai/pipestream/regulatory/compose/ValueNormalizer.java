package ai.pipestream.regulatory.compose;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Comparison form of rule values. Two values are the same claim when their
 * normalized forms are equal.
 * <p>
 * Numbers written the Croatian way ({@code 40.000,00 EUR}) become
 * {@code 40000 eur}; other text is lower-cased with whitespace collapsed.
 */
public final class ValueNormalizer {

    private static final Pattern NUMBER_WITH_UNIT = Pattern.compile(
            "^([+-]?\\d{1,3}(?:[.\\s]\\d{3})+|[+-]?\\d+)(?:,(\\d+))?\\s*(%|eur|€|kn|hrk)?$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ValueNormalizer() {
    }

    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String text = WHITESPACE.matcher(value.replace('\u00A0', ' ').trim().toLowerCase(Locale.ROOT))
                .replaceAll(" ");
        Matcher m = NUMBER_WITH_UNIT.matcher(text);
        if (!m.matches()) {
            return text;
        }
        String integer = m.group(1).replaceAll("[.\\s]", "");
        String fraction = m.group(2);
        BigDecimal number = new BigDecimal(fraction == null ? integer : integer + "." + fraction)
                .stripTrailingZeros();
        String unit = m.group(3);
        if ("€".equals(unit)) {
            unit = "eur";
        }
        String plain = number.toPlainString();
        return unit == null ? plain : plain + ("%".equals(unit) ? "%" : " " + unit);
    }
}
