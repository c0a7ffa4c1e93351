package ai.pipestream.regulatory.parser;

/**
 * One non-empty line of cleaned source text.
 *
 * @param text       trimmed line text
 * @param tableRow   line is a table row with cells joined by {@code " | "}
 * @param tableStart first row of a table
 */
public record SourceLine(String text, boolean tableRow, boolean tableStart) {

    public static SourceLine text(String text) {
        return new SourceLine(text, false, false);
    }
}
