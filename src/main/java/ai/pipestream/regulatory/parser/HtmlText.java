package ai.pipestream.regulatory.parser;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns HTML into line-structured plain text. Block elements and {@code <br>}
 * end a line; table rows become one line with cells joined by {@code " | "}.
 */
public final class HtmlText {

    private static final Pattern HTML_MARKER =
            Pattern.compile("(?is)<\\s*(html|body|p|div|table|h[1-6]|br|article|section)\\b");
    private static final Pattern SPACES = Pattern.compile("[\\s\\u00A0]+");
    private static final String NOISE = "script, noscript, style, header, footer, nav, aside";

    private HtmlText() {
    }

    public static boolean looksLikeHtml(String content) {
        return content != null && HTML_MARKER.matcher(content).find();
    }

    public static List<SourceLine> toLines(String html) {
        Document doc = Jsoup.parse(html);
        doc.select(NOISE).remove();
        LineCollector collector = new LineCollector();
        NodeTraversor.traverse(collector, doc.body());
        collector.flush();
        return collector.lines;
    }

    public static String toPlainText(String html) {
        return toLines(html).stream().map(SourceLine::text).collect(Collectors.joining("\n"));
    }

    private static final class LineCollector implements NodeVisitor {

        private final List<SourceLine> lines = new ArrayList<>();
        private final StringBuilder current = new StringBuilder();
        private int tableDepth;
        private boolean inRow;
        private boolean tableStartPending;
        private int cellIndex;

        @Override
        public void head(Node node, int depth) {
            if (node instanceof TextNode textNode) {
                current.append(textNode.text());
                return;
            }
            if (!(node instanceof Element element)) {
                return;
            }
            switch (element.normalName()) {
                case "br" -> {
                    if (inRow) {
                        current.append(' ');
                    } else {
                        flush();
                    }
                }
                case "table" -> {
                    flush();
                    tableDepth++;
                    tableStartPending = true;
                }
                case "tr" -> {
                    flush();
                    inRow = true;
                    cellIndex = 0;
                }
                case "td", "th" -> {
                    if (cellIndex++ > 0) {
                        current.append(" | ");
                    }
                }
                default -> {
                    if (element.isBlock() && !inRow) {
                        flush();
                    }
                }
            }
        }

        @Override
        public void tail(Node node, int depth) {
            if (!(node instanceof Element element)) {
                return;
            }
            switch (element.normalName()) {
                case "tr" -> {
                    flush();
                    inRow = false;
                }
                case "table" -> {
                    flush();
                    tableDepth = Math.max(0, tableDepth - 1);
                }
                case "td", "th", "br" -> {
                }
                default -> {
                    if (element.isBlock() && !inRow) {
                        flush();
                    }
                }
            }
        }

        void flush() {
            String text = SPACES.matcher(current).replaceAll(" ").trim();
            current.setLength(0);
            if (text.isEmpty()) {
                return;
            }
            boolean row = inRow && tableDepth > 0;
            lines.add(new SourceLine(text, row, row && tableStartPending));
            if (row) {
                tableStartPending = false;
            }
        }
    }
}
