package ai.pipestream.regulatory.parser;

import ai.pipestream.regulatory.entity.ParseStatus;
import ai.pipestream.regulatory.entity.ProvisionNodeType;
import ai.pipestream.regulatory.grounding.QuoteNormalizer;
import ai.pipestream.regulatory.util.ContentHashing;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Structural parser for Croatian statutes (Narodne novine layout).
 * <p>
 * Recognises parts, chapters, sections, articles ({@code Članak 28.}), paragraphs
 * ({@code (1)}), points ({@code a)}), sub-points ({@code 1.}), indents, annexes and
 * tables. Each recognised line opens a node that extends until the next node of
 * the same or a higher level.
 */
@ApplicationScoped
public class LegalTextParser implements StructuralParser {

    private static final Pattern DIO = Pattern.compile("^DIO\\s+([IVXLC]+|\\d+|[A-ZČĆŽŠĐ]+)\\.?$");
    private static final Pattern GLAVA = Pattern.compile("(?iu)^glava\\s+([ivxlc]+|\\d+|[a-zčćžšđ]+)\\.?$");
    private static final Pattern ODJELJAK = Pattern.compile("(?iu)^odjeljak\\s+(\\d+)\\.?$");
    private static final Pattern PODODJELJAK = Pattern.compile("(?iu)^pododjeljak\\s+(\\d+(?:\\.\\d+)*)\\.?$");
    private static final Pattern CLANAK = Pattern.compile("(?iu)^(?:članak|clanak)\\s+(\\d+[a-z]?)\\.?$");
    private static final Pattern PRILOG = Pattern.compile("(?iu)^prilog\\s+([\\wčćžšđ]+)\\.?$");
    private static final Pattern STAVAK = Pattern.compile("^\\((\\d+[a-z]?)\\)\\s*");
    private static final Pattern TOCKA = Pattern.compile("^([a-zčćžšđ])\\)\\s+");
    private static final Pattern PODTOCKA = Pattern.compile("^(\\d+)\\.\\s+");
    private static final Pattern ALINEJA = Pattern.compile("^[–—-]\\s+");

    private static final String CONFIG_HASH = ContentHashing.compositeKeyHash(
            DIO.pattern(), GLAVA.pattern(), ODJELJAK.pattern(), PODODJELJAK.pattern(), CLANAK.pattern(),
            PRILOG.pattern(), STAVAK.pattern(), TOCKA.pattern(), PODTOCKA.pattern(), ALINEJA.pattern());

    @Override
    public String configHash() {
        return CONFIG_HASH;
    }

    @Override
    public ParseResult parse(String content) {
        List<SourceLine> lines = HtmlText.looksLikeHtml(content) ? HtmlText.toLines(content) : plainLines(content);
        return new Run(lines).parse();
    }

    private static List<SourceLine> plainLines(String content) {
        List<SourceLine> lines = new ArrayList<>();
        if (content == null) {
            return lines;
        }
        for (String line : content.split("\\R")) {
            String trimmed = line.replace('\u00A0', ' ').trim();
            if (!trimmed.isEmpty()) {
                lines.add(SourceLine.text(trimmed));
            }
        }
        return lines;
    }

    /**
     * State of one parse.
     */
    private static final class Run {

        private final List<SourceLine> lines;
        private final List<Draft> drafts = new ArrayList<>();
        private final Deque<Draft> stack = new ArrayDeque<>();
        private final Set<String> paths = new HashSet<>();
        private final List<String> warnings = new ArrayList<>();
        private final Map<String, Integer> childCounts = new HashMap<>();
        private String cleanText;

        Run(List<SourceLine> lines) {
            this.lines = lines;
        }

        ParseResult parse() {
            StringBuilder text = new StringBuilder();
            int[] offsets = new int[lines.size()];
            for (int i = 0; i < lines.size(); i++) {
                if (i > 0) {
                    text.append('\n');
                }
                offsets[i] = text.length();
                text.append(lines.get(i).text());
            }
            cleanText = text.toString();

            if (cleanText.isEmpty()) {
                warnings.add("source contains no text");
                return result(List.of(), 0.0, ParseStatus.FAILED);
            }

            Draft root = new Draft(ProvisionNodeType.DOCUMENT, "/", null, null, 0, 0, "0000", 0);
            drafts.add(root);
            stack.push(root);
            paths.add(root.path);

            for (int i = 0; i < lines.size(); i++) {
                SourceLine line = lines.get(i);
                Detected detected = detect(line);
                if (detected == null) {
                    if (!line.tableRow()) {
                        closeTables(offsets[i]);
                    }
                    continue;
                }
                if (detected.type != ProvisionNodeType.REDAK && detected.type != ProvisionNodeType.TABLICA) {
                    closeTables(offsets[i]);
                }
                open(detected.type, detected.label, offsets[i]);
                if (detected.type == ProvisionNodeType.TABLICA) {
                    open(ProvisionNodeType.REDAK, null, offsets[i]);
                }
            }
            while (!stack.isEmpty()) {
                stack.pop().end = cleanText.length();
            }

            int covered = 0;
            for (Draft draft : drafts) {
                if (draft.depth == 1) {
                    covered += draft.end - draft.start;
                }
            }
            double coverage = Math.round(covered * 10000.0 / cleanText.length()) / 100.0;

            ParseStatus status = ParseStatus.SUCCESS;
            if (drafts.size() == 1) {
                warnings.add("no structural markers found");
                status = ParseStatus.PARTIAL;
            }

            List<ParsedNode> nodes = drafts.stream()
                    .sorted(Comparator.comparingInt((Draft d) -> d.depth).thenComparing(d -> d.sortKey))
                    .map(this::toNode)
                    .collect(Collectors.toList());
            return result(nodes, coverage, status);
        }

        private Detected detect(SourceLine line) {
            String text = line.text();
            if (line.tableRow()) {
                return new Detected(line.tableStart() || !inTable()
                        ? ProvisionNodeType.TABLICA : ProvisionNodeType.REDAK, null);
            }
            Matcher m;
            if ((m = DIO.matcher(text)).matches()) {
                return new Detected(ProvisionNodeType.DIO, m.group(1));
            }
            if ((m = GLAVA.matcher(text)).matches()) {
                return new Detected(ProvisionNodeType.GLAVA, m.group(1));
            }
            if ((m = PODODJELJAK.matcher(text)).matches()) {
                return new Detected(ProvisionNodeType.PODODJELJAK, m.group(1));
            }
            if ((m = ODJELJAK.matcher(text)).matches()) {
                return new Detected(ProvisionNodeType.ODJELJAK, m.group(1));
            }
            if ((m = CLANAK.matcher(text)).matches()) {
                return new Detected(ProvisionNodeType.CLANAK, m.group(1));
            }
            if ((m = PRILOG.matcher(text)).matches()) {
                return new Detected(ProvisionNodeType.PRILOG, m.group(1));
            }
            if ((m = STAVAK.matcher(text)).lookingAt()) {
                return new Detected(ProvisionNodeType.STAVAK, m.group(1));
            }
            if ((m = TOCKA.matcher(text)).lookingAt()) {
                return new Detected(ProvisionNodeType.TOCKA, m.group(1));
            }
            if (within(ProvisionNodeType.TOCKA) && (m = PODTOCKA.matcher(text)).lookingAt()) {
                return new Detected(ProvisionNodeType.PODTOCKA, m.group(1));
            }
            if (ALINEJA.matcher(text).lookingAt()) {
                return new Detected(ProvisionNodeType.ALINEJA, null);
            }
            return null;
        }

        private boolean inTable() {
            return within(ProvisionNodeType.TABLICA);
        }

        private boolean within(ProvisionNodeType type) {
            for (Draft draft : stack) {
                if (draft.type == type) {
                    return true;
                }
            }
            return false;
        }

        private void closeTables(int offset) {
            while (stack.size() > 1
                    && (stack.peek().type == ProvisionNodeType.REDAK || stack.peek().type == ProvisionNodeType.TABLICA)) {
                stack.pop().end = offset;
            }
        }

        private void open(ProvisionNodeType type, String label, int offset) {
            while (stack.size() > 1 && stack.peek().type.rank() >= type.rank()) {
                stack.pop().end = offset;
            }
            Draft parent = stack.peek();
            int order = childCounts.merge(parent.path, 1, Integer::sum) - 1;
            String segmentLabel = label != null ? label.toLowerCase(Locale.ROOT) : String.valueOf(order + 1);
            String base = (parent.parentPath == null ? "" : parent.path) + "/" + type.pathCode() + ":" + segmentLabel;
            String path = base;
            int suffix = 2;
            while (paths.contains(path)) {
                path = base + "~" + suffix++;
            }
            if (!path.equals(base)) {
                warnings.add("duplicate node " + base + " renamed to " + path);
            }
            paths.add(path);
            Draft draft = new Draft(type, path, parent.path, label, order, parent.depth + 1,
                    parent.sortKey + "." + String.format("%04d", order), offset);
            drafts.add(draft);
            stack.push(draft);
        }

        private ParsedNode toNode(Draft draft) {
            String raw = cleanText.substring(draft.start, draft.end).strip();
            return new ParsedNode(draft.type, draft.path, draft.parentPath, draft.label, draft.order,
                    draft.depth, draft.sortKey, raw, QuoteNormalizer.normalize(raw), draft.start, draft.end);
        }

        private ParseResult result(List<ParsedNode> nodes, double coverage, ParseStatus status) {
            Map<ProvisionNodeType, Integer> counts = new EnumMap<>(ProvisionNodeType.class);
            for (ParsedNode node : nodes) {
                counts.merge(node.type(), 1, Integer::sum);
            }
            return new ParseResult(nodes, cleanText, ContentHashing.sha256Hex(cleanText), coverage,
                    counts, List.copyOf(warnings), status);
        }
    }

    private record Detected(ProvisionNodeType type, String label) {
    }

    private static final class Draft {
        final ProvisionNodeType type;
        final String path;
        final String parentPath;
        final String label;
        final int order;
        final int depth;
        final String sortKey;
        final int start;
        int end;

        Draft(ProvisionNodeType type, String path, String parentPath, String label,
              int order, int depth, String sortKey, int start) {
            this.type = type;
            this.path = path;
            this.parentPath = parentPath;
            this.label = label;
            this.order = order;
            this.depth = depth;
            this.sortKey = sortKey;
            this.start = start;
            this.end = start;
        }
    }
}
