package ai.pipestream.regulatory.compose;

import ai.pipestream.regulatory.config.PipelineConfiguration;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps extractor domains to canonical concept slugs so that synonyms
 * ({@code vat-threshold}, {@code pdv-prag}) land on the same concept.
 */
@ApplicationScoped
public class ConceptResolver {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

    @Inject
    PipelineConfiguration config;

    public String resolve(String domain) {
        String slug = slugify(domain);
        Map<String, String> aliases = config.concepts().aliases();
        return aliases.getOrDefault(slug, slug);
    }

    /**
     * Lower-case, diacritics folded, runs of anything else collapsed to one dash.
     * {@code đ} has no decomposition and is folded explicitly.
     */
    public static String slugify(String raw) {
        if (raw == null) {
            return "";
        }
        String folded = raw.toLowerCase(Locale.ROOT).replace('đ', 'd');
        folded = Normalizer.normalize(folded, Normalizer.Form.NFD);
        folded = COMBINING_MARKS.matcher(folded).replaceAll("");
        folded = NON_ALPHANUMERIC.matcher(folded).replaceAll("-");
        int start = 0;
        int end = folded.length();
        while (start < end && folded.charAt(start) == '-') {
            start++;
        }
        while (end > start && folded.charAt(end - 1) == '-') {
            end--;
        }
        return folded.substring(start, end);
    }
}
