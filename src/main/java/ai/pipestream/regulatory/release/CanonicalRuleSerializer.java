package ai.pipestream.regulatory.release;

import ai.pipestream.regulatory.entity.RegulatoryRule;
import ai.pipestream.regulatory.util.ContentHashing;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Canonical JSON form of a release's member rules and its content hash.
 * <p>
 * Members are sorted by conceptSlug, then effectiveFrom (missing first), then
 * value. Dates are ISO {@code yyyy-MM-dd}. This class is the only place the
 * canonical form is produced; release creation and verification both call it.
 */
public final class CanonicalRuleSerializer {

    // Own mapper: the canonical form must not follow application-wide Jackson settings.
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Comparator<CanonicalRule> ORDER = Comparator
            .comparing(CanonicalRule::conceptSlug)
            .thenComparing(CanonicalRule::effectiveFrom, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(CanonicalRule::value, Comparator.nullsFirst(Comparator.naturalOrder()));

    private CanonicalRuleSerializer() {
    }

    @JsonPropertyOrder({"conceptSlug", "value", "valueType", "effectiveFrom", "effectiveUntil"})
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record CanonicalRule(String conceptSlug, String value, String valueType,
                                String effectiveFrom, String effectiveUntil) {

        static CanonicalRule of(RegulatoryRule rule) {
            return new CanonicalRule(rule.conceptSlug, rule.value,
                    rule.valueType == null ? null : rule.valueType.name(),
                    isoDate(rule.effectiveFrom), isoDate(rule.effectiveUntil));
        }
    }

    public static List<CanonicalRule> canonicalize(Collection<RegulatoryRule> rules) {
        return rules.stream().map(CanonicalRule::of).sorted(ORDER).toList();
    }

    public static String toJson(Collection<RegulatoryRule> rules) {
        try {
            return MAPPER.writeValueAsString(canonicalize(rules));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize canonical rules", e);
        }
    }

    public static String contentHash(Collection<RegulatoryRule> rules) {
        return ContentHashing.sha256Hex(toJson(rules));
    }

    private static String isoDate(LocalDate date) {
        return date == null ? null : date.toString();
    }
}
