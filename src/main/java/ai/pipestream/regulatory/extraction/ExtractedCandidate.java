package ai.pipestream.regulatory.extraction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * One candidate assertion as returned by the extractor.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractedCandidate(
        @JsonProperty("domain") String domain,
        @JsonProperty("extracted_value") String extractedValue,
        @JsonProperty("exact_quote") String exactQuote,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("value_type") String valueType,
        @JsonProperty("article_reference") String articleReference,
        @JsonProperty("law_reference") String lawReference,
        @JsonProperty("effective_from") LocalDate effectiveFrom,
        @JsonProperty("effective_until") LocalDate effectiveUntil) {

    public static ExtractedCandidate of(String domain, String value, String quote, double confidence) {
        return new ExtractedCandidate(domain, value, quote, confidence, null, null, null, null, null);
    }
}
