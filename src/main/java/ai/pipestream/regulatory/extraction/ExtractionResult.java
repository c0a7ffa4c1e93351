package ai.pipestream.regulatory.extraction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractionResult(List<ExtractedCandidate> extractions, List<String> warnings) {

    public ExtractionResult {
        extractions = extractions == null ? List.of() : List.copyOf(extractions);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
