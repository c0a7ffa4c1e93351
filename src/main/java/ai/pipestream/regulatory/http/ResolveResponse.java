package ai.pipestream.regulatory.http;

import java.time.LocalDate;
import java.util.List;

/**
 * Rules of the current release effective for a concept on a date.
 * Consumers must compare {@code contentHash} with their own copy.
 */
public record ResolveResponse(String releaseVersion, String contentHash, String conceptSlug, LocalDate date,
                              List<RuleView> rules) {
}
