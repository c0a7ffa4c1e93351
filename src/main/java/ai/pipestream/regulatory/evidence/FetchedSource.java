package ai.pipestream.regulatory.evidence;

import ai.pipestream.regulatory.entity.AuthorityLevel;
import ai.pipestream.regulatory.entity.ContentClass;

import java.time.Instant;

/**
 * A source document as handed over by the fetcher.
 */
public record FetchedSource(String url,
                            ContentClass contentClass,
                            String rawContent,
                            AuthorityLevel authorityLevel,
                            Instant fetchedAt) {
}
