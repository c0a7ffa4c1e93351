package ai.pipestream.regulatory.evidence;

import ai.pipestream.regulatory.entity.Evidence;

/**
 * @param evidence          the live row for the fetched content
 * @param created           false when the same url and content were already stored
 * @param pointersMigrated  pointers moved over from stale versions of the same url
 */
public record IngestResult(Evidence evidence, boolean created, int pointersMigrated) {
}
