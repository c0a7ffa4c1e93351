package ai.pipestream.regulatory.contentsync;

/**
 * @param enqueued    events handed to the queue and marked ENQUEUED
 * @param stale       events handed over but already moved on by another writer
 * @param failed      events the backend refused; they stay drainable
 */
public record DrainReport(int enqueued, int stale, int failed) {
}
