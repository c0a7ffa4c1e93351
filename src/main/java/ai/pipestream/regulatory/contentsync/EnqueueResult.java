package ai.pipestream.regulatory.contentsync;

/**
 * @param created false when a row with this event id already existed
 */
public record EnqueueResult(String eventId, boolean created) {
}
