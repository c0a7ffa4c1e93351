package ai.pipestream.regulatory.entity;

public enum ContentSyncEventType {
    RULE_RELEASED,
    RULE_SUPERSEDED,
    RULE_EFFECTIVE,
    SOURCE_CHANGED,
    CONFIDENCE_DROPPED
}
