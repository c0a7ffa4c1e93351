package ai.pipestream.regulatory.health;

public enum GateStatus {
    PASS,
    WARN,
    FAIL
}
