package ai.pipestream.regulatory.health;

public record GateResult(String gate, GateStatus status, String detail) {

    @Override
    public String toString() {
        return String.format("%-5s %-22s %s", status, gate, detail);
    }
}
