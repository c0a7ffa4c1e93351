package ai.pipestream.regulatory.ops;

import java.util.List;

public record ParityReport(List<TableParity> tables) {

    public ParityReport {
        tables = List.copyOf(tables);
    }

    public boolean passed() {
        return tables.stream().allMatch(TableParity::passed);
    }

    public int exitCode() {
        return passed() ? 0 : 1;
    }
}
