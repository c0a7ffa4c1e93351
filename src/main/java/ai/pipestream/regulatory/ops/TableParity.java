package ai.pipestream.regulatory.ops;

import java.util.List;

/**
 * Parity of one logical table between the source and target schema.
 */
public record TableParity(String table, long sourceCount, long targetCount,
                          List<String> missingInTarget, List<String> extraInTarget) {

    public TableParity {
        missingInTarget = List.copyOf(missingInTarget);
        extraInTarget = List.copyOf(extraInTarget);
    }

    public boolean passed() {
        return sourceCount == targetCount && missingInTarget.isEmpty() && extraInTarget.isEmpty();
    }
}
