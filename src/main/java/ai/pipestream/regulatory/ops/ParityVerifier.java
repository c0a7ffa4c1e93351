package ai.pipestream.regulatory.ops;

import org.jboss.logging.Logger;

import javax.sql.DataSource;
import java.io.PrintStream;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Compares the authoritative and the dependent copy of the rule-version tables.
 * <p>
 * Every table must match on row count and on its set of composite keys:
 * <ul>
 *   <li>rule_table: {@code tableKey}</li>
 *   <li>rule_version: {@code tableKey|version|dataHash|effectiveFrom|effectiveUntil}</li>
 *   <li>rule_snapshot, rule_calculation: {@code tableKey|version|rowsForThatVersion}</li>
 * </ul>
 * Missing dates render as {@code null}.
 */
public class ParityVerifier {

    private static final Logger LOG = Logger.getLogger(ParityVerifier.class);

    private static final String RULE_TABLE_KEYS = "SELECT table_key FROM rule_table";
    private static final String RULE_VERSION_KEYS = """
            SELECT t.table_key, v.version, v.data_hash, v.effective_from, v.effective_until
            FROM rule_version v JOIN rule_table t ON t.id = v.table_id""";
    private static final String PER_VERSION_COUNTS = """
            SELECT t.table_key, v.version, COUNT(c.id)
            FROM %s c
            JOIN rule_version v ON v.id = c.rule_version_id
            JOIN rule_table t ON t.id = v.table_id
            GROUP BY t.table_key, v.version""";

    private final DataSource source;
    private final DataSource target;

    public ParityVerifier(DataSource source, DataSource target) {
        this.source = source;
        this.target = target;
    }

    public ParityReport verify() throws SQLException {
        List<TableParity> tables = new ArrayList<>();
        tables.add(compare("RuleTable", "rule_table", RULE_TABLE_KEYS, KeyKind.TABLE));
        tables.add(compare("RuleVersion", "rule_version", RULE_VERSION_KEYS, KeyKind.VERSION));
        tables.add(compare("RuleSnapshot", "rule_snapshot", PER_VERSION_COUNTS.formatted("rule_snapshot"), KeyKind.COUNT));
        tables.add(compare("RuleCalculation", "rule_calculation", PER_VERSION_COUNTS.formatted("rule_calculation"), KeyKind.COUNT));
        ParityReport report = new ParityReport(tables);
        LOG.infof("Parity verification %s", report.passed() ? "passed" : "FAILED");
        return report;
    }

    private TableParity compare(String name, String table, String keyQuery, KeyKind kind) throws SQLException {
        long sourceCount = count(source, table);
        long targetCount = count(target, table);
        Set<String> sourceKeys = keys(source, keyQuery, kind);
        Set<String> targetKeys = keys(target, keyQuery, kind);

        Set<String> missing = new TreeSet<>(sourceKeys);
        missing.removeAll(targetKeys);
        Set<String> extra = new TreeSet<>(targetKeys);
        extra.removeAll(sourceKeys);
        return new TableParity(name, sourceCount, targetCount, new ArrayList<>(missing), new ArrayList<>(extra));
    }

    private static long count(DataSource dataSource, String table) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement("SELECT COUNT(*) FROM " + table);
             ResultSet rs = statement.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private static Set<String> keys(DataSource dataSource, String query, KeyKind kind) throws SQLException {
        Set<String> keys = new HashSet<>();
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(query);
             ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                keys.add(switch (kind) {
                    case TABLE -> rs.getString(1);
                    case VERSION -> String.join("|", rs.getString(1), rs.getString(2), rs.getString(3),
                            date(rs.getObject(4, LocalDate.class)), date(rs.getObject(5, LocalDate.class)));
                    case COUNT -> rs.getString(1) + "|" + rs.getString(2) + "|" + rs.getLong(3);
                });
            }
        }
        return keys;
    }

    private static String date(LocalDate date) {
        return date == null ? "null" : date.toString();
    }

    /**
     * Writes a human-readable report listing every mismatching key.
     */
    public static void print(ParityReport report, PrintStream out) {
        out.println("=== Rule version parity ===");
        for (TableParity table : report.tables()) {
            out.printf("%-16s %s  source=%d target=%d%n", table.table(), table.passed() ? "PASS" : "FAIL",
                    table.sourceCount(), table.targetCount());
            printKeys(out, "missing in target", table.missingInTarget());
            printKeys(out, "extra in target", table.extraInTarget());
        }
        out.println(report.passed() ? "Parity verified" : "Parity mismatch detected");
    }

    private static void printKeys(PrintStream out, String label, List<String> keys) {
        if (keys.isEmpty()) {
            return;
        }
        out.printf("    %s (%d):%n", label, keys.size());
        keys.forEach(k -> out.println("      " + k));
    }

    private enum KeyKind {
        TABLE,
        VERSION,
        COUNT
    }
}
