package ai.pipestream.regulatory.ops;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ParityVerifier against two in-memory H2 databases.
 */
class ParityVerifierTest {

    private JdbcDataSource source;
    private JdbcDataSource target;

    @BeforeEach
    void setUp() throws SQLException {
        source = database();
        target = database();
        for (JdbcDataSource db : new JdbcDataSource[]{source, target}) {
            execute(db,
                    "INSERT INTO rule_table VALUES (1, 'pdv-stope')",
                    "INSERT INTO rule_table VALUES (2, 'doprinosi')",
                    "INSERT INTO rule_version VALUES (10, 1, 1, 'h1', DATE '2025-01-01', NULL)",
                    "INSERT INTO rule_version VALUES (11, 2, 1, 'h2', DATE '2025-01-01', DATE '2026-01-01')",
                    "INSERT INTO rule_snapshot VALUES (100, 10)",
                    "INSERT INTO rule_snapshot VALUES (101, 10)",
                    "INSERT INTO rule_calculation VALUES (200, 11)");
        }
    }

    @Test
    void testIdenticalCopiesPass() throws SQLException {
        ParityReport report = new ParityVerifier(source, target).verify();

        assertTrue(report.passed());
        assertEquals(0, report.exitCode());
        assertEquals(4, report.tables().size());
        assertEquals(2, report.tables().get(1).sourceCount());
    }

    @Test
    void testChangedHashIsReported() throws SQLException {
        execute(target, "UPDATE rule_version SET data_hash = 'other' WHERE id = 10");

        ParityReport report = new ParityVerifier(source, target).verify();

        assertFalse(report.passed());
        assertEquals(1, report.exitCode());
        TableParity versions = report.tables().get(1);
        assertEquals("RuleVersion", versions.table());
        assertEquals(List.of("pdv-stope|1|h1|2025-01-01|null"), versions.missingInTarget());
        assertEquals(List.of("pdv-stope|1|other|2025-01-01|null"), versions.extraInTarget());
        assertTrue(report.tables().get(0).passed());
    }

    @Test
    void testMissingSnapshotRowChangesCount() throws SQLException {
        execute(target, "DELETE FROM rule_snapshot WHERE id = 101");

        ParityReport report = new ParityVerifier(source, target).verify();

        TableParity snapshots = report.tables().get(2);
        assertFalse(snapshots.passed());
        assertEquals(2, snapshots.sourceCount());
        assertEquals(1, snapshots.targetCount());
        assertEquals(List.of("pdv-stope|1|2"), snapshots.missingInTarget());
    }

    @Test
    void testPrintedReport() throws SQLException {
        execute(target, "DELETE FROM rule_calculation");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        ParityVerifier.print(new ParityVerifier(source, target).verify(),
                new PrintStream(buffer, true, StandardCharsets.UTF_8));

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("RuleCalculation  FAIL"));
        assertTrue(output.contains("missing in target (1)"));
        assertTrue(output.endsWith("Parity mismatch detected" + System.lineSeparator()));
    }

    @Test
    void testPrintedReportListsEveryMismatchingKey() throws SQLException {
        for (int i = 0; i < 30; i++) {
            execute(source, "INSERT INTO rule_table VALUES (" + (1000 + i) + ", 'koncept-" + i + "')");
        }
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        ParityVerifier.print(new ParityVerifier(source, target).verify(),
                new PrintStream(buffer, true, StandardCharsets.UTF_8));

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("missing in target (30)"));
        for (int i = 0; i < 30; i++) {
            assertTrue(output.contains("      koncept-" + i + System.lineSeparator()), "koncept-" + i);
        }
        assertFalse(output.contains("more"));
    }

    private static JdbcDataSource database() throws SQLException {
        JdbcDataSource db = new JdbcDataSource();
        db.setURL("jdbc:h2:mem:parity-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        execute(db,
                "CREATE TABLE rule_table (id BIGINT PRIMARY KEY, table_key VARCHAR(128) NOT NULL)",
                "CREATE TABLE rule_version (id BIGINT PRIMARY KEY, table_id BIGINT NOT NULL, version INT NOT NULL,"
                        + " data_hash VARCHAR(64) NOT NULL, effective_from DATE, effective_until DATE)",
                "CREATE TABLE rule_snapshot (id BIGINT PRIMARY KEY, rule_version_id BIGINT NOT NULL)",
                "CREATE TABLE rule_calculation (id BIGINT PRIMARY KEY, rule_version_id BIGINT NOT NULL)");
        return db;
    }

    private static void execute(JdbcDataSource db, String... statements) throws SQLException {
        try (Connection connection = db.getConnection(); Statement statement = connection.createStatement()) {
            for (String sql : statements) {
                statement.execute(sql);
            }
        }
    }
}
