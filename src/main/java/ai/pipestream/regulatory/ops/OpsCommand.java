package ai.pipestream.regulatory.ops;

import ai.pipestream.regulatory.evidence.DedupReport;
import ai.pipestream.regulatory.evidence.EvidenceDeduplicator;
import ai.pipestream.regulatory.health.GateReport;
import ai.pipestream.regulatory.health.GateResult;
import ai.pipestream.regulatory.health.HealthGateService;
import ai.pipestream.regulatory.release.ReleaseVerifier;
import ai.pipestream.regulatory.release.VerificationResult;
import io.agroal.api.AgroalDataSource;
import io.agroal.api.configuration.supplier.AgroalDataSourceConfigurationSupplier;
import io.agroal.api.security.NamePrincipal;
import io.agroal.api.security.SimplePassword;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.PrintStream;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;

/**
 * Operator sub-commands. Each prints a report and returns a process exit code:
 * 0 when nothing failed, 1 on a FAIL condition, 2 on bad usage.
 */
@ApplicationScoped
public class OpsCommand {

    private static final Logger LOG = Logger.getLogger(OpsCommand.class);

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    @Inject
    HealthGateService healthGates;

    @Inject
    EvidenceDeduplicator deduplicator;

    @Inject
    ReleaseVerifier releaseVerifier;

    PrintStream out = System.out;

    public int execute(String... args) {
        if (args.length == 0) {
            return usage();
        }
        String[] rest = Arrays.copyOfRange(args, 1, args.length);
        LOG.infof("Running ops command %s", args[0]);
        return switch (args[0]) {
            case "verify-parity" -> verifyParity(rest);
            case "health-gates" -> healthGates();
            case "dedup-evidence" -> dedupEvidence();
            case "verify-releases" -> verifyReleases();
            default -> usage();
        };
    }

    int healthGates() {
        GateReport report = healthGates.evaluate();
        out.println("=== Health gates ===");
        for (GateResult result : report.results()) {
            out.println(result);
        }
        out.println(report.overall() + " (" + report.summary() + ")");
        return report.exitCode();
    }

    int dedupEvidence() {
        DedupReport report = deduplicator.deduplicate();
        out.printf("Duplicate groups: %d%n", report.duplicateGroups());
        out.printf("Rows merged: %d%n", report.rowsMerged());
        out.printf("Source pointers migrated: %d%n", report.pointersMigrated());
        out.printf("Agent runs migrated: %d%n", report.agentRunsMigrated());
        out.printf("Remaining duplicate groups: %d%n", report.remainingDuplicateGroups());
        return report.clean() ? OK : FAILED;
    }

    int verifyReleases() {
        releaseVerifier.invalidateCache();
        List<VerificationResult> results = releaseVerifier.verifyAll();
        long invalid = 0;
        for (VerificationResult result : results) {
            out.printf("%-12s %s%n", result.version(), result.valid() ? "OK" : "INTEGRITY VIOLATION stored="
                    + result.storedHash() + " recomputed=" + result.recomputedHash());
            if (!result.valid()) {
                invalid++;
            }
        }
        out.printf("Releases: %d, invalid: %d%n", results.size(), invalid);
        return invalid == 0 ? OK : FAILED;
    }

    int verifyParity(String... args) {
        if (args.length < 2) {
            return usage();
        }
        String user = args.length > 2 ? args[2] : null;
        String password = args.length > 3 ? args[3] : null;
        try (AgroalDataSource source = dataSource(args[0], user, password);
             AgroalDataSource target = dataSource(args[1], user, password)) {
            ParityReport report = new ParityVerifier(source, target).verify();
            ParityVerifier.print(report, out);
            return report.exitCode();
        } catch (SQLException e) {
            LOG.errorf(e, "Parity verification could not run");
            out.println("Parity verification failed: " + e.getMessage());
            return FAILED;
        }
    }

    static AgroalDataSource dataSource(String jdbcUrl, String user, String password) throws SQLException {
        AgroalDataSourceConfigurationSupplier configuration = new AgroalDataSourceConfigurationSupplier()
                .connectionPoolConfiguration(pool -> pool
                        .maxSize(2)
                        .connectionFactoryConfiguration(factory -> {
                            factory.jdbcUrl(jdbcUrl);
                            if (user != null) {
                                factory.principal(new NamePrincipal(user));
                            }
                            if (password != null) {
                                factory.credential(new SimplePassword(password));
                            }
                            return factory;
                        }));
        return AgroalDataSource.from(configuration);
    }

    private int usage() {
        out.println("""
                Usage:
                  verify-parity <sourceJdbcUrl> <targetJdbcUrl> [user] [password]
                  health-gates
                  dedup-evidence
                  verify-releases""");
        return USAGE;
    }
}
