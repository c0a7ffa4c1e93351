package ai.pipestream.regulatory;

import ai.pipestream.regulatory.ops.OpsCommand;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Entry point. Without arguments the service runs until shutdown; with an ops
 * sub-command it runs that command and exits with its code.
 */
@QuarkusMain
@ApplicationScoped
public class RegulatoryTruthApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(RegulatoryTruthApplication.class);

    @Inject
    OpsCommand opsCommand;

    public static void main(String... args) {
        Quarkus.run(RegulatoryTruthApplication.class, args);
    }

    @Override
    public int run(String... args) throws Exception {
        if (args.length > 0) {
            return opsCommand.execute(args);
        }
        LOG.info("Regulatory Truth Service started successfully");
        Quarkus.waitForExit();
        return 0;
    }
}
