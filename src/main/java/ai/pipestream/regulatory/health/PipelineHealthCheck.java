package ai.pipestream.regulatory.health;

import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness: database reachable and no health gate at FAIL.
 */
@Readiness
@ApplicationScoped
public class PipelineHealthCheck implements HealthCheck {

    @Inject
    AgroalDataSource dataSource;

    @Inject
    HealthGateService gates;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("regulatory-truth-service");
        try {
            dataSource.getConnection().close();
            builder.withData("database", "connected");
        } catch (Exception e) {
            return builder.withData("database", "disconnected")
                    .withData("error", String.valueOf(e.getMessage()))
                    .down()
                    .build();
        }

        GateReport report = gates.evaluate();
        for (GateResult result : report.results()) {
            builder.withData(result.gate(), result.status() + " " + result.detail());
        }
        return builder.status(report.overall() != GateStatus.FAIL).build();
    }
}
