package ai.pipestream.regulatory.config;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

/**
 * Tests that every {@code rtl.*} key in application.properties maps onto the configuration interface.
 */
@QuarkusTest
public class PipelineConfigurationTest {

    @Inject
    PipelineConfiguration config;

    @Test
    void testDrainerSettings() {
        assertThat(config.drainer().interval(), is("60s"));
        assertThat(config.drainer().batchSize(), is(200));
        assertThat("Scheduler is off in the test profile", config.drainer().enabled(), is(false));
    }

    @Test
    void testContentSyncSettings() {
        assertThat(config.contentSync().maxAttempts(), is(8));
        assertThat(config.contentSync().initialBackoff(), is(Duration.ofSeconds(30)));
        assertThat(config.contentSync().processingLease(), is(Duration.ofMinutes(15)));
        assertThat(config.contentSync().contentDir(), is("target/content-sync-test"));
    }

    @Test
    void testConceptAliases() {
        assertThat(config.concepts().aliases(), hasEntry("vat-threshold", "pdv-prag"));
    }
}
