package ai.pipestream.regulatory.extraction;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * REST client for the external extraction service.
 * Configured through {@code quarkus.rest-client.extractor.*}.
 */
@RegisterRestClient(configKey = "extractor")
@Path("/extract")
public interface ExtractorClient {

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    ExtractionResult extract(ExtractionRequest request);
}
