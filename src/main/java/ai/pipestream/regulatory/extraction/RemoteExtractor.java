package ai.pipestream.regulatory.extraction;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.rest.client.inject.RestClient;

@ApplicationScoped
public class RemoteExtractor implements Extractor {

    @Inject
    @RestClient
    ExtractorClient client;

    @Override
    public ExtractionResult extract(ExtractionRequest request) {
        return client.extract(request);
    }
}
