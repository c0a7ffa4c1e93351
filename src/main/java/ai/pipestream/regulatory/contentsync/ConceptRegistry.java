package ai.pipestream.regulatory.contentsync;

import ai.pipestream.regulatory.config.PipelineConfiguration;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * Concept slug to downstream content files, loaded from a classpath JSON resource.
 */
@ApplicationScoped
public class ConceptRegistry {

    private static final Logger LOG = Logger.getLogger(ConceptRegistry.class);

    @Inject
    PipelineConfiguration config;

    @Inject
    ObjectMapper objectMapper;

    private Map<String, List<String>> paths = Map.of();

    @PostConstruct
    void load() {
        String resource = config.contentSync().registryResource();
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                LOG.warnf("Concept registry %s not found, every concept is unmapped", resource);
                return;
            }
            paths = Map.copyOf(objectMapper.readValue(in, new TypeReference<Map<String, List<String>>>() {
            }));
            LOG.infof("Loaded concept registry: resource=%s, concepts=%d", resource, paths.size());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read concept registry " + resource, e);
        }
    }

    public List<String> pathsFor(String conceptSlug) {
        return paths.getOrDefault(conceptSlug, List.of());
    }
}
