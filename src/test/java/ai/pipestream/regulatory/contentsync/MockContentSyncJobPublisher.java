package ai.pipestream.regulatory.contentsync;

import io.quarkus.test.Mock;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Mock ContentSyncJobPublisher for tests.
 * Records published event ids without a queue backend and can be told to fail for chosen ids.
 */
@Mock
@ApplicationScoped
public class MockContentSyncJobPublisher extends ContentSyncJobPublisher {

    private static final Logger LOG = Logger.getLogger(MockContentSyncJobPublisher.class);

    private final List<String> published = new CopyOnWriteArrayList<>();
    private final Set<String> failing = ConcurrentHashMap.newKeySet();

    @Override
    public void enqueueContentSyncJob(String eventId) {
        if (failing.contains(eventId)) {
            LOG.infof("Mock enqueueContentSyncJob failing: eventId=%s", eventId);
            throw new IllegalStateException("queue backend unavailable");
        }
        LOG.infof("Mock enqueueContentSyncJob: eventId=%s", eventId);
        published.add(eventId);
    }

    public List<String> getPublished() {
        return List.copyOf(published);
    }

    public void failFor(String eventId) {
        failing.add(eventId);
    }

    public void clear() {
        published.clear();
        failing.clear();
    }
}
