package ai.pipestream.regulatory.contentsync;

import ai.pipestream.regulatory.config.PipelineConfiguration;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Content files on local disk under {@code rtl.content-sync.content-dir}.
 * Each applied event leaves a marker comment, so a redelivered event is detected.
 */
@ApplicationScoped
public class FileSystemContentTarget implements ContentTarget {

    private static final Logger LOG = Logger.getLogger(FileSystemContentTarget.class);

    @Inject
    PipelineConfiguration config;

    static String marker(String eventId) {
        return "<!-- content-sync:" + eventId + " -->";
    }

    @Override
    public void applyChangelog(String relativePath, ContentSyncPayload payload) {
        Path root = Path.of(config.contentSync().contentDir()).toAbsolutePath().normalize();
        Path file = root.resolve(relativePath).normalize();
        if (!file.startsWith(root)) {
            throw new InvalidPayloadException("Content path escapes content root: " + relativePath);
        }
        if (!Files.isRegularFile(file)) {
            throw new ContentNotFoundException(relativePath);
        }
        String marker = marker(payload.eventId());
        try {
            String current = Files.readString(file, StandardCharsets.UTF_8);
            if (current.contains(marker)) {
                throw new PatchConflictException(relativePath, payload.eventId());
            }
            String entry = "\n" + marker + "\n" + changelogEntry(payload) + "\n";
            Files.writeString(file, entry, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new RepoWriteFailedException("Cannot write content file " + relativePath + ": " + e.getMessage(), e);
        }
        LOG.debugf("Applied content-sync event to %s: eventId=%s", relativePath, payload.eventId());
    }

    static String changelogEntry(ContentSyncPayload payload) {
        StringBuilder sb = new StringBuilder();
        sb.append("- **").append(payload.type()).append("** `").append(payload.conceptSlug()).append('`');
        if (payload.value() != null) {
            sb.append(": ").append(payload.value());
        }
        if (payload.effectiveFrom() != null) {
            sb.append(" (effective ").append(payload.effectiveFrom());
            if (payload.effectiveUntil() != null) {
                sb.append(" until ").append(payload.effectiveUntil());
            }
            sb.append(')');
        }
        if (payload.note() != null && !payload.note().isBlank()) {
            sb.append(" - ").append(payload.note());
        }
        return sb.toString();
    }
}
