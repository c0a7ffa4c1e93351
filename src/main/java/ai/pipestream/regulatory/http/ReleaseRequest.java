package ai.pipestream.regulatory.http;

import java.util.List;
import java.util.UUID;

/**
 * @param ruleIds APPROVED rules to publish; empty or absent means all of them
 */
public record ReleaseRequest(String releasedBy, List<UUID> ruleIds) {
}
