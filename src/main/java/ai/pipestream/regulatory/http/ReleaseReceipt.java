package ai.pipestream.regulatory.http;

import ai.pipestream.regulatory.entity.ReleaseType;
import ai.pipestream.regulatory.entity.RuleRelease;

import java.time.Instant;

public record ReleaseReceipt(String version, ReleaseType releaseType, String contentHash, int memberCount,
                             String changelog, Instant releasedAt) {

    public static ReleaseReceipt of(RuleRelease release) {
        return new ReleaseReceipt(release.version, release.releaseType, release.contentHash, release.rules.size(),
                release.changelog, release.releasedAt);
    }
}
