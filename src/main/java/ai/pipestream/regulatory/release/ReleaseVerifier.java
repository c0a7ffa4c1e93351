package ai.pipestream.regulatory.release;

import ai.pipestream.regulatory.entity.RuleRelease;
import ai.pipestream.regulatory.exception.EntityNotFoundException;
import ai.pipestream.regulatory.exception.IntegrityException;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.GuavaCacheMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Recomputes release hashes from the member rules.
 * Successful verifications are cached for a short time; failures never are.
 */
@ApplicationScoped
public class ReleaseVerifier {

    private static final Logger LOG = Logger.getLogger(ReleaseVerifier.class);

    @Inject
    MeterRegistry meterRegistry;

    private Cache<String, VerificationResult> verified;

    @PostConstruct
    void init() {
        verified = CacheBuilder.newBuilder()
                .maximumSize(256)
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .recordStats()
                .build();
        GuavaCacheMetrics.monitor(meterRegistry, verified, "release_verification");
    }

    @Transactional
    public VerificationResult verify(String version) {
        VerificationResult cached = verified.getIfPresent(version);
        if (cached != null) {
            return cached;
        }
        RuleRelease release = RuleRelease.findByVersion(version)
                .orElseThrow(() -> EntityNotFoundException.release(version));
        VerificationResult result = verify(release);
        if (result.valid()) {
            verified.put(version, result);
        }
        return result;
    }

    @Transactional
    public VerificationResult verify(RuleRelease release) {
        String recomputed = CanonicalRuleSerializer.contentHash(release.rules);
        boolean valid = recomputed.equals(release.contentHash);
        if (!valid) {
            LOG.warnf("Release integrity check failed: version=%s, stored=%s, recomputed=%s",
                    release.version, release.contentHash, recomputed);
        }
        return new VerificationResult(release.version, valid, release.contentHash, recomputed);
    }

    /**
     * @throws IntegrityException when the stored hash does not match
     */
    @Transactional
    public RuleRelease verifyOrThrow(RuleRelease release) {
        VerificationResult result = verify(release);
        if (!result.valid()) {
            throw new IntegrityException(release.version, result.storedHash(), result.recomputedHash());
        }
        return release;
    }

    @Transactional
    public List<VerificationResult> verifyAll() {
        List<RuleRelease> releases = RuleRelease.list("order by versionMajor, versionMinor, versionPatch");
        return releases.stream().map(this::verify).toList();
    }

    public void invalidateCache() {
        verified.invalidateAll();
    }
}
