package ai.pipestream.regulatory.release;

import ai.pipestream.regulatory.arbiter.ConflictArbiter;
import ai.pipestream.regulatory.entity.RegulatoryConflict;
import ai.pipestream.regulatory.entity.RegulatoryRule;
import ai.pipestream.regulatory.entity.ReleaseType;
import ai.pipestream.regulatory.entity.RuleRelease;
import ai.pipestream.regulatory.entity.RuleStatus;
import ai.pipestream.regulatory.exception.EntityNotFoundException;
import ai.pipestream.regulatory.exception.ReleaseException;
import ai.pipestream.regulatory.metrics.PipelineMetrics;
import ai.pipestream.regulatory.review.RuleStatusService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Publishes approved rules as a new, hash-sealed release.
 * <p>
 * A release holds every rule that is PUBLISHED afterwards. The changes are
 * the APPROVED rules being published plus the PUBLISHED rules they supersede;
 * only those decide the version bump. All status changes, their content-sync
 * events and the release row commit together.
 * <p>
 * Conflict detection runs for every requested concept first, so contradicting
 * rules approved since the last detection pass are held back. Conflicts opened
 * here are kept even when the release is then refused.
 */
@ApplicationScoped
public class RuleReleaser {

    private static final Logger LOG = Logger.getLogger(RuleReleaser.class);

    @Inject
    RuleStatusService statusService;

    @Inject
    ConflictArbiter arbiter;

    @Inject
    PipelineMetrics metrics;

    @Transactional(dontRollbackOn = ReleaseException.class)
    public RuleRelease releaseAllApproved(String releasedBy) {
        List<UUID> approved = RegulatoryRule.listByStatus(RuleStatus.APPROVED).stream().map(r -> r.id).toList();
        return release(approved, releasedBy);
    }

    @Transactional(dontRollbackOn = ReleaseException.class)
    public RuleRelease release(Collection<UUID> approvedRuleIds, String releasedBy) {
        List<RegulatoryRule> requested = new ArrayList<>();
        for (UUID ruleId : approvedRuleIds) {
            RegulatoryRule rule = RegulatoryRule.findById(ruleId);
            if (rule == null) {
                throw EntityNotFoundException.rule(ruleId);
            }
            if (rule.status != RuleStatus.APPROVED) {
                throw new ReleaseException("Rule " + ruleId + " is " + rule.status + ", not APPROVED");
            }
            requested.add(rule);
        }
        requested.stream().map(r -> r.conceptSlug).distinct().forEach(arbiter::detectConflicts);

        Map<UUID, RegulatoryRule> changed = new LinkedHashMap<>();
        List<String> held = new ArrayList<>();
        for (RegulatoryRule rule : requested) {
            UUID ruleId = rule.id;
            if (RegulatoryConflict.countOpenForRule(ruleId) > 0) {
                held.add(rule.conceptSlug + " (" + ruleId + ")");
                continue;
            }
            changed.put(rule.id, rule);
        }
        if (!held.isEmpty()) {
            LOG.warnf("Rules held back from release by open conflicts: %s", held);
        }
        if (changed.isEmpty()) {
            throw ReleaseException.nothingToRelease();
        }

        List<RegulatoryRule> superseded = RegulatoryRule.listByStatus(RuleStatus.PUBLISHED).stream()
                .filter(r -> r.supersededByRuleId != null && changed.containsKey(r.supersededByRuleId))
                .toList();

        List<RegulatoryRule> allChanges = new ArrayList<>(changed.values());
        allChanges.addAll(superseded);
        ReleaseType type = ReleaseTypeCalculator.forChanges(allChanges);
        SemanticVersion previous = RuleRelease.findLatest()
                .map(r -> SemanticVersion.parse(r.version))
                .orElse(SemanticVersion.BASELINE);
        SemanticVersion next = previous.bump(type);
        String note = "Released in " + next;

        for (RegulatoryRule rule : changed.values()) {
            statusService.transition(rule, RuleStatus.PUBLISHED, releasedBy, note);
        }
        for (RegulatoryRule rule : superseded) {
            statusService.transition(rule, RuleStatus.SUPERSEDED, releasedBy,
                    "Superseded by " + rule.supersededByRuleId + " in " + next);
        }

        Set<RegulatoryRule> members = new LinkedHashSet<>(RegulatoryRule.listByStatus(RuleStatus.PUBLISHED));

        RuleRelease release = new RuleRelease();
        release.version = next.toString();
        release.versionMajor = next.major();
        release.versionMinor = next.minor();
        release.versionPatch = next.patch();
        release.releaseType = type;
        release.rules = members;
        release.contentHash = CanonicalRuleSerializer.contentHash(members);
        release.changelog = changelog(changed.values(), superseded);
        release.releasedBy = releasedBy;
        release.releasedAt = Instant.now();
        release.persist();

        metrics.recordRelease(type);
        LOG.infof("Release %s created: type=%s, members=%d, changed=%d, superseded=%d, hash=%s",
                release.version, type, members.size(), changed.size(), superseded.size(), release.contentHash);
        return release;
    }

    static String changelog(Collection<RegulatoryRule> published, Collection<RegulatoryRule> superseded) {
        StringBuilder sb = new StringBuilder();
        for (RegulatoryRule rule : published) {
            sb.append("+ ").append(rule.conceptSlug).append(" = ").append(rule.value)
                    .append(" [").append(rule.riskTier).append("]");
            if (rule.effectiveFrom != null) {
                sb.append(" from ").append(rule.effectiveFrom);
            }
            sb.append('\n');
        }
        for (RegulatoryRule rule : superseded) {
            sb.append("- ").append(rule.conceptSlug).append(" = ").append(rule.value)
                    .append(" superseded by ").append(rule.supersededByRuleId).append('\n');
        }
        return sb.toString();
    }
}
