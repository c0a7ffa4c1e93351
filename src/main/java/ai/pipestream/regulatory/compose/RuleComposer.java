package ai.pipestream.regulatory.compose;

import ai.pipestream.regulatory.entity.AuthorityLevel;
import ai.pipestream.regulatory.entity.Evidence;
import ai.pipestream.regulatory.entity.MatchType;
import ai.pipestream.regulatory.entity.RegulatoryRule;
import ai.pipestream.regulatory.entity.RuleStatus;
import ai.pipestream.regulatory.entity.SourcePointer;
import ai.pipestream.regulatory.evidence.EvidenceLookup;
import ai.pipestream.regulatory.metrics.PipelineMetrics;
import ai.pipestream.regulatory.review.RuleStatusService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Folds grounded pointers into draft rules, one rule per concept, value and
 * effective period, and hands them to review.
 * <p>
 * Several rules may exist for the same concept at once; the arbiter decides
 * between them.
 */
@ApplicationScoped
public class RuleComposer {

    private static final Logger LOG = Logger.getLogger(RuleComposer.class);

    @Inject
    EvidenceLookup evidenceLookup;

    @Inject
    RiskTierClassifier riskTierClassifier;

    @Inject
    RuleStatusService statusService;

    @Inject
    PipelineMetrics metrics;

    @Transactional
    public ComposeReport composePending(int limit) {
        List<SourcePointer> pointers = SourcePointer
                .find("matchType = ?1 and composedAt is null order by createdAt", MatchType.GROUNDED)
                .page(0, limit)
                .list();

        Map<GroupKey, List<SourcePointer>> groups = new LinkedHashMap<>();
        for (SourcePointer pointer : pointers) {
            GroupKey key = new GroupKey(pointer.conceptSlug, ValueNormalizer.normalize(pointer.extractedValue),
                    pointer.effectiveFrom, pointer.effectiveUntil);
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(pointer);
        }

        Instant now = Instant.now();
        int created = 0;
        int extended = 0;
        for (Map.Entry<GroupKey, List<SourcePointer>> group : groups.entrySet()) {
            GroupKey key = group.getKey();
            List<SourcePointer> members = group.getValue();
            Optional<RegulatoryRule> open = findOpenRule(key);
            RegulatoryRule rule = open.orElseGet(() -> newDraft(key, members.get(0), now));
            if (open.isPresent()) {
                extended++;
            } else {
                created++;
            }
            for (SourcePointer pointer : members) {
                rule.sourcePointers.add(pointer);
                pointer.composedAt = now;
            }
            refreshDerivedFields(rule);
            if (rule.status == RuleStatus.DRAFT) {
                statusService.transition(rule, RuleStatus.PENDING_REVIEW, "composer", null);
            }
            LOG.debugf("Composed %d pointers into rule %s (concept=%s, value=%s)",
                    members.size(), rule.id, rule.conceptSlug, rule.value);
        }

        if (!pointers.isEmpty()) {
            LOG.infof("Composition: pointers=%d, rulesCreated=%d, rulesExtended=%d",
                    pointers.size(), created, extended);
        }
        metrics.recordRulesComposed(created);
        return new ComposeReport(pointers.size(), created, extended, 0);
    }

    /**
     * Sends DRAFT rules that still have grounded support back to review.
     * These are rules that were reset after an evidence change.
     */
    @Transactional
    public int submitDrafts(int limit) {
        List<RegulatoryRule> drafts = RegulatoryRule.find("status = ?1 order by updatedAt", RuleStatus.DRAFT)
                .page(0, limit)
                .list();
        int submitted = 0;
        for (RegulatoryRule rule : drafts) {
            if (RuleConfidence.groundedCount(rule.sourcePointers) == 0) {
                continue;
            }
            refreshDerivedFields(rule);
            statusService.transition(rule, RuleStatus.PENDING_REVIEW, "composer", "resubmitted after evidence change");
            submitted++;
        }
        if (submitted > 0) {
            LOG.infof("Resubmitted %d draft rules for review", submitted);
        }
        return submitted;
    }

    /**
     * Recomputes confidence and authority from the rule's pointers.
     */
    public void refreshDerivedFields(RegulatoryRule rule) {
        rule.confidence = RuleConfidence.derive(rule.sourcePointers);
        AuthorityLevel authority = null;
        for (SourcePointer pointer : rule.sourcePointers) {
            if (pointer.matchType != MatchType.GROUNDED) {
                continue;
            }
            Optional<Evidence> evidence = evidenceLookup.resolve(pointer.evidenceRef());
            if (evidence.isPresent()) {
                authority = AuthorityLevel.strongest(authority, evidence.get().authorityLevel);
            }
        }
        rule.authorityLevel = authority;
        rule.updatedAt = Instant.now();
    }

    private Optional<RegulatoryRule> findOpenRule(GroupKey key) {
        List<RegulatoryRule> candidates = RegulatoryRule.list(
                "conceptSlug = ?1 and normalizedValue = ?2 and status in ?3",
                key.conceptSlug(), key.normalizedValue(), List.of(RuleStatus.DRAFT, RuleStatus.PENDING_REVIEW));
        return candidates.stream()
                .filter(r -> Objects.equals(r.effectiveFrom, key.effectiveFrom())
                        && Objects.equals(r.effectiveUntil, key.effectiveUntil()))
                .findFirst();
    }

    private RegulatoryRule newDraft(GroupKey key, SourcePointer first, Instant now) {
        RegulatoryRule rule = new RegulatoryRule();
        rule.conceptSlug = key.conceptSlug();
        rule.title = title(key.conceptSlug(), first.articleReference);
        rule.value = first.extractedValue;
        rule.normalizedValue = key.normalizedValue();
        rule.valueType = first.valueType;
        rule.riskTier = riskTierClassifier.classify(key.conceptSlug());
        rule.status = RuleStatus.DRAFT;
        rule.effectiveFrom = key.effectiveFrom() != null ? key.effectiveFrom() : fetchDate(first);
        rule.effectiveUntil = key.effectiveUntil();
        rule.createdAt = now;
        rule.updatedAt = now;
        rule.persist();
        return rule;
    }

    private LocalDate fetchDate(SourcePointer pointer) {
        return evidenceLookup.resolve(pointer.evidenceRef())
                .map(e -> LocalDate.ofInstant(e.fetchedAt, ZoneOffset.UTC))
                .orElse(null);
    }

    static String title(String conceptSlug, String articleReference) {
        String words = conceptSlug.replace('-', ' ');
        String title = words.isEmpty() ? conceptSlug : Character.toUpperCase(words.charAt(0)) + words.substring(1);
        return articleReference == null || articleReference.isBlank() ? title : title + " (" + articleReference + ")";
    }

    private record GroupKey(String conceptSlug, String normalizedValue, LocalDate effectiveFrom, LocalDate effectiveUntil) {
    }
}
