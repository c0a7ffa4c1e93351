package ai.pipestream.regulatory.entity;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A versioned factual rule for one concept.
 * <p>
 * Status changes go through {@code RuleStatusService}; do not assign
 * {@link #status} directly outside of it.
 */
@Entity
@Table(name = "regulatory_rules", indexes = {
        @Index(name = "idx_rules_concept_status", columnList = "concept_slug, status")
})
public class RegulatoryRule extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    public UUID id;

    @Column(name = "concept_slug", nullable = false, length = 256)
    public String conceptSlug;

    @Column(nullable = false, length = 512)
    public String title;

    @Column(name = "rule_value", nullable = false, length = 1024)
    public String value;

    /**
     * Comparison form of {@link #value}, see {@code ValueNormalizer}.
     */
    @Column(name = "normalized_value", nullable = false, length = 1024)
    public String normalizedValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "value_type", nullable = false, length = 16)
    public ValueType valueType;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_tier", nullable = false, length = 4)
    public RiskTier riskTier;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    public RuleStatus status = RuleStatus.DRAFT;

    @Enumerated(EnumType.STRING)
    @Column(name = "authority_level", length = 32)
    public AuthorityLevel authorityLevel;

    @Column(name = "effective_from")
    public LocalDate effectiveFrom;

    @Column(name = "effective_until")
    public LocalDate effectiveUntil;

    @Column(nullable = false)
    public double confidence;

    @Column(name = "superseded_by_rule_id")
    public UUID supersededByRuleId;

    @Column(name = "reviewed_by", length = 256)
    public String reviewedBy;

    @Column(name = "review_note", length = 2048)
    public String reviewNote;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(name = "rule_source_pointers",
            joinColumns = @JoinColumn(name = "rule_id"),
            inverseJoinColumns = @JoinColumn(name = "source_pointer_id"))
    public Set<SourcePointer> sourcePointers = new LinkedHashSet<>();

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    /**
     * Whether this rule's [effectiveFrom, effectiveUntil) interval contains the date.
     * Open ends are unbounded.
     */
    public boolean isEffectiveOn(LocalDate date) {
        if (date == null) {
            return true;
        }
        boolean started = effectiveFrom == null || !date.isBefore(effectiveFrom);
        boolean notEnded = effectiveUntil == null || date.isBefore(effectiveUntil);
        return started && notEnded;
    }

    public static List<RegulatoryRule> listByStatus(RuleStatus status) {
        return list("status = ?1 order by createdAt", status);
    }

    public static List<RegulatoryRule> listLiveByConcept(String conceptSlug) {
        return list("conceptSlug = ?1 and status in ?2 order by createdAt", conceptSlug, RuleStatus.live());
    }

    /**
     * Rules whose pointer set contains the given pointer.
     */
    public static List<RegulatoryRule> listBySourcePointer(UUID sourcePointerId) {
        return list("select r from RegulatoryRule r join r.sourcePointers p where p.id = ?1", sourcePointerId);
    }
}
