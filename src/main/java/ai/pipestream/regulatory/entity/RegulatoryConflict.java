package ai.pipestream.regulatory.entity;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Two rules that disagree on the same concept for overlapping periods.
 * The pair is stored in a canonical order so that detection is idempotent.
 */
@Entity
@Table(name = "regulatory_conflicts", uniqueConstraints = {
        @UniqueConstraint(name = "uq_conflict_pair", columnNames = {"rule_a_id", "rule_b_id"})
})
public class RegulatoryConflict extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    public UUID id;

    @Column(name = "concept_slug", nullable = false, length = 256)
    public String conceptSlug;

    @Column(name = "rule_a_id", nullable = false)
    public UUID ruleAId;

    @Column(name = "rule_b_id", nullable = false)
    public UUID ruleBId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    public ConflictStatus status = ConflictStatus.OPEN;

    @Column(name = "winning_rule_id")
    public UUID winningRuleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution_policy", length = 16)
    public ResolutionPolicy resolutionPolicy;

    @Column(name = "escalation_reason", length = 1024)
    public String escalationReason;

    @Column(name = "resolved_by", length = 256)
    public String resolvedBy;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "resolved_at")
    public Instant resolvedAt;

    public boolean involves(UUID ruleId) {
        return ruleAId.equals(ruleId) || ruleBId.equals(ruleId);
    }

    public UUID otherRule(UUID ruleId) {
        return ruleAId.equals(ruleId) ? ruleBId : ruleAId;
    }

    public static Optional<RegulatoryConflict> findByPair(UUID ruleAId, UUID ruleBId) {
        return find("ruleAId = ?1 and ruleBId = ?2", ruleAId, ruleBId).firstResultOptional();
    }

    public static List<RegulatoryConflict> listOpen() {
        return list("status = ?1 order by createdAt", ConflictStatus.OPEN);
    }

    public static List<RegulatoryConflict> listOpenByConcept(String conceptSlug) {
        return list("conceptSlug = ?1 and status = ?2 order by createdAt", conceptSlug, ConflictStatus.OPEN);
    }

    public static long countOpenForRule(UUID ruleId) {
        return count("(ruleAId = ?1 or ruleBId = ?1) and status = ?2", ruleId, ConflictStatus.OPEN);
    }
}
