package ai.pipestream.regulatory.entity;

import ai.pipestream.regulatory.evidence.EvidenceRef;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * One extracted, quote-backed claim.
 * <p>
 * The evidence link is a soft reference: {@link #evidenceId} has no foreign key
 * and may point at a row that no longer exists. Resolve it through
 * {@link #evidenceRef()} and an {@code EvidenceLookup}.
 */
@Entity
@Table(name = "source_pointers", indexes = {
        @Index(name = "idx_source_pointers_evidence", columnList = "evidence_id"),
        @Index(name = "idx_source_pointers_match", columnList = "match_type")
})
public class SourcePointer extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    public UUID id;

    @Column(name = "evidence_id", nullable = false)
    public UUID evidenceId;

    @Column(name = "agent_run_id")
    public UUID agentRunId;

    @Column(nullable = false, length = 256)
    public String domain;

    @Column(name = "concept_slug", nullable = false, length = 256)
    public String conceptSlug;

    @Column(name = "extracted_value", nullable = false, length = 1024)
    public String extractedValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "value_type", nullable = false, length = 16)
    public ValueType valueType = ValueType.TEXT;

    @Column(name = "exact_quote", nullable = false, columnDefinition = "text")
    public String exactQuote;

    @Column(name = "article_reference", length = 256)
    public String articleReference;

    @Column(name = "law_reference", length = 512)
    public String lawReference;

    @Column(nullable = false)
    public double confidence;

    @Column(name = "effective_from")
    public LocalDate effectiveFrom;

    @Column(name = "effective_until")
    public LocalDate effectiveUntil;

    @Enumerated(EnumType.STRING)
    @Column(name = "match_type", nullable = false, length = 32)
    public MatchType matchType = MatchType.PENDING_VERIFICATION;

    @Enumerated(EnumType.STRING)
    @Column(name = "match_kind", nullable = false, length = 16)
    public MatchKind matchKind = MatchKind.NONE;

    @Column(name = "match_start")
    public Integer matchStart;

    @Column(name = "match_end")
    public Integer matchEnd;

    /**
     * Hash of the evidence text the current match type was computed against.
     */
    @Column(name = "verified_content_hash", length = 64)
    public String verifiedContentHash;

    @Column(name = "verification_note", length = 1024)
    public String verificationNote;

    @Column(name = "verified_at")
    public Instant verifiedAt;

    /**
     * Set once the composer has folded this pointer into a rule.
     */
    @Column(name = "composed_at")
    public Instant composedAt;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public EvidenceRef evidenceRef() {
        return new EvidenceRef(evidenceId);
    }

    public boolean isCitable() {
        return matchType == MatchType.GROUNDED;
    }

    public static List<SourcePointer> listPendingVerification(int limit) {
        return find("matchType = ?1 order by createdAt", MatchType.PENDING_VERIFICATION)
                .page(0, limit).list();
    }

    public static List<SourcePointer> listByEvidence(UUID evidenceId) {
        return list("evidenceId", evidenceId);
    }
}
