package ai.pipestream.regulatory.entity;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Derived, immutable text representation of an {@link Evidence} row.
 */
@Entity
@Table(name = "evidence_artifacts", uniqueConstraints = {
        @UniqueConstraint(name = "uq_artifact_evidence_kind_hash",
                columnNames = {"evidence_id", "kind", "content_hash"})
})
public class EvidenceArtifact extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    public UUID id;

    @Column(name = "evidence_id", nullable = false)
    public UUID evidenceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    public ArtifactKind kind;

    @Column(nullable = false, columnDefinition = "text")
    public String content;

    @Column(name = "content_hash", nullable = false, length = 64)
    public String contentHash;

    /**
     * Mean OCR confidence reported by the OCR collaborator, only for OCR_TEXT.
     */
    @Column(name = "ocr_confidence")
    public Double ocrConfidence;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public static Optional<EvidenceArtifact> findLatest(UUID evidenceId, ArtifactKind kind) {
        return find("evidenceId = ?1 and kind = ?2 order by createdAt desc", evidenceId, kind)
                .firstResultOptional();
    }

    public static Optional<EvidenceArtifact> findByHash(UUID evidenceId, ArtifactKind kind, String contentHash) {
        return find("evidenceId = ?1 and kind = ?2 and contentHash = ?3", evidenceId, kind, contentHash)
                .firstResultOptional();
    }
}
