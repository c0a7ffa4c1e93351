package ai.pipestream.regulatory.entity;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * One fetched snapshot of a regulatory source.
 * <p>
 * Rows are never physically removed. A duplicate (same url and content hash)
 * is merged into the newest row and soft-deleted via {@link #deletedAt}.
 */
@Entity
@Table(name = "evidence", indexes = {
        @Index(name = "idx_evidence_url_hash", columnList = "url, content_hash")
})
public class Evidence extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    public UUID id;

    @Column(nullable = false, length = 2048)
    public String url;

    @Enumerated(EnumType.STRING)
    @Column(name = "content_class", nullable = false, length = 32)
    public ContentClass contentClass;

    @Column(name = "raw_content", nullable = false, columnDefinition = "text")
    public String rawContent;

    /**
     * Lower-case SHA-256 hex of the UTF-8 bytes of {@link #rawContent}.
     */
    @Column(name = "content_hash", nullable = false, length = 64)
    public String contentHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "authority_level", nullable = false, length = 32)
    public AuthorityLevel authorityLevel;

    @Enumerated(EnumType.STRING)
    @Column(name = "staleness_status", nullable = false, length = 32)
    public StalenessStatus stalenessStatus = StalenessStatus.FRESH;

    @Enumerated(EnumType.STRING)
    @Column(name = "ocr_status", nullable = false, length = 32)
    public OcrStatus ocrStatus = OcrStatus.NOT_REQUIRED;

    @Column(name = "fetched_at", nullable = false)
    public Instant fetchedAt;

    @Column(name = "deleted_at")
    public Instant deletedAt;

    /**
     * Survivor this row was merged into by deduplication.
     */
    @Column(name = "merged_into_id")
    public UUID mergedIntoId;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public static Optional<Evidence> findLive(UUID id) {
        return find("id = ?1 and deletedAt is null", id).firstResultOptional();
    }

    public static Optional<Evidence> findLiveByUrlAndHash(String url, String contentHash) {
        return find("url = ?1 and contentHash = ?2 and deletedAt is null order by fetchedAt desc",
                url, contentHash).firstResultOptional();
    }

    public static List<Evidence> listLiveByUrl(String url) {
        return list("url = ?1 and deletedAt is null order by fetchedAt desc", url);
    }
}
