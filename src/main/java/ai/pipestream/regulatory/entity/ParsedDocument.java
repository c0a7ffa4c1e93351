package ai.pipestream.regulatory.entity;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * One structural parse of an evidence artifact, versioned by parser identity.
 * <p>
 * At most one row per evidence has {@code latest = true}; older parses point
 * at their successor through {@link #supersededById}.
 */
@Entity
@Table(name = "parsed_documents", indexes = {
        @Index(name = "idx_parsed_documents_evidence", columnList = "evidence_id, is_latest")
})
public class ParsedDocument extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    public UUID id;

    @Column(name = "evidence_id", nullable = false)
    public UUID evidenceId;

    @Column(name = "artifact_id")
    public UUID artifactId;

    @Column(name = "parser_id", nullable = false, length = 64)
    public String parserId;

    @Column(name = "parser_version", nullable = false, length = 32)
    public String parserVersion;

    @Column(name = "parse_config_hash", nullable = false, length = 64)
    public String parseConfigHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    public ParseStatus status;

    @Column(name = "clean_text", nullable = false, columnDefinition = "text")
    public String cleanText;

    @Column(name = "clean_text_hash", nullable = false, length = 64)
    public String cleanTextHash;

    @Column(name = "coverage_percent", nullable = false)
    public double coveragePercent;

    @Column(name = "node_count", nullable = false)
    public int nodeCount;

    /**
     * JSON object of node type to count.
     */
    @Column(name = "node_type_counts", columnDefinition = "text")
    public String nodeTypeCounts;

    /**
     * JSON array of parser warnings.
     */
    @Column(columnDefinition = "text")
    public String warnings;

    @Column(name = "is_latest", nullable = false)
    public boolean latest;

    @Column(name = "superseded_by_id")
    public UUID supersededById;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public static Optional<ParsedDocument> findLatest(UUID evidenceId) {
        return find("evidenceId = ?1 and latest = true", evidenceId).firstResultOptional();
    }

    public static long countLatest(UUID evidenceId) {
        return count("evidenceId = ?1 and latest = true", evidenceId);
    }
}
