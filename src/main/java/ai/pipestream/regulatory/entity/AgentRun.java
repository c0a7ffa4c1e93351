package ai.pipestream.regulatory.entity;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * One call of the extractor against one evidence version.
 */
@Entity
@Table(name = "agent_runs", indexes = {
        @Index(name = "idx_agent_runs_evidence_hash", columnList = "evidence_id, evidence_content_hash")
})
public class AgentRun extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    public UUID id;

    @Column(name = "evidence_id", nullable = false)
    public UUID evidenceId;

    @Column(name = "evidence_content_hash", nullable = false, length = 64)
    public String evidenceContentHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    public AgentRunStatus status;

    @Column(name = "candidate_count", nullable = false)
    public int candidateCount;

    /**
     * JSON array of extractor warnings.
     */
    @Column(columnDefinition = "text")
    public String warnings;

    @Column(name = "error_message", length = 2048)
    public String errorMessage;

    @Column(name = "started_at", nullable = false)
    public Instant startedAt;

    @Column(name = "completed_at")
    public Instant completedAt;

    public static Optional<AgentRun> findCompleted(UUID evidenceId, String contentHash) {
        return find("evidenceId = ?1 and evidenceContentHash = ?2 and status = ?3",
                evidenceId, contentHash, AgentRunStatus.COMPLETED).firstResultOptional();
    }

    public static List<AgentRun> listStuck(Instant startedBefore) {
        return list("status = ?1 and startedAt < ?2", AgentRunStatus.RUNNING, startedBefore);
    }
}
