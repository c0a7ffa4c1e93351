package ai.pipestream.regulatory.entity;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Durable queue row for a downstream-relevant rule change.
 * <p>
 * {@link #eventId} is derived from (ruleId, type, effectiveFrom), so inserting the
 * same logical change twice hits the primary key. {@link #lockVersion} is a plain
 * counter: every status update is a compare-and-set on it, see
 * {@link #compareAndSet(String, long, String, Object...)}.
 */
@Entity
@Table(name = "content_sync_events", indexes = {
        @Index(name = "idx_content_sync_status_created", columnList = "status, created_at")
})
public class ContentSyncEvent extends PanacheEntityBase {

    @Id
    @Column(name = "event_id", nullable = false, length = 64)
    public String eventId;

    @Column(name = "lock_version", nullable = false)
    public long lockVersion;

    @Column(name = "rule_id", nullable = false)
    public UUID ruleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 32)
    public ContentSyncEventType type;

    @Column(name = "effective_from")
    public LocalDate effectiveFrom;

    @Column(name = "concept_slug", nullable = false, length = 256)
    public String conceptSlug;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    public ContentSyncStatus status = ContentSyncStatus.PENDING;

    @Column(nullable = false)
    public int attempts;

    @Column(name = "next_attempt_at")
    public Instant nextAttemptAt;

    @Column(name = "last_error", length = 2048)
    public String lastError;

    @Enumerated(EnumType.STRING)
    @Column(name = "dead_letter_reason", length = 32)
    public DeadLetterReason deadLetterReason;

    @Column(name = "dead_letter_note", length = 2048)
    public String deadLetterNote;

    @Column(nullable = false, columnDefinition = "text")
    public String payload;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "enqueued_at")
    public Instant enqueuedAt;

    @Column(name = "claimed_at")
    public Instant claimedAt;

    @Column(name = "processed_at")
    public Instant processedAt;

    /**
     * Applies {@code assignments} only if the row still carries {@code expectedVersion},
     * bumping the version in the same statement.
     *
     * @param assignments JPQL set clause, parameters numbered from ?3
     * @return true when the row was updated, false when another writer got there first
     */
    public static boolean compareAndSet(String eventId, long expectedVersion, String assignments, Object... params) {
        Object[] all = new Object[params.length + 2];
        all[0] = eventId;
        all[1] = expectedVersion;
        System.arraycopy(params, 0, all, 2, params.length);
        int updated = update(assignments + ", lockVersion = lockVersion + 1 where eventId = ?1 and lockVersion = ?2", all);
        return updated == 1;
    }

    /**
     * PENDING rows, FAILED rows whose backoff elapsed, and ENQUEUED or PROCESSING
     * rows whose lease ran out before {@code leaseExpiredBefore}.
     */
    public static List<ContentSyncEvent> listDrainable(Instant now, Instant leaseExpiredBefore, int limit) {
        return find("status = ?1 or (status = ?2 and nextAttemptAt <= ?3)"
                        + " or (status = ?4 and enqueuedAt <= ?6) or (status = ?5 and claimedAt <= ?6)"
                        + " order by createdAt",
                ContentSyncStatus.PENDING, ContentSyncStatus.FAILED, now,
                ContentSyncStatus.ENQUEUED, ContentSyncStatus.PROCESSING, leaseExpiredBefore)
                .page(0, limit).list();
    }

    /**
     * PROCESSING rows claimed before {@code leaseExpiredBefore}: their worker is gone.
     */
    public static long countStalled(Instant leaseExpiredBefore) {
        return count("status = ?1 and claimedAt <= ?2", ContentSyncStatus.PROCESSING, leaseExpiredBefore);
    }

    public boolean isClaimable(Instant leaseExpiredBefore) {
        if (ContentSyncStatus.claimable().contains(status)) {
            return true;
        }
        return status == ContentSyncStatus.PROCESSING && claimedAt != null && !claimedAt.isAfter(leaseExpiredBefore);
    }

    public static long countBacklog() {
        return count("status in ?1", List.of(ContentSyncStatus.PENDING, ContentSyncStatus.FAILED));
    }
}
