package ai.pipestream.regulatory.entity;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable, hash-addressed bundle of published rules.
 */
@Entity
@Table(name = "rule_releases")
public class RuleRelease extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    public UUID id;

    @Column(nullable = false, unique = true, length = 32)
    public String version;

    @Column(name = "version_major", nullable = false)
    public int versionMajor;

    @Column(name = "version_minor", nullable = false)
    public int versionMinor;

    @Column(name = "version_patch", nullable = false)
    public int versionPatch;

    @Enumerated(EnumType.STRING)
    @Column(name = "release_type", nullable = false, length = 8)
    public ReleaseType releaseType;

    @Column(name = "content_hash", nullable = false, length = 64)
    public String contentHash;

    @Column(columnDefinition = "text")
    public String changelog;

    @Column(name = "released_by", length = 256)
    public String releasedBy;

    @Column(name = "released_at", nullable = false)
    public Instant releasedAt;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(name = "release_rules",
            joinColumns = @JoinColumn(name = "release_id"),
            inverseJoinColumns = @JoinColumn(name = "rule_id"))
    public Set<RegulatoryRule> rules = new LinkedHashSet<>();

    public static Optional<RuleRelease> findByVersion(String version) {
        return find("version", version).firstResultOptional();
    }

    public static Optional<RuleRelease> findLatest() {
        return find("order by versionMajor desc, versionMinor desc, versionPatch desc").firstResultOptional();
    }
}
