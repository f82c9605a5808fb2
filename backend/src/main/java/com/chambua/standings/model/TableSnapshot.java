package com.chambua.standings.model;

import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Frozen copy of a league table taken before it is overwritten. Rows are written once and never updated;
 * only the retention jobs in {@code SnapshotService} delete them.
 */
@Entity
@Immutable
@Table(name = "table_snapshots", indexes = {
        @Index(name = "idx_snapshots_league_season_created", columnList = "league_id, season_id, created_at")
})
public class TableSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "league_id", nullable = false, updatable = false)
    private Long leagueId;

    @Column(name = "season_id", nullable = false, updatable = false)
    private Long seasonId;

    @Column(nullable = false, updatable = false)
    private String description;

    @Column(name = "created_by", length = 64, updatable = false)
    private String createdBy;

    @Column(name = "entries_json", columnDefinition = "text", nullable = false, updatable = false)
    private String entriesJson;

    @Column(name = "entry_count", nullable = false, updatable = false)
    private int entryCount;

    // SHA-256 of entriesJson, hex encoded
    @Column(nullable = false, length = 64, updatable = false)
    private String checksum;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected TableSnapshot() {}   // required by JPA

    public TableSnapshot(Long leagueId, Long seasonId, String description, String createdBy,
                         String entriesJson, int entryCount, String checksum, Instant createdAt) {
        this.leagueId = leagueId;
        this.seasonId = seasonId;
        this.description = description;
        this.createdBy = createdBy;
        this.entriesJson = entriesJson;
        this.entryCount = entryCount;
        this.checksum = checksum;
        this.createdAt = createdAt;
    }

    public Long getId() { return id; }
    public Long getLeagueId() { return leagueId; }
    public Long getSeasonId() { return seasonId; }
    public String getDescription() { return description; }
    public String getCreatedBy() { return createdBy; }
    public String getEntriesJson() { return entriesJson; }
    public int getEntryCount() { return entryCount; }
    public String getChecksum() { return checksum; }
    public Instant getCreatedAt() { return createdAt; }
}
