package com.chambua.standings.dto;

import com.chambua.standings.model.TableSnapshot;

import java.time.Instant;

public class SnapshotSummaryDTO {
    private Long id;
    private Long leagueId;
    private Long seasonId;
    private String description;
    private String createdBy;
    private int entryCount;
    private String checksum;
    private Instant createdAt;

    public SnapshotSummaryDTO() {}

    public static SnapshotSummaryDTO from(TableSnapshot s) {
        SnapshotSummaryDTO d = new SnapshotSummaryDTO();
        d.id = s.getId();
        d.leagueId = s.getLeagueId();
        d.seasonId = s.getSeasonId();
        d.description = s.getDescription();
        d.createdBy = s.getCreatedBy();
        d.entryCount = s.getEntryCount();
        d.checksum = s.getChecksum();
        d.createdAt = s.getCreatedAt();
        return d;
    }

    public Long getId() { return id; }
    public Long getLeagueId() { return leagueId; }
    public Long getSeasonId() { return seasonId; }
    public String getDescription() { return description; }
    public String getCreatedBy() { return createdBy; }
    public int getEntryCount() { return entryCount; }
    public String getChecksum() { return checksum; }
    public Instant getCreatedAt() { return createdAt; }
}
