package com.chambua.standings.dto;

public class SnapshotRequest {
    private Long leagueId;
    private Long seasonId;
    private String description;

    public SnapshotRequest() {}

    public SnapshotRequest(Long leagueId, Long seasonId, String description) {
        this.leagueId = leagueId;
        this.seasonId = seasonId;
        this.description = description;
    }

    public Long getLeagueId() { return leagueId; }
    public void setLeagueId(Long leagueId) { this.leagueId = leagueId; }
    public Long getSeasonId() { return seasonId; }
    public void setSeasonId(Long seasonId) { this.seasonId = seasonId; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
}
