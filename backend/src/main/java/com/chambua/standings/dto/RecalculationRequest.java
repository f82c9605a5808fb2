package com.chambua.standings.dto;

public class RecalculationRequest {
    private Long leagueId;
    private Long seasonId;
    private String priority;
    private String description;

    public RecalculationRequest() {}

    public RecalculationRequest(Long leagueId, Long seasonId, String priority, String description) {
        this.leagueId = leagueId;
        this.seasonId = seasonId;
        this.priority = priority;
        this.description = description;
    }

    public Long getLeagueId() { return leagueId; }
    public void setLeagueId(Long leagueId) { this.leagueId = leagueId; }
    public Long getSeasonId() { return seasonId; }
    public void setSeasonId(Long seasonId) { this.seasonId = seasonId; }
    public String getPriority() { return priority; }
    public void setPriority(String priority) { this.priority = priority; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
}
