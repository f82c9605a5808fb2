package com.chambua.standings.dto;

import java.util.Objects;

public class LeagueTableEntryDTO {
    private int position;
    private Long teamId;
    private String teamName;
    private int played;
    private int won;
    private int drawn;
    private int lost;
    private int goalsFor;
    private int goalsAgainst;
    private int goalDifference;
    private int points;

    public LeagueTableEntryDTO() {}

    public LeagueTableEntryDTO(int position, Long teamId, String teamName, int played, int won, int drawn, int lost,
                               int goalsFor, int goalsAgainst, int goalDifference, int points) {
        this.position = position;
        this.teamId = teamId;
        this.teamName = teamName;
        this.played = played;
        this.won = won;
        this.drawn = drawn;
        this.lost = lost;
        this.goalsFor = goalsFor;
        this.goalsAgainst = goalsAgainst;
        this.goalDifference = goalDifference;
        this.points = points;
    }

    public int getPosition() { return position; }
    public void setPosition(int position) { this.position = position; }

    public Long getTeamId() { return teamId; }
    public void setTeamId(Long teamId) { this.teamId = teamId; }

    public String getTeamName() { return teamName; }
    public void setTeamName(String teamName) { this.teamName = teamName; }

    public int getPlayed() { return played; }
    public void setPlayed(int played) { this.played = played; }

    public int getWon() { return won; }
    public void setWon(int won) { this.won = won; }

    public int getDrawn() { return drawn; }
    public void setDrawn(int drawn) { this.drawn = drawn; }

    public int getLost() { return lost; }
    public void setLost(int lost) { this.lost = lost; }

    public int getGoalsFor() { return goalsFor; }
    public void setGoalsFor(int goalsFor) { this.goalsFor = goalsFor; }

    public int getGoalsAgainst() { return goalsAgainst; }
    public void setGoalsAgainst(int goalsAgainst) { this.goalsAgainst = goalsAgainst; }

    public int getGoalDifference() { return goalDifference; }
    public void setGoalDifference(int goalDifference) { this.goalDifference = goalDifference; }

    public int getPoints() { return points; }
    public void setPoints(int points) { this.points = points; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LeagueTableEntryDTO)) return false;
        LeagueTableEntryDTO that = (LeagueTableEntryDTO) o;
        return position == that.position && played == that.played && won == that.won && drawn == that.drawn
                && lost == that.lost && goalsFor == that.goalsFor && goalsAgainst == that.goalsAgainst
                && goalDifference == that.goalDifference && points == that.points
                && Objects.equals(teamId, that.teamId) && Objects.equals(teamName, that.teamName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(position, teamId, teamName, played, won, drawn, lost, goalsFor, goalsAgainst, goalDifference, points);
    }

    @Override
    public String toString() {
        return position + ". " + teamName + " (" + teamId + ") P" + played + " W" + won + " D" + drawn + " L" + lost
                + " " + goalsFor + ":" + goalsAgainst + " GD" + goalDifference + " Pts" + points;
    }
}
