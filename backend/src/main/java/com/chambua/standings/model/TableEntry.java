package com.chambua.standings.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Persisted row of a published league table. Rows for one (league, season) are only ever written
 * together, by {@code JpaTableStore.replaceTable}.
 */
@Entity
@Table(name = "league_table_entries", indexes = {
        @Index(name = "idx_table_entries_league_season", columnList = "league_id, season_id")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_table_entry_league_season_team", columnNames = {"league_id", "season_id", "team_id"}),
        @UniqueConstraint(name = "uk_table_entry_league_season_position", columnNames = {"league_id", "season_id", "position"})
})
public class TableEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "league_id", nullable = false)
    private Long leagueId;

    @Column(name = "season_id", nullable = false)
    private Long seasonId;

    @Column(name = "team_id", nullable = false)
    private Long teamId;

    @Column(name = "team_name", nullable = false)
    private String teamName;

    @Column(nullable = false)
    private int position;

    @Column(nullable = false)
    private int played;

    @Column(nullable = false)
    private int won;

    @Column(nullable = false)
    private int drawn;

    @Column(nullable = false)
    private int lost;

    @Column(name = "goals_for", nullable = false)
    private int goalsFor;

    @Column(name = "goals_against", nullable = false)
    private int goalsAgainst;

    @Column(name = "goal_difference", nullable = false)
    private int goalDifference;

    @Column(nullable = false)
    private int points;

    @Column(name = "calculated_at", nullable = false)
    private Instant calculatedAt;

    // "automatic" for queue recalculations, "snapshot_restore_<id>" after a rollback
    @Column(name = "source", length = 64)
    private String source;

    public TableEntry() {}

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Long getLeagueId() { return leagueId; }
    public void setLeagueId(Long leagueId) { this.leagueId = leagueId; }

    public Long getSeasonId() { return seasonId; }
    public void setSeasonId(Long seasonId) { this.seasonId = seasonId; }

    public Long getTeamId() { return teamId; }
    public void setTeamId(Long teamId) { this.teamId = teamId; }

    public String getTeamName() { return teamName; }
    public void setTeamName(String teamName) { this.teamName = teamName; }

    public int getPosition() { return position; }
    public void setPosition(int position) { this.position = position; }

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

    public Instant getCalculatedAt() { return calculatedAt; }
    public void setCalculatedAt(Instant calculatedAt) { this.calculatedAt = calculatedAt; }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
}
