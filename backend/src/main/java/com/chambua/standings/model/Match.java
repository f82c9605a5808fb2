package com.chambua.standings.model;

import jakarta.persistence.*;
import java.time.LocalDate;

@Entity
@Table(name = "matches", indexes = {
        @Index(name = "idx_matches_league_season_status", columnList = "league_id, season_id, status"),
        @Index(name = "idx_matches_date", columnList = "match_date")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_match_season_matchday_home_away", columnNames = {"season_id", "matchday", "home_team_id", "away_team_id"})
})
public class Match {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "league_id", nullable = false, foreignKey = @ForeignKey(name = "fk_match_league"))
    private League league;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "season_id", nullable = false, foreignKey = @ForeignKey(name = "fk_match_season"))
    private Season season;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "home_team_id", nullable = false, foreignKey = @ForeignKey(name = "fk_match_home_team"))
    private Team homeTeam;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "away_team_id", nullable = false, foreignKey = @ForeignKey(name = "fk_match_away_team"))
    private Team awayTeam;

    @Column(name = "match_date")
    private LocalDate date;

    @Column(nullable = false)
    private Integer matchday;

    @Column(nullable = true)
    private Integer homeGoals;

    @Column(nullable = true)
    private Integer awayGoals;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private MatchStatus status = MatchStatus.SCHEDULED;

    public Match() {}

    public Match(League league, Season season, Team homeTeam, Team awayTeam, Integer matchday, Integer homeGoals, Integer awayGoals) {
        this.league = league;
        this.season = season;
        this.homeTeam = homeTeam;
        this.awayTeam = awayTeam;
        this.matchday = matchday;
        this.homeGoals = homeGoals;
        this.awayGoals = awayGoals;
        // a recorded score means the match is over; anything else waits for an explicit status
        if (homeGoals != null && awayGoals != null) {
            this.status = MatchStatus.FINISHED;
        } else {
            this.status = MatchStatus.SCHEDULED;
        }
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public League getLeague() { return league; }
    public void setLeague(League league) { this.league = league; }

    public Season getSeason() { return season; }
    public void setSeason(Season season) { this.season = season; }

    public Team getHomeTeam() { return homeTeam; }
    public void setHomeTeam(Team homeTeam) { this.homeTeam = homeTeam; }

    public Team getAwayTeam() { return awayTeam; }
    public void setAwayTeam(Team awayTeam) { this.awayTeam = awayTeam; }

    public LocalDate getDate() { return date; }
    public void setDate(LocalDate date) { this.date = date; }

    public Integer getMatchday() { return matchday; }
    public void setMatchday(Integer matchday) { this.matchday = matchday; }

    public Integer getHomeGoals() { return homeGoals; }
    public void setHomeGoals(Integer homeGoals) { this.homeGoals = homeGoals; }

    public Integer getAwayGoals() { return awayGoals; }
    public void setAwayGoals(Integer awayGoals) { this.awayGoals = awayGoals; }

    public MatchStatus getStatus() { return status; }
    public void setStatus(MatchStatus status) { this.status = status; }
}
