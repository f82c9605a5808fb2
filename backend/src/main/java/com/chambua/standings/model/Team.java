package com.chambua.standings.model;

import jakarta.persistence.*;

/**
 * A participant registered in a league. Whether it represents a club or one of its squads is decided
 * by the content backend; standings only need the identifier and a display name.
 */
@Entity
@Table(name = "teams", indexes = {
        @Index(name = "idx_team_league_name", columnList = "league_id, name")
})
public class Team {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "league_id", nullable = false, foreignKey = @ForeignKey(name = "fk_team_league"))
    private League league;

    public Team() {}

    public Team(String name, League league) {
        this.name = name;
        this.league = league;
    }

    @PrePersist
    @PreUpdate
    private void prePersistUpdate() {
        if (this.name != null) {
            this.name = this.name.trim();
        }
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public League getLeague() { return league; }
    public void setLeague(League league) { this.league = league; }
}
