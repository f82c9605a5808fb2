package com.chambua.standings.model;

import jakarta.persistence.*;

@Entity
@Table(name = "leagues", uniqueConstraints = {
        @UniqueConstraint(name = "uk_league_name_country", columnNames = {"name", "country"})
})
public class League {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String country;

    public League() {}

    public League(String name, String country) {
        this.name = name;
        this.country = country;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getCountry() { return country; }
    public void setCountry(String country) { this.country = country; }
}
