package com.chambua.standings.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered standings of one league season. Entries are kept in position order.
 */
public class LeagueTable {
    private final Long leagueId;
    private final Long seasonId;
    private final List<LeagueTableEntryDTO> entries;

    public LeagueTable(Long leagueId, Long seasonId, List<LeagueTableEntryDTO> entries) {
        this.leagueId = leagueId;
        this.seasonId = seasonId;
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public static LeagueTable empty(Long leagueId, Long seasonId) {
        return new LeagueTable(leagueId, seasonId, List.of());
    }

    public Long getLeagueId() { return leagueId; }
    public Long getSeasonId() { return seasonId; }
    public List<LeagueTableEntryDTO> getEntries() { return entries; }

    public int size() { return entries.size(); }
    public boolean isEmpty() { return entries.isEmpty(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LeagueTable)) return false;
        LeagueTable that = (LeagueTable) o;
        return Objects.equals(leagueId, that.leagueId) && Objects.equals(seasonId, that.seasonId)
                && entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(leagueId, seasonId, entries);
    }

    @Override
    public String toString() {
        return "LeagueTable{league=" + leagueId + ", season=" + seasonId + ", entries=" + entries + "}";
    }
}
