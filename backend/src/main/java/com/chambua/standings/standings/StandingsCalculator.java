package com.chambua.standings.standings;

import com.chambua.standings.dto.LeagueTable;
import com.chambua.standings.dto.LeagueTableEntryDTO;
import com.chambua.standings.exception.InvalidMatchDataException;
import com.chambua.standings.model.MatchStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns finished matches into a ranked table. Pure: no I/O, no shared state, same input gives an equal table.
 *
 * <p>Ranking is a total order: points desc, goal difference desc, goals for desc, team name asc, team id asc.
 * Teams tied on every sporting criterion still get distinct, adjacent positions.
 */
@Component
public class StandingsCalculator {

    public static final int POINTS_FOR_WIN = 3;
    public static final int POINTS_FOR_DRAW = 1;

    static final Comparator<Tally> RANKING = Comparator
            .comparingInt(Tally::points).reversed()
            .thenComparing(Comparator.comparingInt(Tally::goalDifference).reversed())
            .thenComparing(Comparator.comparingInt((Tally t) -> t.goalsFor).reversed())
            .thenComparing(t -> t.team.sortName())
            .thenComparing(t -> t.team.id());

    public LeagueTable compute(Long leagueId, Long seasonId, Collection<MatchResult> matches, Collection<TeamRef> teams) {
        Objects.requireNonNull(matches, "matches");
        Objects.requireNonNull(teams, "teams");

        Map<Long, Tally> tallies = new LinkedHashMap<>();
        for (TeamRef team : teams) {
            if (team == null || team.id() == null) {
                throw new InvalidMatchDataException("Team list contains an entry without id");
            }
            if (tallies.putIfAbsent(team.id(), new Tally(team)) != null) {
                throw new InvalidMatchDataException("Team " + team.id() + " is listed twice");
            }
        }

        for (MatchResult match : matches) {
            validate(match, leagueId, seasonId, tallies);
            int home = match.homeGoals();
            int away = match.awayGoals();
            tallies.get(match.homeTeamId()).record(home, away);
            tallies.get(match.awayTeamId()).record(away, home);
        }

        List<Tally> ordered = new ArrayList<>(tallies.values());
        ordered.sort(RANKING);

        List<LeagueTableEntryDTO> entries = new ArrayList<>(ordered.size());
        int position = 1;
        for (Tally t : ordered) {
            entries.add(new LeagueTableEntryDTO(position++, t.team.id(), t.team.name(), t.played(), t.won, t.drawn,
                    t.lost, t.goalsFor, t.goalsAgainst, t.goalDifference(), t.points()));
        }
        return new LeagueTable(leagueId, seasonId, entries);
    }

    private static void validate(MatchResult match, Long leagueId, Long seasonId, Map<Long, Tally> tallies) {
        if (match == null) {
            throw new InvalidMatchDataException("Match list contains a null entry");
        }
        String label = "Match " + match.matchId();
        if (match.status() != MatchStatus.FINISHED) {
            throw new InvalidMatchDataException(label + " has status " + match.status() + ", only FINISHED matches count");
        }
        if (leagueId != null && !leagueId.equals(match.leagueId())) {
            throw new InvalidMatchDataException(label + " belongs to league " + match.leagueId() + ", not " + leagueId);
        }
        if (seasonId != null && !seasonId.equals(match.seasonId())) {
            throw new InvalidMatchDataException(label + " belongs to season " + match.seasonId() + ", not " + seasonId);
        }
        if (match.homeGoals() == null || match.awayGoals() == null) {
            throw new InvalidMatchDataException(label + " is finished but has no score");
        }
        if (match.homeGoals() < 0 || match.awayGoals() < 0) {
            throw new InvalidMatchDataException(label + " has a negative score");
        }
        if (!tallies.containsKey(match.homeTeamId())) {
            throw new InvalidMatchDataException(label + " references unknown home team " + match.homeTeamId());
        }
        if (!tallies.containsKey(match.awayTeamId())) {
            throw new InvalidMatchDataException(label + " references unknown away team " + match.awayTeamId());
        }
        if (match.homeTeamId().equals(match.awayTeamId())) {
            throw new InvalidMatchDataException(label + " has team " + match.homeTeamId() + " on both sides");
        }
    }

    static final class Tally {
        final TeamRef team;
        int won;
        int drawn;
        int lost;
        int goalsFor;
        int goalsAgainst;

        Tally(TeamRef team) {
            this.team = team;
        }

        void record(int scored, int conceded) {
            goalsFor += scored;
            goalsAgainst += conceded;
            if (scored > conceded) won++;
            else if (scored == conceded) drawn++;
            else lost++;
        }

        int played() { return won + drawn + lost; }
        int goalDifference() { return goalsFor - goalsAgainst; }
        int points() { return won * POINTS_FOR_WIN + drawn * POINTS_FOR_DRAW; }
    }
}
