package com.chambua.standings.standings;

import com.chambua.standings.dto.LeagueTable;
import com.chambua.standings.dto.LeagueTableEntryDTO;
import com.chambua.standings.exception.CalculationInvariantViolationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a table before it may be published.
 */
public final class TableInvariants {

    private TableInvariants() {}

    public static void verify(LeagueTable table) {
        List<String> violations = findViolations(table);
        if (!violations.isEmpty()) {
            throw new CalculationInvariantViolationException(violations);
        }
    }

    public static List<String> findViolations(LeagueTable table) {
        List<String> violations = new ArrayList<>();
        List<LeagueTableEntryDTO> entries = table.getEntries();
        long goalsFor = 0;
        long goalsAgainst = 0;
        Set<Long> teams = new HashSet<>();

        for (int i = 0; i < entries.size(); i++) {
            LeagueTableEntryDTO e = entries.get(i);
            String team = "team " + e.getTeamId();
            if (!teams.add(e.getTeamId())) {
                violations.add(team + " appears more than once");
            }
            if (e.getPosition() != i + 1) {
                violations.add(team + " has position " + e.getPosition() + ", expected " + (i + 1));
            }
            if (e.getPoints() != e.getWon() * StandingsCalculator.POINTS_FOR_WIN + e.getDrawn() * StandingsCalculator.POINTS_FOR_DRAW) {
                violations.add(team + " points " + e.getPoints() + " do not match results");
            }
            if (e.getPlayed() != e.getWon() + e.getDrawn() + e.getLost()) {
                violations.add(team + " played " + e.getPlayed() + " != won + drawn + lost");
            }
            if (e.getGoalDifference() != e.getGoalsFor() - e.getGoalsAgainst()) {
                violations.add(team + " goal difference " + e.getGoalDifference() + " != goalsFor - goalsAgainst");
            }
            if (e.getPlayed() < 0 || e.getGoalsFor() < 0 || e.getGoalsAgainst() < 0) {
                violations.add(team + " has negative counters");
            }
            if (i > 0 && ranksBefore(e, entries.get(i - 1))) {
                violations.add(team + " at position " + e.getPosition() + " outranks the entry above it");
            }
            goalsFor += e.getGoalsFor();
            goalsAgainst += e.getGoalsAgainst();
        }
        if (goalsFor != goalsAgainst) {
            violations.add("total goals for " + goalsFor + " != total goals against " + goalsAgainst);
        }
        return violations;
    }

    // true when a strictly beats b on the sporting criteria
    private static boolean ranksBefore(LeagueTableEntryDTO a, LeagueTableEntryDTO b) {
        if (a.getPoints() != b.getPoints()) return a.getPoints() > b.getPoints();
        if (a.getGoalDifference() != b.getGoalDifference()) return a.getGoalDifference() > b.getGoalDifference();
        return a.getGoalsFor() > b.getGoalsFor();
    }
}
