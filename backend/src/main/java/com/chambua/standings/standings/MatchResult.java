package com.chambua.standings.standings;

import com.chambua.standings.model.MatchStatus;

/**
 * Read-only view of a match as the calculator sees it. Goals are boxed because unfinished matches have none.
 */
public record MatchResult(
        Long matchId,
        Long leagueId,
        Long seasonId,
        Long homeTeamId,
        Long awayTeamId,
        Integer homeGoals,
        Integer awayGoals,
        MatchStatus status,
        Integer matchday
) {

    public static MatchResult finished(Long matchId, Long leagueId, Long seasonId, Long homeTeamId, Long awayTeamId,
                                       int homeGoals, int awayGoals, int matchday) {
        return new MatchResult(matchId, leagueId, seasonId, homeTeamId, awayTeamId, homeGoals, awayGoals,
                MatchStatus.FINISHED, matchday);
    }
}
