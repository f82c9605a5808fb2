package com.chambua.standings.store;

import com.chambua.standings.standings.MatchResult;
import com.chambua.standings.standings.TeamRef;

import java.util.List;

/**
 * Read access to match data owned by the content backend.
 */
public interface MatchStore {

    /** Finished matches of one league season. */
    List<MatchResult> listFinishedMatches(Long leagueId, Long seasonId);

    /** Every team that belongs in the season's table, including teams that have not played yet. */
    List<TeamRef> listTeams(Long leagueId, Long seasonId);
}
