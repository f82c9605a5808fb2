package com.chambua.standings.store;

import com.chambua.standings.exception.TransientStoreException;
import com.chambua.standings.model.Match;
import com.chambua.standings.model.Team;
import com.chambua.standings.repository.MatchRepository;
import com.chambua.standings.repository.TeamRepository;
import com.chambua.standings.standings.MatchResult;
import com.chambua.standings.standings.TeamRef;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
public class JpaMatchStore implements MatchStore {

    private final MatchRepository matchRepository;
    private final TeamRepository teamRepository;

    public JpaMatchStore(MatchRepository matchRepository, TeamRepository teamRepository) {
        this.matchRepository = matchRepository;
        this.teamRepository = teamRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public List<MatchResult> listFinishedMatches(Long leagueId, Long seasonId) {
        try {
            return matchRepository.findFinishedWithTeams(leagueId, seasonId).stream()
                    .map(JpaMatchStore::toResult)
                    .collect(Collectors.toList());
        } catch (DataAccessException e) {
            throw new TransientStoreException("Failed to load matches for league " + leagueId + " season " + seasonId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<TeamRef> listTeams(Long leagueId, Long seasonId) {
        try {
            Map<Long, TeamRef> teams = new LinkedHashMap<>();
            add(teams, teamRepository.findByLeague_IdOrderByIdAsc(leagueId));
            add(teams, teamRepository.findHomeTeamsInSeason(leagueId, seasonId));
            add(teams, teamRepository.findAwayTeamsInSeason(leagueId, seasonId));
            return new ArrayList<>(teams.values());
        } catch (DataAccessException e) {
            throw new TransientStoreException("Failed to load teams for league " + leagueId + " season " + seasonId, e);
        }
    }

    private static void add(Map<Long, TeamRef> into, List<Team> teams) {
        for (Team t : teams) {
            into.putIfAbsent(t.getId(), new TeamRef(t.getId(), t.getName()));
        }
    }

    private static MatchResult toResult(Match m) {
        return new MatchResult(m.getId(), m.getLeague().getId(), m.getSeason().getId(), m.getHomeTeam().getId(),
                m.getAwayTeam().getId(), m.getHomeGoals(), m.getAwayGoals(), m.getStatus(), m.getMatchday());
    }
}
