package com.chambua.standings.repository;

import com.chambua.standings.model.Match;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface MatchRepository extends JpaRepository<Match, Long> {

    // Finished matches of one season, teams eager-loaded so the store can map them outside a session
    @Query("select m from Match m join fetch m.homeTeam join fetch m.awayTeam " +
           "where m.league.id = :leagueId and m.season.id = :seasonId " +
           "and m.status = com.chambua.standings.model.MatchStatus.FINISHED " +
           "order by m.matchday asc, m.id asc")
    List<Match> findFinishedWithTeams(@Param("leagueId") Long leagueId, @Param("seasonId") Long seasonId);
}
