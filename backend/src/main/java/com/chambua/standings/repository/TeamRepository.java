package com.chambua.standings.repository;

import com.chambua.standings.model.Team;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface TeamRepository extends JpaRepository<Team, Long> {
    List<Team> findByLeague_IdOrderByIdAsc(Long leagueId);

    // Teams that appear in any match of the season, including ones registered under another league id
    @Query("select distinct t from Match m join m.homeTeam t where m.league.id = :leagueId and m.season.id = :seasonId")
    List<Team> findHomeTeamsInSeason(@Param("leagueId") Long leagueId, @Param("seasonId") Long seasonId);

    @Query("select distinct t from Match m join m.awayTeam t where m.league.id = :leagueId and m.season.id = :seasonId")
    List<Team> findAwayTeamsInSeason(@Param("leagueId") Long leagueId, @Param("seasonId") Long seasonId);
}
