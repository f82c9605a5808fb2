package com.chambua.standings.repository;

import com.chambua.standings.model.Season;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SeasonRepository extends JpaRepository<Season, Long> {
    // Guards recalculation requests against a season id that belongs to another league
    boolean existsByIdAndLeague_Id(Long id, Long leagueId);

    List<Season> findByLeague_IdOrderByStartDateDesc(Long leagueId);
}
