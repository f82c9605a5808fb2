package com.chambua.standings.repository;

import com.chambua.standings.model.TableEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface TableEntryRepository extends JpaRepository<TableEntry, Long> {

    List<TableEntry> findByLeagueIdAndSeasonIdOrderByPositionAsc(Long leagueId, Long seasonId);

    // Bulk delete runs immediately, so the following inserts cannot collide with the unique keys
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from TableEntry e where e.leagueId = :leagueId and e.seasonId = :seasonId")
    int deleteTable(@Param("leagueId") Long leagueId, @Param("seasonId") Long seasonId);
}
