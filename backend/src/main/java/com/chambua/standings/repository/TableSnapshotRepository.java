package com.chambua.standings.repository;

import com.chambua.standings.model.TableSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface TableSnapshotRepository extends JpaRepository<TableSnapshot, Long> {

    @Query("select s from TableSnapshot s " +
           "where (:leagueId is null or s.leagueId = :leagueId) " +
           "and (:seasonId is null or s.seasonId = :seasonId) " +
           "order by s.createdAt desc, s.id desc")
    List<TableSnapshot> findFiltered(@Param("leagueId") Long leagueId, @Param("seasonId") Long seasonId);

    List<TableSnapshot> findByLeagueIdAndSeasonIdOrderByCreatedAtDescIdDesc(Long leagueId, Long seasonId);

    List<TableSnapshot> findByCreatedAtBefore(Instant cutoff);
}
