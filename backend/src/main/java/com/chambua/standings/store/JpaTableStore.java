package com.chambua.standings.store;

import com.chambua.standings.dto.LeagueTable;
import com.chambua.standings.dto.LeagueTableEntryDTO;
import com.chambua.standings.exception.StaleClaimException;
import com.chambua.standings.exception.TransientStoreException;
import com.chambua.standings.model.TableEntry;
import com.chambua.standings.repository.TableEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

@Component
public class JpaTableStore implements TableStore {
    private static final Logger log = LoggerFactory.getLogger(JpaTableStore.class);

    // Bounded by the job timeout so a hung statement is cancelled before the reaper hands the job to another worker
    static final String TX_TIMEOUT_SECONDS = "#{${standings.queue.job-timeout-ms:30000} / 1000}";

    private final TableEntryRepository tableEntryRepository;
    private final Clock clock;

    public JpaTableStore(TableEntryRepository tableEntryRepository, Clock clock) {
        this.tableEntryRepository = tableEntryRepository;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true, timeoutString = TX_TIMEOUT_SECONDS)
    public LeagueTable getCurrentTable(Long leagueId, Long seasonId) {
        try {
            List<LeagueTableEntryDTO> entries = tableEntryRepository.findByLeagueIdAndSeasonIdOrderByPositionAsc(leagueId, seasonId)
                    .stream()
                    .map(JpaTableStore::toDto)
                    .collect(Collectors.toList());
            return new LeagueTable(leagueId, seasonId, entries);
        } catch (DataAccessException e) {
            throw new TransientStoreException("Failed to read table for league " + leagueId + " season " + seasonId, e);
        }
    }

    @Override
    @Transactional(timeoutString = TX_TIMEOUT_SECONDS)
    public int replaceTable(Long leagueId, Long seasonId, LeagueTable table, String source) {
        return replaceTable(leagueId, seasonId, table, source, () -> true);
    }

    @Override
    @Transactional(timeoutString = TX_TIMEOUT_SECONDS)
    public int replaceTable(Long leagueId, Long seasonId, LeagueTable table, String source, BooleanSupplier stillCurrent) {
        checkFence(leagueId, seasonId, stillCurrent);
        Instant now = clock.instant();
        List<TableEntry> rows = new ArrayList<>(table.size());
        for (LeagueTableEntryDTO e : table.getEntries()) {
            rows.add(toEntity(leagueId, seasonId, e, now, source));
        }
        int removed;
        try {
            removed = tableEntryRepository.deleteTable(leagueId, seasonId);
            tableEntryRepository.saveAll(rows);
            tableEntryRepository.flush();
        } catch (DataAccessException e) {
            throw new TransientStoreException("Failed to replace table for league " + leagueId + " season " + seasonId, e);
        }
        // the throw marks the surrounding transaction rollback-only
        checkFence(leagueId, seasonId, stillCurrent);
        log.info("[TableStore][Replace] leagueId={} seasonId={} removed={} written={} source={}",
                leagueId, seasonId, removed, rows.size(), source);
        return rows.size();
    }

    private static void checkFence(Long leagueId, Long seasonId, BooleanSupplier stillCurrent) {
        if (!stillCurrent.getAsBoolean()) {
            log.warn("[TableStore][Fenced] leagueId={} seasonId={} claim no longer current, write abandoned", leagueId, seasonId);
            throw new StaleClaimException(leagueId, seasonId);
        }
    }

    static LeagueTableEntryDTO toDto(TableEntry e) {
        return new LeagueTableEntryDTO(e.getPosition(), e.getTeamId(), e.getTeamName(), e.getPlayed(), e.getWon(),
                e.getDrawn(), e.getLost(), e.getGoalsFor(), e.getGoalsAgainst(), e.getGoalDifference(), e.getPoints());
    }

    private static TableEntry toEntity(Long leagueId, Long seasonId, LeagueTableEntryDTO d, Instant calculatedAt, String source) {
        TableEntry e = new TableEntry();
        e.setLeagueId(leagueId);
        e.setSeasonId(seasonId);
        e.setTeamId(d.getTeamId());
        e.setTeamName(d.getTeamName() != null ? d.getTeamName() : String.valueOf(d.getTeamId()));
        e.setPosition(d.getPosition());
        e.setPlayed(d.getPlayed());
        e.setWon(d.getWon());
        e.setDrawn(d.getDrawn());
        e.setLost(d.getLost());
        e.setGoalsFor(d.getGoalsFor());
        e.setGoalsAgainst(d.getGoalsAgainst());
        e.setGoalDifference(d.getGoalDifference());
        e.setPoints(d.getPoints());
        e.setCalculatedAt(calculatedAt);
        e.setSource(source);
        return e;
    }
}
