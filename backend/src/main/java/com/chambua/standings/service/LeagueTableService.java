package com.chambua.standings.service;

import com.chambua.standings.dto.LeagueTable;
import com.chambua.standings.model.Season;
import com.chambua.standings.repository.LeagueRepository;
import com.chambua.standings.repository.SeasonRepository;
import com.chambua.standings.standings.StandingsCalculator;
import com.chambua.standings.store.MatchStore;
import com.chambua.standings.store.TableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
@Transactional(readOnly = true)
public class LeagueTableService {

    private static final Logger log = LoggerFactory.getLogger(LeagueTableService.class);

    private final TableStore tableStore;
    private final MatchStore matchStore;
    private final StandingsCalculator calculator;
    private final LeagueRepository leagueRepository;
    private final SeasonRepository seasonRepository;

    public LeagueTableService(TableStore tableStore, MatchStore matchStore, StandingsCalculator calculator,
                              LeagueRepository leagueRepository, SeasonRepository seasonRepository) {
        this.tableStore = tableStore;
        this.matchStore = matchStore;
        this.calculator = calculator;
        this.leagueRepository = leagueRepository;
        this.seasonRepository = seasonRepository;
    }

    /**
     * The published table, empty when nothing has been published for the season.
     */
    public Optional<LeagueTable> getPublishedTable(Long leagueId, Long seasonId) {
        requireSeason(leagueId, seasonId);
        LeagueTable table = tableStore.getCurrentTable(leagueId, seasonId);
        return table.isEmpty() ? Optional.empty() : Optional.of(table);
    }

    // Computed from current match data; nothing is written
    public LeagueTable previewTable(Long leagueId, Long seasonId) {
        requireSeason(leagueId, seasonId);
        LeagueTable table = calculator.compute(leagueId, seasonId,
                matchStore.listFinishedMatches(leagueId, seasonId), matchStore.listTeams(leagueId, seasonId));
        log.debug("[LeagueTable][Preview] leagueId={} seasonId={} entries={}", leagueId, seasonId, table.size());
        return table;
    }

    public List<Season> listSeasons(Long leagueId) {
        if (leagueId == null) throw new IllegalArgumentException("leagueId is required");
        return seasonRepository.findByLeague_IdOrderByStartDateDesc(leagueId);
    }

    public boolean leagueExists(Long leagueId) {
        return leagueId != null && leagueRepository.existsById(leagueId);
    }

    private void requireSeason(Long leagueId, Long seasonId) {
        if (leagueId == null) throw new IllegalArgumentException("leagueId is required");
        if (seasonId == null) throw new IllegalArgumentException("seasonId is required");
        if (!seasonRepository.existsByIdAndLeague_Id(seasonId, leagueId)) {
            throw new IllegalArgumentException("Season " + seasonId + " does not belong to league " + leagueId);
        }
    }
}
