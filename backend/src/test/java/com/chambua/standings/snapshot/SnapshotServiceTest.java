package com.chambua.standings.snapshot;

import com.chambua.standings.config.StandingsProperties;
import com.chambua.standings.dto.LeagueTable;
import com.chambua.standings.dto.LeagueTableEntryDTO;
import com.chambua.standings.dto.SnapshotDetailDTO;
import com.chambua.standings.dto.SnapshotSummaryDTO;
import com.chambua.standings.exception.SnapshotCorruptedException;
import com.chambua.standings.exception.SnapshotNotFoundException;
import com.chambua.standings.repository.TableEntryRepository;
import com.chambua.standings.repository.TableSnapshotRepository;
import com.chambua.standings.standings.MatchResult;
import com.chambua.standings.standings.StandingsCalculator;
import com.chambua.standings.standings.TeamRef;
import com.chambua.standings.store.JpaTableStore;
import com.chambua.standings.store.TableStore;
import com.chambua.standings.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
class SnapshotServiceTest {

    @Autowired private TableSnapshotRepository snapshotRepository;
    @Autowired private TableEntryRepository tableEntryRepository;
    @Autowired private EntityManager entityManager;

    private MutableClock clock;
    private StandingsProperties properties;
    private JpaTableStore tableStore;
    private SnapshotService snapshotService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-08-01T12:00:00Z");
        properties = new StandingsProperties();
        tableStore = new JpaTableStore(tableEntryRepository, clock);
        snapshotService = new SnapshotService(snapshotRepository, tableStore, new ObjectMapper(), properties, clock);
    }

    private static LeagueTable twoTeamTable(Long league, Long season, String leader, String second) {
        return new LeagueTable(league, season, List.of(
                new LeagueTableEntryDTO(1, leader.equals("Alpha") ? 10L : 20L, leader, 1, 1, 0, 0, 2, 0, 2, 3),
                new LeagueTableEntryDTO(2, second.equals("Alpha") ? 10L : 20L, second, 1, 0, 0, 1, 0, 2, -2, 0)));
    }

    @Test
    void rollbackRestoresTheCapturedTable() {
        LeagueTable original = twoTeamTable(1L, 1L, "Alpha", "Beta");
        tableStore.replaceTable(1L, 1L, original, TableStore.SOURCE_CALCULATION);
        Long snapshotId = snapshotService.snapshot(1L, 1L, "before change", "tester");
        tableStore.replaceTable(1L, 1L, twoTeamTable(1L, 1L, "Beta", "Alpha"), TableStore.SOURCE_CALCULATION);

        int restored = snapshotService.rollback(snapshotId);

        assertThat(restored).isEqualTo(2);
        assertThat(tableStore.getCurrentTable(1L, 1L)).isEqualTo(original);
        assertThat(tableEntryRepository.findByLeagueIdAndSeasonIdOrderByPositionAsc(1L, 1L))
                .allSatisfy(e -> assertThat(e.getSource()).isEqualTo("rollback:" + snapshotId));
    }

    @Test
    void rollbackThenRecomputeFromSameMatchesGivesTheSameTable() {
        StandingsCalculator calculator = new StandingsCalculator();
        List<TeamRef> teams = List.of(new TeamRef(10L, "Alpha"), new TeamRef(20L, "Beta"), new TeamRef(30L, "Gamma"));
        List<MatchResult> matches = List.of(
                MatchResult.finished(1L, 1L, 1L, 10L, 20L, 2, 1, 1),
                MatchResult.finished(2L, 1L, 1L, 20L, 30L, 0, 0, 2));
        LeagueTable computed = calculator.compute(1L, 1L, matches, teams);
        tableStore.replaceTable(1L, 1L, computed, TableStore.SOURCE_CALCULATION);
        Long snapshotId = snapshotService.snapshot(1L, 1L, "good", "tester");
        tableStore.replaceTable(1L, 1L, LeagueTable.empty(1L, 1L), TableStore.SOURCE_CALCULATION);

        snapshotService.rollback(snapshotId);

        assertThat(tableStore.getCurrentTable(1L, 1L)).isEqualTo(calculator.compute(1L, 1L, matches, teams));
    }

    @Test
    void snapshotOfUnpublishedTableIsEmptyAndRestoringItClearsTheTable() {
        Long snapshotId = snapshotService.snapshot(1L, 1L, "empty", "tester");
        tableStore.replaceTable(1L, 1L, twoTeamTable(1L, 1L, "Alpha", "Beta"), TableStore.SOURCE_CALCULATION);

        assertThat(snapshotService.getSnapshot(snapshotId).getEntries()).isEmpty();
        assertThat(snapshotService.rollback(snapshotId)).isZero();
        assertThat(tableStore.getCurrentTable(1L, 1L).isEmpty()).isTrue();
    }

    @Test
    void unknownSnapshotIsReportedAsNotFound() {
        assertThatThrownBy(() -> snapshotService.rollback(404L)).isInstanceOf(SnapshotNotFoundException.class);
        assertThatThrownBy(() -> snapshotService.getSnapshot(404L)).isInstanceOf(SnapshotNotFoundException.class);
    }

    @Test
    void tamperedSnapshotIsRefused() {
        tableStore.replaceTable(1L, 1L, twoTeamTable(1L, 1L, "Alpha", "Beta"), TableStore.SOURCE_CALCULATION);
        Long snapshotId = snapshotService.snapshot(1L, 1L, "original", "tester");
        entityManager.flush();
        entityManager.createNativeQuery("update table_snapshots set entries_json = :json where id = :id")
                .setParameter("json", "[]")
                .setParameter("id", snapshotId)
                .executeUpdate();
        entityManager.clear();

        assertThatThrownBy(() -> snapshotService.rollback(snapshotId)).isInstanceOf(SnapshotCorruptedException.class);
        assertThat(tableStore.getCurrentTable(1L, 1L).size()).isEqualTo(2);
    }

    @Test
    void detailCarriesMetadataAndEntries() {
        tableStore.replaceTable(1L, 1L, twoTeamTable(1L, 1L, "Alpha", "Beta"), TableStore.SOURCE_CALCULATION);
        Long snapshotId = snapshotService.snapshot(1L, 1L, "manual", "ops");

        SnapshotDetailDTO detail = snapshotService.getSnapshot(snapshotId);

        assertThat(detail.getSnapshot().getCreatedBy()).isEqualTo("ops");
        assertThat(detail.getSnapshot().getEntryCount()).isEqualTo(2);
        assertThat(detail.getSnapshot().getChecksum()).hasSize(64);
        assertThat(detail.getEntries()).extracting(LeagueTableEntryDTO::getTeamName).containsExactly("Alpha", "Beta");
    }

    @Test
    void listsNewestFirstWithOptionalFilters() {
        Long first = snapshotService.snapshot(1L, 1L, "one", "tester");
        clock.advanceMillis(1000);
        Long second = snapshotService.snapshot(1L, 2L, "two", "tester");
        clock.advanceMillis(1000);
        Long third = snapshotService.snapshot(2L, 1L, "three", "tester");

        assertThat(snapshotService.listSnapshots(null, null)).extracting(SnapshotSummaryDTO::getId)
                .containsExactly(third, second, first);
        assertThat(snapshotService.listSnapshots(1L, null)).extracting(SnapshotSummaryDTO::getId)
                .containsExactly(second, first);
        assertThat(snapshotService.listSnapshots(1L, 2L)).extracting(SnapshotSummaryDTO::getId)
                .containsExactly(second);
    }

    @Test
    void keepsOnlyTheNewestSnapshotsPerTable() {
        properties.getSnapshot().setMaxPerTable(3);
        Long last = null;
        for (int i = 0; i < 5; i++) {
            last = snapshotService.snapshot(1L, 1L, "s" + i, "tester");
            clock.advanceMillis(1000);
        }
        snapshotService.snapshot(1L, 2L, "other season", "tester");

        List<SnapshotSummaryDTO> kept = snapshotService.listSnapshots(1L, 1L);
        assertThat(kept).hasSize(3);
        assertThat(kept.get(0).getId()).isEqualTo(last);
        assertThat(kept).extracting(SnapshotSummaryDTO::getDescription).containsExactly("s4", "s3", "s2");
        assertThat(snapshotService.listSnapshots(1L, 2L)).hasSize(1);
    }

    @Test
    void purgeRemovesSnapshotsOlderThanMaxAge() {
        Long old = snapshotService.snapshot(1L, 1L, "old", "tester");
        clock.advance(Duration.ofDays(20));
        Long recent = snapshotService.snapshot(1L, 1L, "recent", "tester");
        clock.advance(Duration.ofDays(11));

        assertThat(snapshotService.purgeExpired()).isEqualTo(1);
        assertThat(snapshotRepository.findById(old)).isEmpty();
        assertThat(snapshotRepository.findById(recent)).isPresent();
    }
}
