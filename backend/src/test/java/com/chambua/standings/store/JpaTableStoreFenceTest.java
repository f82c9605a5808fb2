package com.chambua.standings.store;

import com.chambua.standings.dto.LeagueTable;
import com.chambua.standings.dto.LeagueTableEntryDTO;
import com.chambua.standings.exception.StaleClaimException;
import com.chambua.standings.repository.TableEntryRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs against the transactional bean without a test transaction, so a fenced write is really rolled back.
 */
@DataJpaTest
@ActiveProfiles("test")
@Import({JpaTableStore.class, JpaTableStoreFenceTest.FixedClock.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaTableStoreFenceTest {

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2024-08-01T12:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired private TableStore tableStore;
    @Autowired private TableEntryRepository tableEntryRepository;

    @AfterEach
    void cleanUp() {
        tableEntryRepository.deleteAll();
    }

    private static LeagueTable table(String first, String second) {
        return new LeagueTable(1L, 1L, List.of(
                new LeagueTableEntryDTO(1, first.equals("Alpha") ? 10L : 20L, first, 1, 1, 0, 0, 2, 0, 2, 3),
                new LeagueTableEntryDTO(2, second.equals("Alpha") ? 10L : 20L, second, 1, 0, 0, 1, 0, 2, -2, 0)));
    }

    @Test
    void claimLostDuringTheWriteRollsTheWriteBack() {
        tableStore.replaceTable(1L, 1L, table("Alpha", "Beta"), TableStore.SOURCE_CALCULATION);
        AtomicInteger checks = new AtomicInteger();

        assertThatThrownBy(() -> tableStore.replaceTable(1L, 1L, table("Beta", "Alpha"), TableStore.SOURCE_CALCULATION,
                () -> checks.incrementAndGet() == 1))
                .isInstanceOf(StaleClaimException.class);

        assertThat(checks).hasValue(2);
        assertThat(tableStore.getCurrentTable(1L, 1L).getEntries())
                .extracting(LeagueTableEntryDTO::getTeamName)
                .containsExactly("Alpha", "Beta");
    }

    @Test
    void currentClaimCommits() {
        int written = tableStore.replaceTable(1L, 1L, table("Beta", "Alpha"), TableStore.SOURCE_CALCULATION, () -> true);

        assertThat(written).isEqualTo(2);
        assertThat(tableStore.getCurrentTable(1L, 1L)).isEqualTo(table("Beta", "Alpha"));
    }
}
