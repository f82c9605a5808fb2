package com.chambua.standings.store;

import com.chambua.standings.dto.LeagueTable;

import java.util.function.BooleanSupplier;

/**
 * The published table of each league season. Readers never observe a partially replaced table.
 */
public interface TableStore {

    String SOURCE_CALCULATION = "calculation";

    /** Current table, or an empty table when none has been published. */
    LeagueTable getCurrentTable(Long leagueId, Long seasonId);

    /**
     * Replaces every entry of the table in one transaction.
     *
     * @param source label stored on each row, e.g. {@code calculation} or {@code rollback:42}
     * @return number of entries written
     */
    int replaceTable(Long leagueId, Long seasonId, LeagueTable table, String source);

    /**
     * Fenced variant of {@link #replaceTable(Long, Long, LeagueTable, String)}. {@code stillCurrent} is checked
     * before the first write and again as the last step before commit; when it returns false nothing is written.
     *
     * @throws com.chambua.standings.exception.StaleClaimException when the fence no longer holds
     */
    int replaceTable(Long leagueId, Long seasonId, LeagueTable table, String source, BooleanSupplier stillCurrent);
}
