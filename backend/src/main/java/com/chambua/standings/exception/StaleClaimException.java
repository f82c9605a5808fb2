package com.chambua.standings.exception;

/**
 * A worker tried to publish for a claim the queue has since reaped and handed to another worker. The write is
 * rolled back; the current claim owns the table.
 */
public class StaleClaimException extends StandingsException {

    public StaleClaimException(Long leagueId, Long seasonId) {
        super("Claim for league " + leagueId + " season " + seasonId + " is no longer current");
    }

    @Override
    public ErrorCategory getCategory() { return ErrorCategory.RETRY_LATER; }

    @Override
    public String getCode() { return "STALE_CLAIM"; }
}
