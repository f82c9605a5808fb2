package com.chambua.standings.exception;

/**
 * Match data cannot be turned into a table: unknown team, unfinished match, missing score and the like.
 * Never retried.
 */
public class InvalidMatchDataException extends StandingsException {

    public InvalidMatchDataException(String message) {
        super(message);
    }

    @Override
    public ErrorCategory getCategory() { return ErrorCategory.FIX_INPUT; }

    @Override
    public String getCode() { return "INVALID_MATCH_DATA"; }
}
