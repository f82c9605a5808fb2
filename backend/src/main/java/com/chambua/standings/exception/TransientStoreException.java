package com.chambua.standings.exception;

/**
 * The match or table store was unavailable, timed out or the work was interrupted.
 */
public class TransientStoreException extends StandingsException {

    public TransientStoreException(String message) {
        super(message);
    }

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCategory getCategory() { return ErrorCategory.RETRY_LATER; }

    @Override
    public String getCode() { return "STORE_UNAVAILABLE"; }
}
