package com.chambua.standings.exception;

/**
 * Base type of every failure raised by the standings automation.
 */
public abstract class StandingsException extends RuntimeException {

    protected StandingsException(String message) {
        super(message);
    }

    protected StandingsException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorCategory getCategory();

    /** Stable machine-readable code used in API error bodies. */
    public abstract String getCode();

    /** Whether the job queue may retry the job that hit this error. */
    public boolean isRetryable() {
        return getCategory() == ErrorCategory.RETRY_LATER;
    }
}
