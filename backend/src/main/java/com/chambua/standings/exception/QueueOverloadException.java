package com.chambua.standings.exception;

public class QueueOverloadException extends StandingsException {

    private final int maxSize;

    public QueueOverloadException(int maxSize) {
        super("Calculation queue is full (" + maxSize + " active jobs), try again later");
        this.maxSize = maxSize;
    }

    public int getMaxSize() { return maxSize; }

    @Override
    public ErrorCategory getCategory() { return ErrorCategory.RETRY_LATER; }

    @Override
    public String getCode() { return "QUEUE_OVERLOAD"; }
}
