package com.chambua.standings.queue;

public enum JobStatus {
    PENDING, PROCESSING, COMPLETED, FAILED, CANCELLED;

    /** Pending or processing: counts against capacity and blocks a second job for the same table. */
    public boolean isActive() {
        return this == PENDING || this == PROCESSING;
    }

    public boolean isTerminal() {
        return !isActive();
    }
}
