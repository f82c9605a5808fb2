package com.chambua.standings.exception;

import com.chambua.standings.queue.JobStatus;

public class InvalidJobStateException extends StandingsException {

    public InvalidJobStateException(String jobId, JobStatus actual, String operation) {
        super("Cannot " + operation + " job " + jobId + " in state " + actual);
    }

    @Override
    public ErrorCategory getCategory() { return ErrorCategory.FIX_INPUT; }

    @Override
    public String getCode() { return "INVALID_JOB_STATE"; }
}
