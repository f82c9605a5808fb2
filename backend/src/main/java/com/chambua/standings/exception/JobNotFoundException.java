package com.chambua.standings.exception;

public class JobNotFoundException extends StandingsException {

    public JobNotFoundException(String jobId) {
        super("Calculation job not found: " + jobId);
    }

    @Override
    public ErrorCategory getCategory() { return ErrorCategory.FIX_INPUT; }

    @Override
    public String getCode() { return "JOB_NOT_FOUND"; }
}
