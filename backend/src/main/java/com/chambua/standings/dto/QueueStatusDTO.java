package com.chambua.standings.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Operator view of the queue. {@code queueLength} counts pending jobs, {@code activeJobs} processing ones.
 */
public class QueueStatusDTO {
    private final int queueLength;
    private final int activeJobs;
    private final int completedJobs;
    private final int failedJobs;
    private final int cancelledJobs;
    private final boolean paused;
    private final List<JobSummaryDTO> jobs;

    public QueueStatusDTO(int queueLength, int activeJobs, int completedJobs, int failedJobs, int cancelledJobs,
                          boolean paused, List<JobSummaryDTO> jobs) {
        this.queueLength = queueLength;
        this.activeJobs = activeJobs;
        this.completedJobs = completedJobs;
        this.failedJobs = failedJobs;
        this.cancelledJobs = cancelledJobs;
        this.paused = paused;
        this.jobs = List.copyOf(jobs);
    }

    public int getQueueLength() { return queueLength; }
    public int getActiveJobs() { return activeJobs; }
    public int getCompletedJobs() { return completedJobs; }
    public int getFailedJobs() { return failedJobs; }
    public int getCancelledJobs() { return cancelledJobs; }

    @JsonProperty("isPaused")
    public boolean isPaused() { return paused; }

    public List<JobSummaryDTO> getJobs() { return jobs; }
}
