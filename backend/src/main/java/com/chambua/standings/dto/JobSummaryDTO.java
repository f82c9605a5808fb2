package com.chambua.standings.dto;

import com.chambua.standings.queue.CalculationJob;
import com.chambua.standings.queue.JobPriority;
import com.chambua.standings.queue.JobStatus;

import java.time.Instant;
import java.util.List;

public class JobSummaryDTO {
    private String id;
    private Long leagueId;
    private Long seasonId;
    private JobPriority priority;
    private JobStatus status;
    private int attempts;
    private String trigger;
    private String description;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private Instant nextAttemptAt;
    private String lastError;
    private List<String> errors;
    private boolean rerunRequested;
    private String followUpJobId;
    private int mergedRequests;
    private long ageMs;
    private Long durationMs;

    public JobSummaryDTO() {}

    public static JobSummaryDTO from(CalculationJob job, Instant now) {
        JobSummaryDTO d = new JobSummaryDTO();
        d.id = job.getId();
        d.leagueId = job.getLeagueId();
        d.seasonId = job.getSeasonId();
        d.priority = job.getPriority();
        d.status = job.getStatus();
        d.attempts = job.getAttempts();
        d.trigger = job.getTrigger();
        d.description = job.getDescription();
        d.createdAt = job.getCreatedAt();
        d.startedAt = job.getStartedAt();
        d.completedAt = job.getCompletedAt();
        d.nextAttemptAt = job.getNextAttemptAt();
        d.lastError = job.getLastError();
        d.errors = List.copyOf(job.getErrors());
        d.rerunRequested = job.isRerunRequested();
        d.followUpJobId = job.getFollowUpJobId();
        d.mergedRequests = job.getMergedRequests();
        d.ageMs = job.ageMs(now);
        d.durationMs = job.durationMs(now);
        return d;
    }

    public String getId() { return id; }
    public Long getLeagueId() { return leagueId; }
    public Long getSeasonId() { return seasonId; }
    public JobPriority getPriority() { return priority; }
    public JobStatus getStatus() { return status; }
    public int getAttempts() { return attempts; }
    public String getTrigger() { return trigger; }
    public String getDescription() { return description; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public Instant getNextAttemptAt() { return nextAttemptAt; }
    public String getLastError() { return lastError; }
    public List<String> getErrors() { return errors; }
    public boolean isRerunRequested() { return rerunRequested; }
    public String getFollowUpJobId() { return followUpJobId; }
    public int getMergedRequests() { return mergedRequests; }
    public long getAgeMs() { return ageMs; }
    public Long getDurationMs() { return durationMs; }
}
