package com.chambua.standings.queue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * One recalculation request for a (league, season) table. Mutated only by {@link CalculationJobQueue} while it
 * holds its lock; everything outside the queue sees copies.
 */
public class CalculationJob {

    static final int MAX_ERROR_HISTORY = 10;

    private final String id;
    private final Long leagueId;
    private final Long seasonId;
    private final String trigger;
    private final String description;
    private final Instant createdAt;

    private long sequence;
    private JobPriority priority;
    private JobStatus status = JobStatus.PENDING;
    private int attempts;
    private Instant startedAt;
    private Instant publishStartedAt;
    private Instant completedAt;
    private Instant nextAttemptAt;
    private Instant queuedAt;
    private String lastError;
    private final List<String> errors = new ArrayList<>();
    private boolean rerunRequested;
    private String followUpJobId;
    private int mergedRequests;
    private long claimToken;

    CalculationJob(Long leagueId, Long seasonId, JobPriority priority, String trigger, String description,
                   Instant createdAt, long sequence) {
        this(UUID.randomUUID().toString(), leagueId, seasonId, priority, trigger, description, createdAt, sequence);
    }

    private CalculationJob(String id, Long leagueId, Long seasonId, JobPriority priority, String trigger,
                           String description, Instant createdAt, long sequence) {
        this.id = id;
        this.leagueId = leagueId;
        this.seasonId = seasonId;
        this.priority = priority;
        this.trigger = trigger;
        this.description = description;
        this.createdAt = createdAt;
        this.sequence = sequence;
        this.queuedAt = createdAt;
    }

    CalculationJob copy() {
        CalculationJob c = new CalculationJob(id, leagueId, seasonId, priority, trigger, description, createdAt, sequence);
        c.status = status;
        c.attempts = attempts;
        c.startedAt = startedAt;
        c.publishStartedAt = publishStartedAt;
        c.completedAt = completedAt;
        c.nextAttemptAt = nextAttemptAt;
        c.queuedAt = queuedAt;
        c.lastError = lastError;
        c.errors.addAll(errors);
        c.rerunRequested = rerunRequested;
        c.followUpJobId = followUpJobId;
        c.mergedRequests = mergedRequests;
        c.claimToken = claimToken;
        return c;
    }

    boolean isEligible(Instant now) {
        return status == JobStatus.PENDING && (nextAttemptAt == null || !nextAttemptAt.isAfter(now));
    }

    void recordError(String error) {
        lastError = error;
        errors.add(error);
        if (errors.size() > MAX_ERROR_HISTORY) {
            errors.remove(0);
        }
    }

    void markProcessing(Instant now, long token) {
        status = JobStatus.PROCESSING;
        startedAt = now;
        publishStartedAt = null;
        nextAttemptAt = null;
        claimToken = token;
    }

    void markPublishing(Instant now) {
        publishStartedAt = now;
    }

    void markTerminal(JobStatus terminal, Instant now) {
        status = terminal;
        completedAt = now;
        publishStartedAt = null;
        nextAttemptAt = null;
        claimToken = 0;
    }

    void markRetry(Instant eligibleAt) {
        status = JobStatus.PENDING;
        nextAttemptAt = eligibleAt;
        queuedAt = eligibleAt;
        publishStartedAt = null;
        claimToken = 0;
    }

    void requeue(long newSequence, Instant now) {
        status = JobStatus.PENDING;
        queuedAt = now;
        sequence = newSequence;
        attempts = 0;
        completedAt = null;
        nextAttemptAt = null;
        rerunRequested = false;
        followUpJobId = null;
    }

    void incrementAttempts() { attempts++; }
    void incrementMerged() { mergedRequests++; }
    void setPriority(JobPriority priority) { this.priority = priority; }
    void setRerunRequested(boolean rerunRequested) { this.rerunRequested = rerunRequested; }
    void setFollowUpJobId(String followUpJobId) { this.followUpJobId = followUpJobId; }
    long getSequence() { return sequence; }
    long getClaimToken() { return claimToken; }
    /** When the job last became eligible for dequeue. */
    Instant getQueuedAt() { return queuedAt; }

    public String getId() { return id; }
    public Long getLeagueId() { return leagueId; }
    public Long getSeasonId() { return seasonId; }
    public String getTrigger() { return trigger; }
    public String getDescription() { return description; }
    public Instant getCreatedAt() { return createdAt; }
    public JobPriority getPriority() { return priority; }
    public JobStatus getStatus() { return status; }
    public int getAttempts() { return attempts; }
    public Instant getStartedAt() { return startedAt; }
    /** Set while the current attempt is writing the table. */
    public Instant getPublishStartedAt() { return publishStartedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public Instant getNextAttemptAt() { return nextAttemptAt; }
    public String getLastError() { return lastError; }
    public List<String> getErrors() { return Collections.unmodifiableList(errors); }
    public boolean isRerunRequested() { return rerunRequested; }
    public String getFollowUpJobId() { return followUpJobId; }
    public int getMergedRequests() { return mergedRequests; }

    /** Run time of the last attempt, or of the current one measured against {@code now}. */
    public Long durationMs(Instant now) {
        if (startedAt == null) return null;
        Instant end = (status == JobStatus.PROCESSING || completedAt == null) ? now : completedAt;
        return Math.max(0, Duration.between(startedAt, end).toMillis());
    }

    public long ageMs(Instant now) {
        return Math.max(0, Duration.between(createdAt, now).toMillis());
    }

    @Override
    public String toString() {
        return "CalculationJob{id=" + id + ", league=" + leagueId + ", season=" + seasonId + ", priority=" + priority
                + ", status=" + status + ", attempts=" + attempts + "}";
    }
}
