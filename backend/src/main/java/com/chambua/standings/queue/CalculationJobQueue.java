package com.chambua.standings.queue;

import com.chambua.standings.config.StandingsProperties;
import com.chambua.standings.dto.JobSummaryDTO;
import com.chambua.standings.dto.QueueStatusDTO;
import com.chambua.standings.exception.InvalidJobStateException;
import com.chambua.standings.exception.JobNotFoundException;
import com.chambua.standings.exception.QueueOverloadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory queue of table recalculations, at most one active job per (league, season).
 *
 * <p>All state sits behind a single lock, so every public operation is atomic with respect to the others and a
 * pending job is handed to exactly one caller of {@link #dequeue()}. Workers report back with the claim token
 * they were given; a report for a claim that has since been reaped and re-issued is ignored.
 *
 * <p>Automatic requests that arrive while the queue is full are parked per table via
 * {@link #enqueueOrDefer} and become jobs as capacity frees up, so a burst of result changes is delayed rather
 * than lost.
 */
@Component
public class CalculationJobQueue {
    private static final Logger log = LoggerFactory.getLogger(CalculationJobQueue.class);

    private static final Comparator<CalculationJob> DEQUEUE_ORDER = Comparator
            .comparing(CalculationJob::getPriority).reversed()
            .thenComparingLong(CalculationJob::getSequence);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CalculationJob> jobs = new LinkedHashMap<>();
    private final Map<TableKey, String> activeByKey = new HashMap<>();
    private final Map<TableKey, DeferredRequest> deferred = new LinkedHashMap<>();
    private final Deque<JobFailure> recentFailures = new ArrayDeque<>();

    private final StandingsProperties.Queue config;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    private boolean paused;
    private long sequence;
    private long tokens;

    private long totalEnqueued;
    private long totalMerged;
    private long totalCompleted;
    private long totalFailed;
    private long totalRetried;
    private long totalReaped;
    private long totalCancelled;
    private long totalRejected;
    private long totalDeferred;
    private long totalDropped;
    private Instant lastRejectedAt;
    private long sumDurationMs;

    private record TableKey(Long leagueId, Long seasonId) {
        static TableKey of(CalculationJob job) {
            return new TableKey(job.getLeagueId(), job.getSeasonId());
        }
    }

    private static final class DeferredRequest {
        private final String trigger;
        private final String description;
        private final Instant deferredAt;
        private JobPriority priority;

        DeferredRequest(JobPriority priority, String trigger, String description, Instant deferredAt) {
            this.priority = priority;
            this.trigger = trigger;
            this.description = description;
            this.deferredAt = deferredAt;
        }
    }

    public CalculationJobQueue(StandingsProperties properties, RetryPolicy retryPolicy, Clock clock) {
        this.config = properties.getQueue();
        this.retryPolicy = retryPolicy;
        this.clock = clock;
    }

    public String enqueue(Long leagueId, Long seasonId, JobPriority priority) {
        return enqueue(leagueId, seasonId, priority, "manual", null);
    }

    /**
     * Requests a recalculation. When the table already has an active job the request is merged into it and
     * that job's id is returned: a pending job takes the higher of the two priorities, a processing job is
     * additionally marked so that a fresh run follows once it finishes.
     *
     * @throws QueueOverloadException when a new job would exceed the configured capacity
     */
    public String enqueue(Long leagueId, Long seasonId, JobPriority priority, String trigger, String description) {
        if (leagueId == null || seasonId == null) {
            throw new IllegalArgumentException("leagueId and seasonId are required");
        }
        JobPriority requested = priority != null ? priority : JobPriority.NORMAL;
        TableKey key = new TableKey(leagueId, seasonId);
        lock.lock();
        try {
            String jobId = submit(key, requested, trigger, description);
            if (jobId == null) {
                recordRejection();
                log.warn("[Queue][Overload] rejected leagueId={} seasonId={} active={} maxSize={}",
                        leagueId, seasonId, activeByKey.size(), config.getMaxSize());
                throw new QueueOverloadException(config.getMaxSize());
            }
            return jobId;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Same as {@link #enqueue(Long, Long, JobPriority, String, String)}, except that a request the queue has no
     * room for is parked and turned into a job once capacity frees up. Parked requests for the same table collapse
     * into one that keeps the highest priority. When the parking area itself is full the request is dropped and
     * recorded as a failure.
     *
     * @return the job id, or empty when the request was parked or dropped
     */
    public Optional<String> enqueueOrDefer(Long leagueId, Long seasonId, JobPriority priority, String trigger, String description) {
        if (leagueId == null || seasonId == null) {
            throw new IllegalArgumentException("leagueId and seasonId are required");
        }
        JobPriority requested = priority != null ? priority : JobPriority.NORMAL;
        TableKey key = new TableKey(leagueId, seasonId);
        lock.lock();
        try {
            String jobId = submit(key, requested, trigger, description);
            if (jobId != null) {
                return Optional.of(jobId);
            }
            recordRejection();
            defer(key, requested, trigger, description);
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /** Parked requests waiting for capacity. */
    public int deferredCount() {
        lock.lock();
        try {
            return deferred.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Claims the most urgent eligible job: highest priority first, submission order within a priority. Jobs
     * waiting out a retry delay are skipped. Returns empty while paused.
     */
    public Optional<JobClaim> dequeue() {
        lock.lock();
        try {
            if (paused) {
                return Optional.empty();
            }
            Instant now = clock.instant();
            Optional<CalculationJob> next = jobs.values().stream()
                    .filter(j -> j.isEligible(now))
                    .min(DEQUEUE_ORDER);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            CalculationJob job = next.get();
            job.markProcessing(now, ++tokens);
            log.debug("[Queue][Dequeue] jobId={} leagueId={} seasonId={} priority={} attempt={}",
                    job.getId(), job.getLeagueId(), job.getSeasonId(), job.getPriority(), job.getAttempts() + 1);
            return Optional.of(new JobClaim(job.getId(), job.getLeagueId(), job.getSeasonId(), job.getPriority(),
                    job.getAttempts() + 1, job.getClaimToken(), now));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Worker report of success. Returns false, and changes nothing, when the claim is no longer current.
     */
    public boolean complete(String jobId, long claimToken) {
        lock.lock();
        try {
            CalculationJob job = jobs.get(jobId);
            if (!holdsClaim(job, claimToken)) {
                log.warn("[Queue][StaleReport] ignoring completion jobId={} token={}", jobId, claimToken);
                return false;
            }
            finishCompleted(job, clock.instant());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Whether {@code claimToken} is still the live claim on the job. */
    public boolean isCurrentClaim(String jobId, long claimToken) {
        lock.lock();
        try {
            return holdsClaim(jobs.get(jobId), claimToken);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the start of the table write for a claim. The reaper measures a publishing job's timeout from this
     * point, which gives the store's transaction timeout the chance to abort the write first. Returns false when
     * the claim is no longer current.
     */
    public boolean beginPublish(String jobId, long claimToken) {
        lock.lock();
        try {
            CalculationJob job = jobs.get(jobId);
            if (!holdsClaim(job, claimToken)) {
                return false;
            }
            job.markPublishing(clock.instant());
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void complete(String jobId) {
        lock.lock();
        try {
            CalculationJob job = require(jobId);
            if (job.getStatus() != JobStatus.PROCESSING) {
                throw new InvalidJobStateException(jobId, job.getStatus(), "complete");
            }
            finishCompleted(job, clock.instant());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Worker report of failure. Retryable failures go back to pending after the backoff delay until the
     * attempt limit is reached. Returns false, and changes nothing, when the claim is no longer current.
     */
    public boolean fail(String jobId, long claimToken, String error, boolean retryable) {
        lock.lock();
        try {
            CalculationJob job = jobs.get(jobId);
            if (!holdsClaim(job, claimToken)) {
                log.warn("[Queue][StaleReport] ignoring failure jobId={} token={} error={}", jobId, claimToken, error);
                return false;
            }
            applyFailure(job, error, retryable, clock.instant());
            return true;
        } finally {
            lock.unlock();
        }
    }

    public JobStatus fail(String jobId, String error) {
        return fail(jobId, error, true);
    }

    public JobStatus fail(String jobId, String error, boolean retryable) {
        lock.lock();
        try {
            CalculationJob job = require(jobId);
            if (job.getStatus() != JobStatus.PROCESSING) {
                throw new InvalidJobStateException(jobId, job.getStatus(), "fail");
            }
            return applyFailure(job, error, retryable, clock.instant());
        } finally {
            lock.unlock();
        }
    }

    /** Cancels a pending job. Processing jobs can only be stopped by the stuck-job timeout. */
    public void cancel(String jobId) {
        lock.lock();
        try {
            CalculationJob job = require(jobId);
            if (job.getStatus() != JobStatus.PENDING) {
                throw new InvalidJobStateException(jobId, job.getStatus(), "cancel");
            }
            cancelPending(job, clock.instant(), "cancelled by operator");
            promoteDeferred();
            enforceRetention();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fails every processing job that has run longer than the job timeout, as a retryable failure. A job that is
     * writing its table gets the full timeout again from the start of the write. The returned claims carry the
     * tokens the stuck workers hold, so their late reports and fenced writes will be refused.
     */
    public List<JobClaim> reapStuckJobs() {
        lock.lock();
        try {
            Instant now = clock.instant();
            Instant cutoff = now.minusMillis(config.getJobTimeoutMs());
            List<CalculationJob> stuck = jobs.values().stream()
                    .filter(j -> j.getStatus() == JobStatus.PROCESSING && j.getStartedAt().isBefore(cutoff)
                            && (j.getPublishStartedAt() == null || j.getPublishStartedAt().isBefore(cutoff)))
                    .collect(Collectors.toList());
            List<JobClaim> reaped = new ArrayList<>(stuck.size());
            for (CalculationJob job : stuck) {
                reaped.add(new JobClaim(job.getId(), job.getLeagueId(), job.getSeasonId(), job.getPriority(),
                        job.getAttempts() + 1, job.getClaimToken(), job.getStartedAt()));
                totalReaped++;
                log.warn("[Queue][Reap] jobId={} leagueId={} seasonId={} runningMs={}", job.getId(),
                        job.getLeagueId(), job.getSeasonId(), job.durationMs(now));
                applyFailure(job, "Job timed out after " + config.getJobTimeoutMs() + "ms", true, now);
            }
            return reaped;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops handing out jobs. Processing jobs run to completion.
     *
     * @param cancelPending also cancel every pending job
     * @return number of jobs cancelled
     */
    public int pause(boolean cancelPending) {
        lock.lock();
        try {
            paused = true;
            int cancelled = cancelPending ? cancelAllPending("cancelled by pause") : 0;
            log.info("[Queue][Pause] cancelPending={} cancelled={}", cancelPending, cancelled);
            return cancelled;
        } finally {
            lock.unlock();
        }
    }

    public void resume() {
        lock.lock();
        try {
            paused = false;
            log.info("[Queue][Resume] pending={}", count(JobStatus.PENDING));
        } finally {
            lock.unlock();
        }
    }

    public boolean isPaused() {
        lock.lock();
        try {
            return paused;
        } finally {
            lock.unlock();
        }
    }

    /** Cancels every pending job; returns how many. */
    public int clearPending() {
        lock.lock();
        try {
            int cancelled = cancelAllPending("cancelled by clear");
            log.info("[Queue][Clear] cancelled={}", cancelled);
            return cancelled;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Puts a failed job back in the queue with a fresh attempt budget. When its table already has another active
     * job the request is merged into that one and its id returned.
     */
    public String retryFailed(String jobId) {
        lock.lock();
        try {
            CalculationJob job = require(jobId);
            if (job.getStatus() != JobStatus.FAILED) {
                throw new InvalidJobStateException(jobId, job.getStatus(), "retry");
            }
            TableKey key = TableKey.of(job);
            String activeId = activeByKey.get(key);
            if (activeId != null) {
                merge(jobs.get(activeId), job.getPriority());
                log.info("[Queue][Retry] jobId={} merged into active jobId={}", jobId, activeId);
                return activeId;
            }
            if (activeByKey.size() >= config.getMaxSize()) {
                recordRejection();
                throw new QueueOverloadException(config.getMaxSize());
            }
            job.requeue(++sequence, clock.instant());
            activeByKey.put(key, job.getId());
            log.info("[Queue][Retry] jobId={} leagueId={} seasonId={} requeued", jobId, job.getLeagueId(), job.getSeasonId());
            return job.getId();
        } finally {
            lock.unlock();
        }
    }

    public CalculationJob getJob(String jobId) {
        lock.lock();
        try {
            return require(jobId).copy();
        } finally {
            lock.unlock();
        }
    }

    public QueueStatusDTO getStatus() {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<JobSummaryDTO> listed = new ArrayList<>();
            jobs.values().stream()
                    .filter(j -> j.getStatus().isActive())
                    .sorted(Comparator.comparing((CalculationJob j) -> j.getStatus() != JobStatus.PROCESSING)
                            .thenComparing(DEQUEUE_ORDER))
                    .forEach(j -> listed.add(JobSummaryDTO.from(j, now)));
            jobs.values().stream()
                    .filter(j -> j.getStatus().isTerminal())
                    .sorted(Comparator.comparing(CalculationJob::getCompletedAt).reversed())
                    .forEach(j -> listed.add(JobSummaryDTO.from(j, now)));
            return new QueueStatusDTO(count(JobStatus.PENDING), count(JobStatus.PROCESSING), count(JobStatus.COMPLETED),
                    count(JobStatus.FAILED), count(JobStatus.CANCELLED), paused, listed);
        } finally {
            lock.unlock();
        }
    }

    /** Retained jobs, newest first, optionally for one league only. */
    public List<JobSummaryDTO> history(Long leagueId, int limit) {
        lock.lock();
        try {
            Instant now = clock.instant();
            return jobs.values().stream()
                    .filter(j -> leagueId == null || leagueId.equals(j.getLeagueId()))
                    .sorted(Comparator.comparing(CalculationJob::getCreatedAt)
                            .thenComparingLong(CalculationJob::getSequence).reversed())
                    .limit(Math.max(0, limit))
                    .map(j -> JobSummaryDTO.from(j, now))
                    .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    public List<JobFailure> recentFailures() {
        lock.lock();
        try {
            return List.copyOf(recentFailures);
        } finally {
            lock.unlock();
        }
    }

    public QueueMetrics metrics() {
        lock.lock();
        try {
            Instant now = clock.instant();
            Long oldestPending = jobs.values().stream()
                    .filter(j -> j.getStatus() == JobStatus.PENDING)
                    .map(j -> j.ageMs(now))
                    .max(Long::compare).orElse(null);
            Long oldestEligible = jobs.values().stream()
                    .filter(j -> j.isEligible(now))
                    .map(j -> Math.max(0, Duration.between(j.getQueuedAt(), now).toMillis()))
                    .max(Long::compare).orElse(null);
            List<JobSummaryDTO> processing = jobs.values().stream()
                    .filter(j -> j.getStatus() == JobStatus.PROCESSING)
                    .map(j -> JobSummaryDTO.from(j, now))
                    .collect(Collectors.toList());
            long avg = totalCompleted == 0 ? 0 : sumDurationMs / totalCompleted;
            return new QueueMetrics(count(JobStatus.PENDING), count(JobStatus.PROCESSING), count(JobStatus.COMPLETED),
                    count(JobStatus.FAILED), count(JobStatus.CANCELLED), paused, config.getMaxSize(), deferred.size(),
                    totalEnqueued, totalMerged, totalCompleted, totalFailed, totalRetried, totalReaped, totalCancelled,
                    totalRejected, totalDeferred, totalDropped, lastRejectedAt, avg, oldestPending, oldestEligible,
                    processing, List.copyOf(recentFailures));
        } finally {
            lock.unlock();
        }
    }

    /** Pending plus processing jobs. */
    public int activeCount() {
        lock.lock();
        try {
            return activeByKey.size();
        } finally {
            lock.unlock();
        }
    }

    @Scheduled(cron = "0 0 * * * *") // hourly cleanup
    public void cleanup() {
        lock.lock();
        try {
            Instant cutoff = clock.instant().minus(Duration.ofHours(config.getJobRetentionHours()));
            int before = jobs.size();
            jobs.values().removeIf(j -> j.getStatus().isTerminal() && j.getCompletedAt() != null
                    && j.getCompletedAt().isBefore(cutoff));
            if (jobs.size() != before) {
                log.info("[Queue][Cleanup] removed={} retained={}", before - jobs.size(), jobs.size());
            }
        } finally {
            lock.unlock();
        }
    }

    // --- internals, lock held ---

    /** Merges into the table's active job or creates one; null when there is no room for a new job. */
    private String submit(TableKey key, JobPriority requested, String trigger, String description) {
        String existingId = activeByKey.get(key);
        if (existingId != null) {
            CalculationJob existing = jobs.get(existingId);
            merge(existing, requested);
            log.info("[Queue][Merge] jobId={} leagueId={} seasonId={} status={} priority={} rerunRequested={}",
                    existingId, key.leagueId(), key.seasonId(), existing.getStatus(), existing.getPriority(),
                    existing.isRerunRequested());
            return existingId;
        }
        if (activeByKey.size() >= config.getMaxSize()) {
            return null;
        }
        DeferredRequest parked = deferred.remove(key);
        JobPriority effective = parked != null ? JobPriority.max(parked.priority, requested) : requested;
        CalculationJob job = create(key.leagueId(), key.seasonId(), effective, trigger, description);
        log.info("[Queue][Enqueue] jobId={} leagueId={} seasonId={} priority={} trigger={}",
                job.getId(), key.leagueId(), key.seasonId(), effective, trigger);
        return job.getId();
    }

    private void recordRejection() {
        totalRejected++;
        lastRejectedAt = clock.instant();
    }

    private void defer(TableKey key, JobPriority priority, String trigger, String description) {
        DeferredRequest parked = deferred.get(key);
        if (parked != null) {
            parked.priority = JobPriority.max(parked.priority, priority);
            log.info("[Queue][Defer] leagueId={} seasonId={} already deferred, priority={}", key.leagueId(),
                    key.seasonId(), parked.priority);
            return;
        }
        Instant now = clock.instant();
        if (deferred.size() >= config.getMaxDeferred()) {
            totalDropped++;
            String error = "Recalculation request dropped: queue and deferred backlog full (" + config.getMaxDeferred() + ")";
            addRecentFailure(new JobFailure(null, key.leagueId(), key.seasonId(), 0, error, now));
            log.error("[Queue][Drop] leagueId={} seasonId={} trigger={} deferred={} maxDeferred={}", key.leagueId(),
                    key.seasonId(), trigger, deferred.size(), config.getMaxDeferred());
            return;
        }
        deferred.put(key, new DeferredRequest(priority, trigger, description, now));
        totalDeferred++;
        log.warn("[Queue][Defer] leagueId={} seasonId={} priority={} trigger={} deferred={}", key.leagueId(),
                key.seasonId(), priority, trigger, deferred.size());
    }

    /** Turns parked requests into jobs, oldest first, while there is room. */
    private void promoteDeferred() {
        Iterator<Map.Entry<TableKey, DeferredRequest>> it = deferred.entrySet().iterator();
        Instant now = clock.instant();
        while (it.hasNext() && activeByKey.size() < config.getMaxSize()) {
            Map.Entry<TableKey, DeferredRequest> entry = it.next();
            it.remove();
            TableKey key = entry.getKey();
            DeferredRequest parked = entry.getValue();
            String activeId = activeByKey.get(key);
            if (activeId != null) {
                merge(jobs.get(activeId), parked.priority);
                continue;
            }
            CalculationJob job = create(key.leagueId(), key.seasonId(), parked.priority, parked.trigger, parked.description);
            log.info("[Queue][Promote] jobId={} leagueId={} seasonId={} priority={} waitedMs={}", job.getId(),
                    key.leagueId(), key.seasonId(), parked.priority, Duration.between(parked.deferredAt, now).toMillis());
        }
    }

    private CalculationJob create(Long leagueId, Long seasonId, JobPriority priority, String trigger, String description) {
        CalculationJob job = new CalculationJob(leagueId, seasonId, priority, trigger, description, clock.instant(), ++sequence);
        jobs.put(job.getId(), job);
        activeByKey.put(TableKey.of(job), job.getId());
        totalEnqueued++;
        return job;
    }

    private void merge(CalculationJob existing, JobPriority requested) {
        existing.setPriority(JobPriority.max(existing.getPriority(), requested));
        existing.incrementMerged();
        if (existing.getStatus() == JobStatus.PROCESSING) {
            existing.setRerunRequested(true);
        }
        totalMerged++;
    }

    private boolean holdsClaim(CalculationJob job, long claimToken) {
        return job != null && job.getStatus() == JobStatus.PROCESSING && job.getClaimToken() == claimToken;
    }

    private CalculationJob require(String jobId) {
        CalculationJob job = jobId == null ? null : jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    private void finishCompleted(CalculationJob job, Instant now) {
        Long duration = job.durationMs(now);
        job.markTerminal(JobStatus.COMPLETED, now);
        totalCompleted++;
        sumDurationMs += duration != null ? duration : 0;
        log.info("[Queue][Complete] jobId={} leagueId={} seasonId={} attempts={} durationMs={}",
                job.getId(), job.getLeagueId(), job.getSeasonId(), job.getAttempts() + 1, duration);
        release(job);
        scheduleFollowUp(job);
        promoteDeferred();
        enforceRetention();
    }

    private JobStatus applyFailure(CalculationJob job, String error, boolean retryable, Instant now) {
        job.incrementAttempts();
        job.recordError(error);
        if (retryable && retryPolicy.shouldRetry(job.getAttempts())) {
            Duration delay = retryPolicy.delayFor(job.getAttempts());
            job.markRetry(now.plus(delay));
            // the retry reads the latest match data, which covers any merged request
            job.setRerunRequested(false);
            totalRetried++;
            log.warn("[Queue][Retry] jobId={} attempts={}/{} delayMs={} error={}", job.getId(), job.getAttempts(),
                    retryPolicy.getMaxAttempts(), delay.toMillis(), error);
            return JobStatus.PENDING;
        }
        job.markTerminal(JobStatus.FAILED, now);
        totalFailed++;
        addRecentFailure(new JobFailure(job.getId(), job.getLeagueId(), job.getSeasonId(), job.getAttempts(), error, now));
        log.error("[Queue][Failed] jobId={} leagueId={} seasonId={} attempts={} retryable={} error={}", job.getId(),
                job.getLeagueId(), job.getSeasonId(), job.getAttempts(), retryable, error);
        release(job);
        scheduleFollowUp(job);
        promoteDeferred();
        enforceRetention();
        return JobStatus.FAILED;
    }

    private void cancelPending(CalculationJob job, Instant now, String reason) {
        job.markTerminal(JobStatus.CANCELLED, now);
        job.recordError(reason);
        totalCancelled++;
        release(job);
        log.info("[Queue][Cancel] jobId={} leagueId={} seasonId={} reason={}", job.getId(), job.getLeagueId(),
                job.getSeasonId(), reason);
    }

    private int cancelAllPending(String reason) {
        Instant now = clock.instant();
        List<CalculationJob> pending = jobs.values().stream()
                .filter(j -> j.getStatus() == JobStatus.PENDING)
                .collect(Collectors.toList());
        pending.forEach(j -> cancelPending(j, now, reason));
        if (!deferred.isEmpty()) {
            log.info("[Queue][Cancel] discarding {} deferred requests, reason={}", deferred.size(), reason);
            deferred.clear();
        }
        enforceRetention();
        return pending.size();
    }

    private void addRecentFailure(JobFailure failure) {
        recentFailures.addFirst(failure);
        while (recentFailures.size() > config.getRecentFailureLimit()) {
            recentFailures.removeLast();
        }
    }

    private void release(CalculationJob job) {
        activeByKey.remove(TableKey.of(job), job.getId());
    }

    private void scheduleFollowUp(CalculationJob finished) {
        if (!finished.isRerunRequested()) {
            return;
        }
        CalculationJob followUp = create(finished.getLeagueId(), finished.getSeasonId(), finished.getPriority(),
                "rerun", "Follow-up of " + finished.getId());
        finished.setFollowUpJobId(followUp.getId());
        log.info("[Queue][FollowUp] jobId={} followUpJobId={} priority={}", finished.getId(), followUp.getId(),
                followUp.getPriority());
    }

    private void enforceRetention() {
        trim(j -> j.getStatus() == JobStatus.COMPLETED || j.getStatus() == JobStatus.CANCELLED, config.getMaxCompletedJobs());
        trim(j -> j.getStatus() == JobStatus.FAILED, config.getMaxFailedJobs());
    }

    private void trim(Predicate<CalculationJob> filter, int keep) {
        List<CalculationJob> matching = jobs.values().stream()
                .filter(filter)
                .sorted(Comparator.comparing(CalculationJob::getCompletedAt))
                .collect(Collectors.toList());
        for (int i = 0; i < matching.size() - keep; i++) {
            jobs.remove(matching.get(i).getId());
        }
    }

    private int count(JobStatus status) {
        return (int) jobs.values().stream().filter(j -> j.getStatus() == status).count();
    }
}
