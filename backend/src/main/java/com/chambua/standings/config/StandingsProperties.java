package com.chambua.standings.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for the standings automation, bound from {@code standings.*}.
 */
@ConfigurationProperties(prefix = "standings")
public class StandingsProperties {

    private final Queue queue = new Queue();
    private final Worker worker = new Worker();
    private final Snapshot snapshot = new Snapshot();
    private final Health health = new Health();

    public Queue getQueue() { return queue; }
    public Worker getWorker() { return worker; }
    public Snapshot getSnapshot() { return snapshot; }
    public Health getHealth() { return health; }

    public static class Queue {
        /** Maximum number of active (pending or processing) jobs. */
        private int maxSize = 100;
        /** Automatic requests parked while the queue is full; one per table. */
        private int maxDeferred = 1000;
        private int maxAttempts = 3;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 30000;
        private double jitterRatio = 0.1;
        /** A processing job older than this is treated as stuck. */
        private long jobTimeoutMs = 30000;
        private int maxCompletedJobs = 100;
        private int maxFailedJobs = 50;
        private int recentFailureLimit = 20;
        /** Finished jobs older than this are dropped by the hourly cleanup. */
        private int jobRetentionHours = 24;

        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }
        public int getMaxDeferred() { return maxDeferred; }
        public void setMaxDeferred(int maxDeferred) { this.maxDeferred = maxDeferred; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }
        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }
        public double getJitterRatio() { return jitterRatio; }
        public void setJitterRatio(double jitterRatio) { this.jitterRatio = jitterRatio; }
        public long getJobTimeoutMs() { return jobTimeoutMs; }
        public void setJobTimeoutMs(long jobTimeoutMs) { this.jobTimeoutMs = jobTimeoutMs; }
        public int getMaxCompletedJobs() { return maxCompletedJobs; }
        public void setMaxCompletedJobs(int maxCompletedJobs) { this.maxCompletedJobs = maxCompletedJobs; }
        public int getMaxFailedJobs() { return maxFailedJobs; }
        public void setMaxFailedJobs(int maxFailedJobs) { this.maxFailedJobs = maxFailedJobs; }
        public int getRecentFailureLimit() { return recentFailureLimit; }
        public void setRecentFailureLimit(int recentFailureLimit) { this.recentFailureLimit = recentFailureLimit; }
        public int getJobRetentionHours() { return jobRetentionHours; }
        public void setJobRetentionHours(int jobRetentionHours) { this.jobRetentionHours = jobRetentionHours; }
    }

    public static class Worker {
        private int poolSize = 3;
        private long pollIntervalMs = 500;
        private long stuckCheckIntervalMs = 5000;

        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
        public long getStuckCheckIntervalMs() { return stuckCheckIntervalMs; }
        public void setStuckCheckIntervalMs(long stuckCheckIntervalMs) { this.stuckCheckIntervalMs = stuckCheckIntervalMs; }
    }

    public static class Snapshot {
        private int maxPerTable = 50;
        private int maxAgeDays = 30;

        public int getMaxPerTable() { return maxPerTable; }
        public void setMaxPerTable(int maxPerTable) { this.maxPerTable = maxPerTable; }
        public int getMaxAgeDays() { return maxAgeDays; }
        public void setMaxAgeDays(int maxAgeDays) { this.maxAgeDays = maxAgeDays; }
    }

    public static class Health {
        private int pendingDegraded = 50;
        /** Must not exceed {@code standings.queue.max-size}, pending jobs never go above it. */
        private int pendingUnhealthy = 90;
        private int failedDegraded = 10;
        private double failureRateUnhealthy = 0.5;
        private int minSampleSize = 5;
        private long stalePendingMs = 300000;
        /** A rejected or deferred request keeps the status UNHEALTHY for this long. */
        private long recentRejectionMs = 60000;

        /**
         * Rejects backlog thresholds the queue can never reach.
         *
         * @throws IllegalStateException when the thresholds are out of order or above the queue capacity
         */
        public void validate(int queueMaxSize) {
            if (pendingUnhealthy > queueMaxSize) {
                throw new IllegalStateException("standings.health.pending-unhealthy (" + pendingUnhealthy
                        + ") must not exceed standings.queue.max-size (" + queueMaxSize + ")");
            }
            if (pendingDegraded >= pendingUnhealthy) {
                throw new IllegalStateException("standings.health.pending-degraded (" + pendingDegraded
                        + ") must be below standings.health.pending-unhealthy (" + pendingUnhealthy + ")");
            }
        }

        public int getPendingDegraded() { return pendingDegraded; }
        public void setPendingDegraded(int pendingDegraded) { this.pendingDegraded = pendingDegraded; }
        public int getPendingUnhealthy() { return pendingUnhealthy; }
        public void setPendingUnhealthy(int pendingUnhealthy) { this.pendingUnhealthy = pendingUnhealthy; }
        public int getFailedDegraded() { return failedDegraded; }
        public void setFailedDegraded(int failedDegraded) { this.failedDegraded = failedDegraded; }
        public double getFailureRateUnhealthy() { return failureRateUnhealthy; }
        public void setFailureRateUnhealthy(double failureRateUnhealthy) { this.failureRateUnhealthy = failureRateUnhealthy; }
        public int getMinSampleSize() { return minSampleSize; }
        public void setMinSampleSize(int minSampleSize) { this.minSampleSize = minSampleSize; }
        public long getStalePendingMs() { return stalePendingMs; }
        public void setStalePendingMs(long stalePendingMs) { this.stalePendingMs = stalePendingMs; }
        public long getRecentRejectionMs() { return recentRejectionMs; }
        public void setRecentRejectionMs(long recentRejectionMs) { this.recentRejectionMs = recentRejectionMs; }
    }
}
