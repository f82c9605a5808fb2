package com.chambua.standings.queue;

import com.chambua.standings.dto.JobSummaryDTO;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time counters read by the health reporter. Totals are lifetime values since startup.
 */
public record QueueMetrics(
        int pending,
        int processing,
        int completed,
        int failed,
        int cancelled,
        boolean paused,
        int maxSize,
        int deferred,
        long totalEnqueued,
        long totalMerged,
        long totalCompleted,
        long totalFailed,
        long totalRetried,
        long totalReaped,
        long totalCancelled,
        long totalRejected,
        long totalDeferred,
        long totalDropped,
        Instant lastRejectedAt,
        long averageDurationMs,
        Long oldestPendingAgeMs,
        Long oldestEligiblePendingAgeMs,
        List<JobSummaryDTO> processingJobs,
        List<JobFailure> recentFailures
) {

    /** Share of finished runs that ended in FAILED; 0 before anything finished. */
    public double failureRate() {
        long finished = totalCompleted + totalFailed;
        return finished == 0 ? 0.0 : (double) totalFailed / finished;
    }

    public long finishedJobs() {
        return totalCompleted + totalFailed;
    }

    /** No room for another job. */
    public boolean atCapacity() {
        return pending + processing >= maxSize;
    }
}
