package com.chambua.standings.service;

import com.chambua.standings.config.StandingsProperties;
import com.chambua.standings.dto.HealthReport;
import com.chambua.standings.queue.CalculationJobQueue;
import com.chambua.standings.queue.CalculationWorkerPool;
import com.chambua.standings.queue.QueueMetrics;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only classification of the automation's state. A full queue, or one that turned work away recently, is
 * UNHEALTHY; parked requests alone make it DEGRADED.
 */
@Service
public class StandingsHealthReporter {

    private final CalculationJobQueue queue;
    private final CalculationWorkerPool workerPool;
    private final StandingsProperties.Health thresholds;
    private final Clock clock;

    public StandingsHealthReporter(CalculationJobQueue queue, CalculationWorkerPool workerPool,
                                   StandingsProperties properties, Clock clock) {
        this.queue = queue;
        this.workerPool = workerPool;
        this.thresholds = properties.getHealth();
        this.thresholds.validate(properties.getQueue().getMaxSize());
        this.clock = clock;
    }

    public HealthReport report() {
        QueueMetrics m = queue.metrics();
        List<String> critical = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        Instant now = clock.instant();
        if (m.atCapacity()) {
            critical.add("Queue at capacity with " + (m.pending() + m.processing()) + " of " + m.maxSize() + " active jobs");
        }
        if (m.lastRejectedAt() != null
                && Duration.between(m.lastRejectedAt(), now).toMillis() <= thresholds.getRecentRejectionMs()) {
            critical.add("Queue turned away " + m.totalRejected() + " requests, last "
                    + Duration.between(m.lastRejectedAt(), now).toSeconds() + "s ago");
        }
        if (m.deferred() > 0) {
            warnings.add(m.deferred() + " recalculation requests deferred until the queue has room");
        }
        if (m.pending() >= thresholds.getPendingUnhealthy()) {
            critical.add("Queue backlog of " + m.pending() + " pending jobs (limit " + thresholds.getPendingUnhealthy() + ")");
        } else if (m.pending() >= thresholds.getPendingDegraded()) {
            warnings.add("Queue backlog of " + m.pending() + " pending jobs");
        }
        if (m.finishedJobs() >= thresholds.getMinSampleSize() && m.failureRate() >= thresholds.getFailureRateUnhealthy()) {
            critical.add(String.format("Failure rate %.0f%% over %d finished jobs", m.failureRate() * 100, m.finishedJobs()));
        }
        if (!m.paused() && m.oldestEligiblePendingAgeMs() != null
                && m.oldestEligiblePendingAgeMs() > thresholds.getStalePendingMs()) {
            critical.add("A pending job has waited " + m.oldestEligiblePendingAgeMs() / 1000 + "s without a worker");
        }
        if (m.failed() >= thresholds.getFailedDegraded()) {
            warnings.add(m.failed() + " failed jobs awaiting attention");
        }
        if (m.paused()) {
            warnings.add("Automation is paused");
        }

        HealthReport.Status status = !critical.isEmpty() ? HealthReport.Status.UNHEALTHY
                : !warnings.isEmpty() ? HealthReport.Status.DEGRADED
                : HealthReport.Status.HEALTHY;
        List<String> issues = new ArrayList<>(critical);
        issues.addAll(warnings);

        return new HealthReport(status, metricsOf(m), issues, m.processingJobs(), m.recentFailures(), now);
    }

    private Map<String, Object> metricsOf(QueueMetrics m) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("pendingJobs", m.pending());
        metrics.put("processingJobs", m.processing());
        metrics.put("completedJobs", m.completed());
        metrics.put("failedJobs", m.failed());
        metrics.put("cancelledJobs", m.cancelled());
        metrics.put("paused", m.paused());
        metrics.put("totalEnqueued", m.totalEnqueued());
        metrics.put("totalMerged", m.totalMerged());
        metrics.put("totalCompleted", m.totalCompleted());
        metrics.put("totalFailed", m.totalFailed());
        metrics.put("totalRetried", m.totalRetried());
        metrics.put("totalReaped", m.totalReaped());
        metrics.put("totalCancelled", m.totalCancelled());
        metrics.put("deferredRequests", m.deferred());
        metrics.put("totalRejected", m.totalRejected());
        metrics.put("totalDeferred", m.totalDeferred());
        metrics.put("totalDropped", m.totalDropped());
        metrics.put("maxQueueSize", m.maxSize());
        metrics.put("failureRate", m.failureRate());
        metrics.put("averageDurationMs", m.averageDurationMs());
        metrics.put("oldestPendingAgeMs", m.oldestPendingAgeMs());
        metrics.put("activeWorkers", workerPool.activeWorkers());
        metrics.put("workerPoolSize", workerPool.size());
        return metrics;
    }
}
