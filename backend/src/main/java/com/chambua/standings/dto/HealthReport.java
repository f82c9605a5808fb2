package com.chambua.standings.dto;

import com.chambua.standings.queue.JobFailure;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class HealthReport {

    public enum Status {
        HEALTHY, DEGRADED, UNHEALTHY;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Status status;
    private final Map<String, Object> metrics;
    private final List<String> issues;
    private final List<JobSummaryDTO> processing;
    private final List<JobFailure> recentFailures;
    private final Instant checkedAt;

    public HealthReport(Status status, Map<String, Object> metrics, List<String> issues, List<JobSummaryDTO> processing,
                        List<JobFailure> recentFailures, Instant checkedAt) {
        this.status = status;
        this.metrics = metrics;
        this.issues = List.copyOf(issues);
        this.processing = List.copyOf(processing);
        this.recentFailures = List.copyOf(recentFailures);
        this.checkedAt = checkedAt;
    }

    public Status getStatus() { return status; }
    public Map<String, Object> getMetrics() { return metrics; }
    public List<String> getIssues() { return issues; }
    public List<JobSummaryDTO> getProcessing() { return processing; }
    public List<JobFailure> getRecentFailures() { return recentFailures; }
    public Instant getCheckedAt() { return checkedAt; }
}
