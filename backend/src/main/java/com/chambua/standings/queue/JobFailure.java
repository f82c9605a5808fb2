package com.chambua.standings.queue;

import java.time.Instant;

/**
 * A job that ran out of attempts or failed with a non-retryable error. A recalculation request dropped before it
 * became a job has no {@code jobId}.
 */
public record JobFailure(String jobId, Long leagueId, Long seasonId, int attempts, String error, Instant failedAt) {
}
