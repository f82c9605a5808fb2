package com.chambua.standings.queue;

import java.time.Instant;

/**
 * Handed to a worker by {@link CalculationJobQueue#dequeue()}. The token identifies this particular claim;
 * reports made with an outdated token are ignored by the queue.
 */
public record JobClaim(String jobId, Long leagueId, Long seasonId, JobPriority priority, int attempt,
                       long claimToken, Instant claimedAt) {
}
