package com.chambua.standings.service;

import com.chambua.standings.config.FeatureFlags;
import com.chambua.standings.queue.CalculationJobQueue;
import com.chambua.standings.queue.CalculationWorkerPool;
import com.chambua.standings.queue.JobPriority;
import com.chambua.standings.repository.SeasonRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.Optional;

@Service
public class StandingsTriggerService {
    private static final Logger log = LoggerFactory.getLogger(StandingsTriggerService.class);

    private final CalculationJobQueue queue;
    private final CalculationWorkerPool workerPool;
    private final SeasonRepository seasonRepository;
    private final FeatureFlags featureFlags;

    public StandingsTriggerService(CalculationJobQueue queue, CalculationWorkerPool workerPool,
                                   SeasonRepository seasonRepository, FeatureFlags featureFlags) {
        this.queue = queue;
        this.workerPool = workerPool;
        this.seasonRepository = seasonRepository;
        this.featureFlags = featureFlags;
    }

    /**
     * Operator-initiated recalculation. Rejects a season that does not belong to the league.
     *
     * @return id of the new job, or of the active job the request was merged into
     */
    public String requestRecalculation(Long leagueId, Long seasonId, JobPriority priority, String trigger, String description) {
        if (leagueId == null || seasonId == null) {
            throw new IllegalArgumentException("leagueId and seasonId are required");
        }
        if (!seasonRepository.existsByIdAndLeague_Id(seasonId, leagueId)) {
            throw new IllegalArgumentException("Season " + seasonId + " does not belong to league " + leagueId);
        }
        String jobId = queue.enqueue(leagueId, seasonId, priority, trigger, description);
        workerPool.dispatch();
        return jobId;
    }

    /** Hands eligible jobs to free workers without waiting for the next poll. */
    public void dispatchNow() {
        workerPool.dispatch();
    }

    /**
     * Automatic trigger. Runs after the writing transaction commits so workers read the new result. When the queue
     * is full the request is parked in the queue and runs once capacity frees up.
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onMatchResultChanged(MatchResultChangedEvent event) {
        if (!featureFlags.isAutomaticCalculationEnabled()) {
            log.debug("[Trigger] automatic calculation disabled, ignoring leagueId={} seasonId={}", event.leagueId(), event.seasonId());
            return;
        }
        Optional<String> jobId = queue.enqueueOrDefer(event.leagueId(), event.seasonId(), JobPriority.HIGH, "match-result",
                "Match " + event.matchId() + " " + (event.reason() != null ? event.reason() : "changed"));
        if (jobId.isEmpty()) {
            log.warn("[Trigger][Deferred] matchId={} leagueId={} seasonId={} queue full, recalculation deferred",
                    event.matchId(), event.leagueId(), event.seasonId());
            return;
        }
        log.info("[Trigger] matchId={} leagueId={} seasonId={} jobId={}", event.matchId(), event.leagueId(), event.seasonId(), jobId.get());
        workerPool.dispatch();
    }
}
