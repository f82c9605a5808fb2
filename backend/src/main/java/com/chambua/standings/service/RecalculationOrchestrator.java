package com.chambua.standings.service;

import com.chambua.standings.config.FeatureFlags;
import com.chambua.standings.dto.LeagueTable;
import com.chambua.standings.exception.StaleClaimException;
import com.chambua.standings.exception.StandingsException;
import com.chambua.standings.queue.CalculationJobQueue;
import com.chambua.standings.queue.JobClaim;
import com.chambua.standings.snapshot.SnapshotService;
import com.chambua.standings.standings.MatchResult;
import com.chambua.standings.standings.StandingsCalculator;
import com.chambua.standings.standings.TableInvariants;
import com.chambua.standings.standings.TeamRef;
import com.chambua.standings.store.MatchStore;
import com.chambua.standings.store.TableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Runs one claimed job: snapshot, compute, verify, publish, report back to the queue.
 *
 * <p>The published table only changes in the publish step. When that step fails and the stored table no longer
 * matches what was there before the job, the earlier table is put back. Both writes are fenced on the claim: once
 * the reaper has handed the job to another worker, this one cannot change the table any more.
 */
@Service
public class RecalculationOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(RecalculationOrchestrator.class);

    static final String SNAPSHOT_CREATOR = "system:recalculation";

    private final MatchStore matchStore;
    private final TableStore tableStore;
    private final StandingsCalculator calculator;
    private final SnapshotService snapshotService;
    private final CalculationJobQueue queue;
    private final FeatureFlags featureFlags;

    public RecalculationOrchestrator(MatchStore matchStore, TableStore tableStore, StandingsCalculator calculator,
                                     SnapshotService snapshotService, CalculationJobQueue queue, FeatureFlags featureFlags) {
        this.matchStore = matchStore;
        this.tableStore = tableStore;
        this.calculator = calculator;
        this.snapshotService = snapshotService;
        this.queue = queue;
        this.featureFlags = featureFlags;
    }

    public void execute(JobClaim claim) {
        long t0 = System.currentTimeMillis();
        Long leagueId = claim.leagueId();
        Long seasonId = claim.seasonId();
        LeagueTable before = null;
        Long snapshotId = null;
        boolean publishAttempted = false;
        BooleanSupplier stillCurrent = () -> queue.isCurrentClaim(claim.jobId(), claim.claimToken());
        log.info("[Orchestrator][Start] jobId={} leagueId={} seasonId={} attempt={}", claim.jobId(), leagueId, seasonId, claim.attempt());
        try {
            List<MatchResult> matches = matchStore.listFinishedMatches(leagueId, seasonId);
            List<TeamRef> teams = matchStore.listTeams(leagueId, seasonId);
            before = tableStore.getCurrentTable(leagueId, seasonId);

            if (!before.isEmpty() && featureFlags.isSnapshotCreationEnabled()) {
                snapshotId = snapshotService.snapshot(leagueId, seasonId,
                        "Before recalculation job " + claim.jobId(), SNAPSHOT_CREATOR);
            }

            LeagueTable computed = calculator.compute(leagueId, seasonId, matches, teams);
            TableInvariants.verify(computed);

            if (Thread.currentThread().isInterrupted()) {
                log.warn("[Orchestrator][Interrupted] jobId={} not publishing", claim.jobId());
                queue.fail(claim.jobId(), claim.claimToken(), "Interrupted before publishing", true);
                return;
            }

            if (!queue.beginPublish(claim.jobId(), claim.claimToken())) {
                log.warn("[Orchestrator][Stale] jobId={} claim reaped before publishing, result discarded", claim.jobId());
                return;
            }
            publishAttempted = true;
            int written = tableStore.replaceTable(leagueId, seasonId, computed, TableStore.SOURCE_CALCULATION, stillCurrent);
            boolean accepted = queue.complete(claim.jobId(), claim.claimToken());
            log.info("[Orchestrator][Done] jobId={} leagueId={} seasonId={} matches={} teams={} written={} snapshotId={} accepted={} tookMs={}",
                    claim.jobId(), leagueId, seasonId, matches.size(), teams.size(), written, snapshotId, accepted,
                    System.currentTimeMillis() - t0);
        } catch (StaleClaimException e) {
            log.warn("[Orchestrator][Stale] jobId={} leagueId={} seasonId={} write fenced off, table belongs to the current claim",
                    claim.jobId(), leagueId, seasonId);
        } catch (StandingsException e) {
            String recovery = publishAttempted ? restore(claim, before, snapshotId, stillCurrent) : "";
            log.warn("[Orchestrator][Failed] jobId={} code={} category={} retryable={} error={}",
                    claim.jobId(), e.getCode(), e.getCategory(), e.isRetryable(), e.getMessage());
            queue.fail(claim.jobId(), claim.claimToken(), e.getCode() + ": " + e.getMessage() + recovery, e.isRetryable());
        } catch (RuntimeException e) {
            String recovery = publishAttempted ? restore(claim, before, snapshotId, stillCurrent) : "";
            log.error("[Orchestrator][Failed] jobId={} unexpected error", claim.jobId(), e);
            queue.fail(claim.jobId(), claim.claimToken(), e.getClass().getSimpleName() + ": " + e.getMessage() + recovery, true);
        }
    }

    /**
     * Puts the pre-job table back if a failed publish left something else behind. Returns a note for the job
     * error text.
     */
    private String restore(JobClaim claim, LeagueTable before, Long snapshotId, BooleanSupplier stillCurrent) {
        Long leagueId = claim.leagueId();
        Long seasonId = claim.seasonId();
        if (!stillCurrent.getAsBoolean()) {
            log.warn("[Orchestrator][Restore] jobId={} claim no longer current, leaving the table to the new claim", claim.jobId());
            return " (restore skipped, claim no longer current)";
        }
        try {
            LeagueTable current = tableStore.getCurrentTable(leagueId, seasonId);
            if (current.equals(before)) {
                return "";
            }
            if (snapshotId != null) {
                int restored = snapshotService.rollback(snapshotId);
                log.warn("[Orchestrator][Restore] jobId={} rolled back to snapshotId={} entries={}", claim.jobId(), snapshotId, restored);
                return " (table restored from snapshot " + snapshotId + ")";
            }
            tableStore.replaceTable(leagueId, seasonId, before, "restore:" + claim.jobId(), stillCurrent);
            log.warn("[Orchestrator][Restore] jobId={} restored pre-job table entries={}", claim.jobId(), before.size());
            return " (pre-job table restored)";
        } catch (RuntimeException e) {
            log.error("[Orchestrator][RestoreFailed] jobId={} leagueId={} seasonId={} snapshotId={}",
                    claim.jobId(), leagueId, seasonId, snapshotId, e);
            return " (restore failed: " + e.getMessage() + ")";
        }
    }
}
