package com.chambua.standings.queue;

import com.chambua.standings.config.StandingsProperties;
import com.chambua.standings.service.RecalculationOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.Semaphore;
import java.util.function.Consumer;

/**
 * Moves claims from the queue onto the calculation executor, never more at once than there are workers.
 *
 * <p>A worker keeps its permit until its thread has left the task, including a task the reaper cancelled, so a
 * worker stuck in I/O still counts against the pool.
 */
@Component
public class CalculationWorkerPool {
    private static final Logger log = LoggerFactory.getLogger(CalculationWorkerPool.class);

    private final CalculationJobQueue queue;
    private final RecalculationOrchestrator orchestrator;
    private final Executor executor;
    private final Semaphore permits;
    private final int size;
    // keyed by claim token, so a re-issued claim for the same job never collides with the old one
    private final Map<Long, ClaimTask> running = new ConcurrentHashMap<>();

    @Autowired
    public CalculationWorkerPool(CalculationJobQueue queue,
                                 RecalculationOrchestrator orchestrator,
                                 ThreadPoolTaskExecutor standingsCalculationExecutor,
                                 StandingsProperties properties) {
        this(queue, orchestrator, (Executor) standingsCalculationExecutor, properties.getWorker().getPoolSize());
    }

    CalculationWorkerPool(CalculationJobQueue queue, RecalculationOrchestrator orchestrator, Executor executor, int size) {
        this.queue = queue;
        this.orchestrator = orchestrator;
        this.executor = executor;
        this.size = Math.max(1, size);
        this.permits = new Semaphore(this.size);
    }

    /**
     * Claims jobs while a worker is free and work is eligible. Called on a fixed delay and right after enqueue.
     *
     * @return number of claims handed to workers
     */
    @Scheduled(fixedDelayString = "${standings.worker.poll-interval-ms:500}")
    public int dispatch() {
        int started = 0;
        while (permits.tryAcquire()) {
            Optional<JobClaim> claim;
            try {
                claim = queue.dequeue();
            } catch (RuntimeException e) {
                permits.release();
                throw e;
            }
            if (claim.isEmpty()) {
                permits.release();
                break;
            }
            submit(claim.get());
            started++;
        }
        return started;
    }

    /**
     * Fails stuck jobs through the queue and interrupts the workers still holding them. Their permits come back
     * only when the interrupted threads return.
     */
    @Scheduled(fixedDelayString = "${standings.worker.stuck-check-interval-ms:5000}")
    public int reapStuckJobs() {
        List<JobClaim> reaped = queue.reapStuckJobs();
        for (JobClaim claim : reaped) {
            ClaimTask task = running.get(claim.claimToken());
            if (task != null) {
                task.cancel(true);
                log.warn("[Workers][Interrupt] jobId={} leagueId={} seasonId={}", claim.jobId(), claim.leagueId(), claim.seasonId());
            }
        }
        return reaped.size();
    }

    public int activeWorkers() {
        return running.size();
    }

    public int size() {
        return size;
    }

    private void submit(JobClaim claim) {
        ClaimTask task = new ClaimTask(claim, () -> orchestrator.execute(claim), this::finished, this::exited);
        running.put(claim.claimToken(), task);
        try {
            executor.execute(task);
        } catch (TaskRejectedException e) {
            running.remove(claim.claimToken(), task);
            permits.release();
            log.error("[Workers][Rejected] jobId={} error={}", claim.jobId(), e.getMessage());
            queue.fail(claim.jobId(), claim.claimToken(), "Worker pool rejected job: " + e.getMessage(), true);
        }
    }

    private void exited(ClaimTask task) {
        running.remove(task.claim.claimToken(), task);
        permits.release();
    }

    private void finished(ClaimTask task) {
        if (task.isCancelled()) {
            return;
        }
        try {
            task.get();
        } catch (ExecutionException e) {
            // the orchestrator reports its own failures; anything reaching here escaped it
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[Workers][Crash] jobId={} error={}", task.claim.jobId(), cause.toString(), cause);
            queue.fail(task.claim.jobId(), task.claim.claimToken(), "Worker crashed: " + cause, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (CancellationException e) {
            log.debug("[Workers] jobId={} cancelled", task.claim.jobId());
        }
    }

    private static final class ClaimTask extends FutureTask<Void> {
        private final JobClaim claim;
        private final Consumer<ClaimTask> onDone;
        private final Consumer<ClaimTask> onExit;

        ClaimTask(JobClaim claim, Runnable work, Consumer<ClaimTask> onDone, Consumer<ClaimTask> onExit) {
            super(work, null);
            this.claim = claim;
            this.onDone = onDone;
            this.onExit = onExit;
        }

        @Override
        public void run() {
            try {
                super.run();
            } finally {
                onExit.accept(this);
            }
        }

        // runs on the cancelling thread when reaped, while the worker may still be inside run()
        @Override
        protected void done() {
            onDone.accept(this);
        }
    }
}
