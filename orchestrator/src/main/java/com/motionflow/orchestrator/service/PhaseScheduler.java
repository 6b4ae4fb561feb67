package com.motionflow.orchestrator.service;

import com.motionflow.orchestrator.model.PhaseExecution;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;

/**
 * Background loops that keep orders moving.
 *
 * The phase_executions table is the queue: each tick claims one PENDING row
 * with SELECT ... FOR UPDATE SKIP LOCKED and hands it to a fixed worker pool.
 * A semaphore keeps the scheduler from claiming rows no worker can take yet,
 * so unclaimed work stays visible to other instances.
 */
@Component
public class PhaseScheduler {

    private static final Logger log = LoggerFactory.getLogger(PhaseScheduler.class);

    private final PhaseExecutionService executions;
    private final PhaseDriver           driver;
    private final OrderWorkflowService  workflow;
    private final ExecutorService       workers;
    private final Semaphore             freeWorkers;
    private final Duration              holdSweepInterval;

    public PhaseScheduler(PhaseExecutionService executions,
                          PhaseDriver driver,
                          OrderWorkflowService workflow,
                          @Value("${motionflow.scheduler.workers:4}") int workerCount,
                          @Value("${motionflow.scheduler.hold-sweep-interval:PT15M}") Duration holdSweepInterval) {
        this.executions        = executions;
        this.driver            = driver;
        this.workflow          = workflow;
        this.workers           = Executors.newFixedThreadPool(workerCount);
        this.freeWorkers       = new Semaphore(workerCount);
        this.holdSweepInterval = holdSweepInterval;
    }

    // ------------------------------------------------------------------
    // Phase queue
    // ------------------------------------------------------------------

    @Scheduled(fixedDelayString = "${motionflow.scheduler.poll-interval:PT2S}")
    public void tick() {
        if (!freeWorkers.tryAcquire()) return;

        String workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);
        Optional<PhaseExecution> claimed;
        try {
            claimed = executions.claimNext(workerId);
        } catch (RuntimeException e) {
            freeWorkers.release();
            throw e;
        }
        if (claimed.isEmpty()) {
            freeWorkers.release();
            return;
        }

        PhaseExecution exec = claimed.get();
        workers.submit(() -> {
            try {
                driver.run(exec);
            } catch (Exception e) {
                log.error("Unhandled error running execution {} ({}): {}",
                        exec.getId(), exec.getPhaseCode(), e.getMessage(), e);
                executions.fail(exec, "Unhandled exception: " + e.getMessage());
            } finally {
                freeWorkers.release();
            }
        });
    }

    @Scheduled(fixedDelayString = "${motionflow.scheduler.stall-check-interval:PT1M}")
    public void recoverStalled() {
        int recovered = executions.recoverStalled();
        if (recovered > 0) log.warn("Re-queued {} stalled phase executions", recovered);
    }

    // ------------------------------------------------------------------
    // Order housekeeping
    // ------------------------------------------------------------------

    @Scheduled(fixedDelayString = "${motionflow.scheduler.hold-sweep-interval:PT15M}")
    public void sweepHolds() {
        int cancelled = workflow.sweepHolds(holdSweepInterval);
        if (cancelled > 0) log.info("Hold sweep auto-cancelled {} orders", cancelled);
    }

    @Scheduled(fixedDelayString = "${motionflow.scheduler.capacity-retry-interval:PT5M}")
    public void resumeCapacityWaits() {
        int resumed = workflow.resumeCapacityWaits();
        if (resumed > 0) log.info("Resumed {} orders waiting on model capacity", resumed);
    }

    @PreDestroy
    void shutdown() {
        workers.shutdown();
    }
}
