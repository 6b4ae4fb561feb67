package com.motionflow.orchestrator.service;

import com.motionflow.orchestrator.model.PhaseExecution;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keeps an execution's heartbeat fresh while its worker is blocked on a
 * long model call, so the stall sweep only re-queues work whose worker
 * actually died.
 *
 * Usage:
 * <pre>
 *   try (ExecutionHeartbeat.Beat beat = heartbeat.start(exec)) {
 *       response = modelClient.complete(request);
 *   }
 * </pre>
 */
@Component
public class ExecutionHeartbeat {

    private static final Logger log = LoggerFactory.getLogger(ExecutionHeartbeat.class);

    private final PhaseExecutionService    executions;
    private final Duration                 interval;
    private final ScheduledExecutorService ticker;

    @Autowired
    public ExecutionHeartbeat(PhaseExecutionService executions) {
        this(executions, PhaseExecutionService.HEARTBEAT_INTERVAL);
    }

    ExecutionHeartbeat(PhaseExecutionService executions, Duration interval) {
        this.executions = executions;
        this.interval   = interval;
        this.ticker     = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "execution-heartbeat");
            t.setDaemon(true);
            return t;
        });
    }

    /** Start beating for the execution; closing the returned handle stops it. */
    public Beat start(PhaseExecution exec) {
        UUID id = exec.getId();
        ScheduledFuture<?> task = ticker.scheduleAtFixedRate(() -> beat(id),
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        return new Beat(task);
    }

    private void beat(UUID executionId) {
        try {
            if (!executions.heartbeat(executionId)) {
                log.warn("Heartbeat for execution {} found it no longer IN_PROGRESS", executionId);
            }
        } catch (RuntimeException e) {
            // A failed beat must not cancel the schedule; the next one may land.
            log.warn("Heartbeat for execution {} failed: {}", executionId, e.getMessage());
        }
    }

    @PreDestroy
    void shutdown() {
        ticker.shutdownNow();
    }

    public static final class Beat implements AutoCloseable {

        private final ScheduledFuture<?> task;

        private Beat(ScheduledFuture<?> task) {
            this.task = task;
        }

        @Override
        public void close() {
            task.cancel(false);
        }
    }
}
