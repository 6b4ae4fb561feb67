package com.motionflow.orchestrator.service;

import com.motionflow.orchestrator.model.MotionOrder;
import com.motionflow.orchestrator.model.PhaseCode;
import com.motionflow.orchestrator.model.PhaseExecution;
import com.motionflow.orchestrator.model.PhaseExecutionStatus;
import com.motionflow.orchestrator.repository.PhaseExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Queue operations on phase_executions: enqueue, claim, finish, retry, recover.
 *
 * The table is the work queue; claiming uses SELECT FOR UPDATE SKIP LOCKED
 * so several worker threads (or pods) never take the same row.
 */
@Service
public class PhaseExecutionService {

    private static final Logger log = LoggerFactory.getLogger(PhaseExecutionService.class);

    public static final int MAX_ATTEMPTS = 3;
    static final Duration STALL_TIMEOUT = Duration.ofMinutes(5);

    // Well inside STALL_TIMEOUT so one late beat never trips the sweep.
    static final Duration HEARTBEAT_INTERVAL = Duration.ofMinutes(1);

    private final PhaseExecutionRepository execRepo;

    public PhaseExecutionService(PhaseExecutionRepository execRepo) {
        this.execRepo = execRepo;
    }

    @Transactional
    public PhaseExecution enqueue(MotionOrder order, PhaseCode phase, int revisionCycle) {
        PhaseExecution exec = execRepo.save(new PhaseExecution(order, phase, revisionCycle));
        log.info("Enqueued phase {} for order {} (cycle {})", phase, order.getId(), revisionCycle);
        return exec;
    }

    // ------------------------------------------------------------------
    // Claiming (scheduler thread)
    // ------------------------------------------------------------------

    @Transactional
    public Optional<PhaseExecution> claimNext(String workerId) {
        Optional<PhaseExecution> opt = execRepo.claimNextPending();
        opt.ifPresent(exec -> {
            Instant now = Instant.now();
            exec.setStatus(PhaseExecutionStatus.IN_PROGRESS);
            exec.setWorkerId(workerId);
            exec.setStartedAt(now);
            exec.setHeartbeatAt(now);
            execRepo.save(exec);
            log.info("Worker '{}' claimed execution {} (order={}, phase={}, attempt={})",
                    workerId, exec.getId(), exec.getOrder().getId(), exec.getPhaseCode(), exec.getAttempt());
        });
        return opt;
    }

    // ------------------------------------------------------------------
    // Outcomes (worker thread)
    // ------------------------------------------------------------------

    @Transactional
    public void complete(PhaseExecution exec, String output, BigDecimal qualityScore, String citationSummary) {
        exec.setStatus(PhaseExecutionStatus.COMPLETED);
        exec.setFinishedAt(Instant.now());
        exec.setOutputText(output);
        exec.setQualityScore(qualityScore);
        exec.setCitationSummary(citationSummary);
        exec.setErrorMessage(null);
        execRepo.save(exec);
    }

    /**
     * Record a failed attempt. Below {@link #MAX_ATTEMPTS} the row goes back to
     * PENDING for another worker.
     *
     * @return true when a retry was scheduled, false when attempts are exhausted
     */
    @Transactional
    public boolean fail(PhaseExecution exec, String reason) {
        exec.incrementAttempt();
        exec.setWorkerId(null);
        exec.setErrorMessage(reason);

        if (exec.getAttempt() < MAX_ATTEMPTS) {
            exec.setStatus(PhaseExecutionStatus.PENDING);
            exec.setStartedAt(null);
            exec.setFinishedAt(null);
            execRepo.save(exec);
            log.warn("Execution {} failed (attempt {}/{}), will retry. Reason: {}",
                    exec.getId(), exec.getAttempt(), MAX_ATTEMPTS, reason);
            return true;
        }
        exec.setStatus(PhaseExecutionStatus.FAILED);
        exec.setFinishedAt(Instant.now());
        execRepo.save(exec);
        log.error("Execution {} permanently failed after {} attempts: {}", exec.getId(), MAX_ATTEMPTS, reason);
        return false;
    }

    /** Park the execution; the order left PROCESSING and will re-enqueue on resume. */
    @Transactional
    public void block(PhaseExecution exec, String reason) {
        finishAs(exec, PhaseExecutionStatus.BLOCKED, reason);
    }

    /** Output was produced but could not be applied to the order automatically. */
    @Transactional
    public void requireReview(PhaseExecution exec, String reason) {
        finishAs(exec, PhaseExecutionStatus.REQUIRES_REVIEW, reason);
    }

    /**
     * Keep a running execution out of the stall sweep. Called periodically
     * by {@link ExecutionHeartbeat} while the model call is in flight.
     *
     * @return false once the row is no longer IN_PROGRESS
     */
    @Transactional
    public boolean heartbeat(UUID executionId) {
        return execRepo.touchHeartbeat(executionId, Instant.now()) == 1;
    }

    /** Re-queue IN_PROGRESS executions whose worker stopped heartbeating. */
    @Transactional
    public int recoverStalled() {
        Instant cutoff = Instant.now().minus(STALL_TIMEOUT);
        List<PhaseExecution> stalled = execRepo.findByStatusAndHeartbeatAtBefore(PhaseExecutionStatus.IN_PROGRESS, cutoff);
        for (PhaseExecution exec : stalled) {
            log.warn("Recovering stalled execution {} (worker={}, last heartbeat={})",
                    exec.getId(), exec.getWorkerId(), exec.getHeartbeatAt());
            fail(exec, "Worker heartbeat timed out after " + STALL_TIMEOUT.toMinutes() + " minutes");
        }
        return stalled.size();
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public List<PhaseExecution> forOrder(UUID orderId) {
        return execRepo.findByOrderIdOrderByCreatedAtAsc(orderId);
    }

    /** Whether the order already has work queued or running. */
    @Transactional(readOnly = true)
    public boolean hasOpenWork(UUID orderId) {
        return !execRepo.findByOrderIdAndStatus(orderId, PhaseExecutionStatus.PENDING).isEmpty()
            || !execRepo.findByOrderIdAndStatus(orderId, PhaseExecutionStatus.IN_PROGRESS).isEmpty();
    }

    /**
     * Latest completed output per phase, in pipeline order. After a revision
     * loop only the newest draft and grade are visible to later phases.
     */
    @Transactional(readOnly = true)
    public Map<PhaseCode, String> completedOutputs(UUID orderId) {
        Map<PhaseCode, String> latest = new EnumMap<>(PhaseCode.class);
        for (PhaseExecution e : execRepo.findByOrderIdOrderByCreatedAtAsc(orderId)) {
            if (e.getStatus() == PhaseExecutionStatus.COMPLETED && e.getOutputText() != null) {
                latest.put(e.phase(), e.getOutputText());
            }
        }
        return new LinkedHashMap<>(latest);
    }

    private void finishAs(PhaseExecution exec, PhaseExecutionStatus status, String reason) {
        exec.setStatus(status);
        exec.setFinishedAt(Instant.now());
        exec.setWorkerId(null);
        exec.setErrorMessage(reason);
        execRepo.save(exec);
        log.info("Execution {} -> {}: {}", exec.getId(), status, reason);
    }
}
