package com.motionflow.orchestrator.repository;

import com.motionflow.orchestrator.model.PhaseExecution;
import com.motionflow.orchestrator.model.PhaseExecutionStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + scheduler queries for the phase_executions table.
 */
public interface PhaseExecutionRepository extends JpaRepository<PhaseExecution, UUID> {

    /**
     * Claim the oldest PENDING execution.
     *
     * PESSIMISTIC_WRITE with lock timeout -2 renders as
     * SELECT ... FOR UPDATE SKIP LOCKED on PostgreSQL: a row another worker
     * already holds is skipped rather than waited on.
     *
     * Must run inside a @Transactional service method; the caller flips the
     * row to IN_PROGRESS before the transaction commits.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("""
            SELECT e FROM PhaseExecution e
            WHERE e.status = com.motionflow.orchestrator.model.PhaseExecutionStatus.PENDING
            ORDER BY e.createdAt ASC
            LIMIT 1
            """)
    Optional<PhaseExecution> claimNextPending();

    /** All executions for an order, in creation order. */
    List<PhaseExecution> findByOrderIdOrderByCreatedAtAsc(UUID orderId);

    /** Executions for an order in a given status (used to detect in-flight work). */
    List<PhaseExecution> findByOrderIdAndStatus(UUID orderId, PhaseExecutionStatus status);

    /** IN_PROGRESS executions whose heartbeat is older than the cutoff. */
    List<PhaseExecution> findByStatusAndHeartbeatAtBefore(PhaseExecutionStatus status, Instant cutoff);

    /**
     * Refresh the heartbeat of a running execution. Only the heartbeat column
     * is written, so a worker's in-memory copy of the row is never merged
     * over a concurrent outcome write. A row that already left IN_PROGRESS
     * is not touched.
     */
    @Modifying
    @Query("""
            UPDATE PhaseExecution e SET e.heartbeatAt = :now
            WHERE e.id = :id
              AND e.status = com.motionflow.orchestrator.model.PhaseExecutionStatus.IN_PROGRESS
            """)
    int touchHeartbeat(@Param("id") UUID id, @Param("now") Instant now);
}
