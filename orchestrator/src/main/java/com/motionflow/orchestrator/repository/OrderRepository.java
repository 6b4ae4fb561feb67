package com.motionflow.orchestrator.repository;

import com.motionflow.orchestrator.model.ExecutionTier;
import com.motionflow.orchestrator.model.MotionOrder;
import com.motionflow.orchestrator.model.OrderStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + the compare-and-set write for the orders table.
 */
public interface OrderRepository extends JpaRepository<MotionOrder, UUID> {

    Optional<MotionOrder> findByOrderNumber(String orderNumber);

    /** Orders currently in a given status (hold sweep, capacity resume, monitoring). */
    List<MotionOrder> findByStatus(OrderStatus status);

    /**
     * The single conditional write behind every lifecycle change.
     *
     * One UPDATE statement: the row only changes when status_version still
     * equals the version the caller observed, and the version is bumped in the
     * same statement. Returns the number of rows updated, so 0 means another
     * writer got there first (or the order does not exist).
     *
     * Every mutable lifecycle column is written; the caller passes the current
     * values for fields it does not mean to change.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            UPDATE MotionOrder o SET
                o.status            = :status,
                o.currentPhase      = :currentPhase,
                o.tier              = :tier,
                o.holdReason        = :holdReason,
                o.holdTriggeredAt   = :holdTriggeredAt,
                o.holdExpiresAt     = :holdExpiresAt,
                o.revisionCount     = :revisionCount,
                o.costCapTriggered  = :costCapTriggered,
                o.deliverableReady  = :deliverableReady,
                o.statusVersion     = o.statusVersion + 1,
                o.updatedAt         = :now
            WHERE o.id = :id AND o.statusVersion = :expectedVersion
            """)
    int compareAndSet(@Param("id") UUID id,
                      @Param("expectedVersion") long expectedVersion,
                      @Param("status") OrderStatus status,
                      @Param("currentPhase") String currentPhase,
                      @Param("tier") ExecutionTier tier,
                      @Param("holdReason") String holdReason,
                      @Param("holdTriggeredAt") Instant holdTriggeredAt,
                      @Param("holdExpiresAt") Instant holdExpiresAt,
                      @Param("revisionCount") int revisionCount,
                      @Param("costCapTriggered") boolean costCapTriggered,
                      @Param("deliverableReady") boolean deliverableReady,
                      @Param("now") Instant now);
}
