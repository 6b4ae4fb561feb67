package com.motionflow.orchestrator.repository;

import com.motionflow.orchestrator.model.CostEntry;
import com.motionflow.orchestrator.model.CostSource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Insert + aggregate queries for the cost ledger. Nothing here updates or deletes.
 */
public interface CostEntryRepository extends JpaRepository<CostEntry, UUID> {

    List<CostEntry> findByOrderIdOrderByCreatedAtAsc(UUID orderId);

    @Query("SELECT COALESCE(SUM(c.totalCostCents), 0) FROM CostEntry c WHERE c.orderId = :orderId")
    BigDecimal sumByOrder(@Param("orderId") UUID orderId);

    @Query("""
            SELECT COALESCE(SUM(c.totalCostCents), 0) FROM CostEntry c
            WHERE c.orderId = :orderId AND c.source = :source
            """)
    BigDecimal sumByOrderAndSource(@Param("orderId") UUID orderId,
                                   @Param("source") CostSource source);

    @Query("""
            SELECT COALESCE(SUM(c.totalCostCents), 0) FROM CostEntry c
            WHERE c.orderId = :orderId AND c.source = :source AND c.revisionCycle = :cycle
            """)
    BigDecimal sumByOrderSourceAndCycle(@Param("orderId") UUID orderId,
                                        @Param("source") CostSource source,
                                        @Param("cycle") int cycle);
}
