package com.motionflow.orchestrator.cost;

import com.motionflow.orchestrator.model.CostEntry;
import com.motionflow.orchestrator.model.CostSource;
import com.motionflow.orchestrator.model.ExecutionTier;
import com.motionflow.orchestrator.repository.CostEntryRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only ledger of model-call spend.
 *
 * A bad tier never blocks a write: the row is stored under the UNKNOWN
 * sentinel and an alert event goes out after the insert.
 */
@Service
public class CostTracker {

    private static final Logger log = LoggerFactory.getLogger(CostTracker.class);

    private final CostEntryRepository       costRepo;
    private final ModelPricing              pricing;
    private final ApplicationEventPublisher events;
    private final MeterRegistry             meters;

    public CostTracker(CostEntryRepository costRepo,
                       ModelPricing pricing,
                       ApplicationEventPublisher events,
                       MeterRegistry meters) {
        this.costRepo = costRepo;
        this.pricing  = pricing;
        this.events   = events;
        this.meters   = meters;
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    @Transactional
    public CostEntry record(CostRecordRequest req) {
        if (req.orderId() == null) throw new IllegalArgumentException("orderId is required");
        if (req.source() == null)  throw new IllegalArgumentException("source is required");

        Optional<ExecutionTier> tier = ExecutionTier.fromCode(req.tier());
        String storedTier = tier.map(Enum::name).orElse(CostEntry.UNKNOWN_TIER);
        BigDecimal cost = pricing.costCents(req.model(), req.inputTokens(), req.outputTokens());

        CostEntry entry = costRepo.save(new CostEntry(
                req.orderId(), req.phaseCode(), req.model(), storedTier,
                req.inputTokens(), req.outputTokens(), cost,
                req.source(), req.attempt(), req.revisionCycle(), req.metadata()));

        meters.counter("motionflow.cost.recorded", "tier", storedTier, "source", req.source().name())
                .increment();
        log.debug("Recorded {} cents for order {} phase {} ({} in / {} out, {} attempt {})",
                cost.toPlainString(), req.orderId(), req.phaseCode(),
                req.inputTokens(), req.outputTokens(), req.source(), req.attempt());

        if (tier.isEmpty()) {
            events.publishEvent(new UnknownTierRecordedEvent(
                    entry.getId(), req.orderId(), req.phaseCode(), req.tier()));
        }
        return entry;
    }

    // ------------------------------------------------------------------
    // Aggregates
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public BigDecimal totalCost(UUID orderId) {
        return costRepo.sumByOrder(orderId);
    }

    @Transactional(readOnly = true)
    public CostBreakdown costBySource(UUID orderId) {
        BigDecimal primary = costRepo.sumByOrderAndSource(orderId, CostSource.PRIMARY);
        BigDecimal retry   = costRepo.sumByOrderAndSource(orderId, CostSource.RETRY);
        return breakdown(primary, retry);
    }

    @Transactional(readOnly = true)
    public CostBreakdown cycleCost(UUID orderId, int revisionCycle) {
        BigDecimal primary = costRepo.sumByOrderSourceAndCycle(orderId, CostSource.PRIMARY, revisionCycle);
        BigDecimal retry   = costRepo.sumByOrderSourceAndCycle(orderId, CostSource.RETRY, revisionCycle);
        return breakdown(primary, retry);
    }

    @Transactional(readOnly = true)
    public List<CostEntry> entries(UUID orderId) {
        return costRepo.findByOrderIdOrderByCreatedAtAsc(orderId);
    }

    static CostBreakdown breakdown(BigDecimal primary, BigDecimal retry) {
        Optional<BigDecimal> overhead = primary.signum() > 0
                ? Optional.of(retry.multiply(BigDecimal.valueOf(100)).divide(primary, 2, RoundingMode.HALF_UP))
                : Optional.empty();
        return new CostBreakdown(primary, retry, primary.add(retry), overhead);
    }
}
