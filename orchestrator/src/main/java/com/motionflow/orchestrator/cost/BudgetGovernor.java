package com.motionflow.orchestrator.cost;

import com.motionflow.orchestrator.model.ExecutionTier;
import com.motionflow.orchestrator.model.MotionOrder;
import com.motionflow.orchestrator.tier.TierConfiguration;
import com.motionflow.orchestrator.tier.TierPolicy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Spend limits per revision cycle and per order.
 *
 *   soft  : cycle PRIMARY spend <= perCycleCap           (flag only)
 *   hard  : cycle PRIMARY + RETRY spend <= perCycleCap x 1.5
 *   order : lifetime spend <= perCycleCap x maxRevisionLoops x 1.5
 *
 * Only the hard and order limits stop work, and only through
 * {@link #checkAfterWrite}, which the phase driver calls right after every
 * ledger insert.
 */
@Component
public class BudgetGovernor {

    private static final Logger log = LoggerFactory.getLogger(BudgetGovernor.class);

    static final BigDecimal HARD_CAP_MULTIPLIER = new BigDecimal("1.5");

    private final CostTracker       costTracker;
    private final TierConfiguration tiers;
    private final Counter           softBreaches;

    public BudgetGovernor(CostTracker costTracker, TierConfiguration tiers, MeterRegistry meters) {
        this.costTracker  = costTracker;
        this.tiers        = tiers;
        this.softBreaches = Counter.builder("motionflow.budget.soft_breach")
                .description("Revision cycles whose primary spend passed the per-cycle cap")
                .register(meters);
    }

    /** Pure evaluation of one cycle's spend against a tier policy. */
    public BudgetCheck checkBudgetEnforcement(BigDecimal primaryCents, BigDecimal retryCents, TierPolicy policy) {
        BigDecimal softCap = BigDecimal.valueOf(policy.perCycleCostCapCents());
        BigDecimal hardCap = softCap.multiply(HARD_CAP_MULTIPLIER);
        BigDecimal total   = primaryCents.add(retryCents);
        return new BudgetCheck(
                primaryCents.compareTo(softCap) <= 0,
                total.compareTo(hardCap) <= 0,
                primaryCents, total, softCap, hardCap);
    }

    /** Evaluate the order's active revision cycle from the ledger. */
    public BudgetCheck checkBudgetEnforcement(MotionOrder order) {
        CostBreakdown cycle = costTracker.cycleCost(order.getId(), order.getRevisionCount());
        return checkBudgetEnforcement(cycle.primaryCents(), cycle.retryCents(), tiers.policy(order.getTier()));
    }

    public BigDecimal orderCostCeiling(ExecutionTier tier) {
        TierPolicy policy = tiers.policy(tier);
        return BigDecimal.valueOf(policy.perCycleCostCapCents())
                .multiply(BigDecimal.valueOf(policy.maxRevisionLoops()))
                .multiply(HARD_CAP_MULTIPLIER);
    }

    /**
     * Enforce the hard limits after a cost write.
     *
     * @throws BudgetExceededException when the cycle hard cap or the order
     *         ceiling has been passed
     */
    public BudgetCheck checkAfterWrite(MotionOrder order) {
        BudgetCheck cycle = checkBudgetEnforcement(order);
        if (!cycle.totalOk()) {
            throw new BudgetExceededException(order.getId(), "cycle", cycle.totalCents(), cycle.hardCapCents());
        }
        BigDecimal lifetime = costTracker.totalCost(order.getId());
        BigDecimal ceiling  = orderCostCeiling(order.getTier());
        if (lifetime.compareTo(ceiling) > 0) {
            throw new BudgetExceededException(order.getId(), "order", lifetime, ceiling);
        }
        if (!cycle.primaryOk()) {
            softBreaches.increment();
            log.warn("Order {} cycle {} primary spend {} cents is over the {} cent soft cap",
                    order.getId(), order.getRevisionCount(),
                    cycle.primaryCents().toPlainString(), cycle.softCapCents().toPlainString());
        }
        return cycle;
    }
}
