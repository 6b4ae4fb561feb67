package com.motionflow.orchestrator.tier;

import com.motionflow.orchestrator.model.ExecutionTier;
import com.motionflow.orchestrator.model.PricingTier;
import org.springframework.stereotype.Component;

/**
 * Picks the tier an order actually runs at.
 *
 * A motion type carries a minimum complexity tier and the customer pays for
 * a tier; the order runs at whichever is higher. Pricing tier D has no
 * execution counterpart of its own and runs with the C policy.
 */
@Component
public class TierResolver {

    public PricingTier resolveEffectiveTier(PricingTier motionTypeTier, PricingTier paidTier) {
        requireBoth(motionTypeTier, paidTier);
        return motionTypeTier.rank() >= paidTier.rank() ? motionTypeTier : paidTier;
    }

    public ExecutionTier resolveEffectiveTier(ExecutionTier motionTypeTier, ExecutionTier paidTier) {
        requireBoth(motionTypeTier, paidTier);
        return motionTypeTier.ordinal() >= paidTier.ordinal() ? motionTypeTier : paidTier;
    }

    public ExecutionTier toExecutionTier(PricingTier tier) {
        if (tier == null) throw new IllegalArgumentException("pricing tier must not be null");
        return switch (tier) {
            case A -> ExecutionTier.A;
            case B -> ExecutionTier.B;
            case C, D -> ExecutionTier.C;
        };
    }

    private static void requireBoth(Object a, Object b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("both tiers are required (got " + a + ", " + b + ")");
        }
    }
}
