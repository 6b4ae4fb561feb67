package com.motionflow.orchestrator.tier;

import com.motionflow.orchestrator.model.ExecutionTier;
import com.motionflow.orchestrator.model.PricingTier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Static tier table. Every tier shares the same quality bar; tiers differ in
 * how many revision loops and how much model spend they are allowed.
 */
@Component
public class TierConfiguration {

    public static final BigDecimal QUALITY_THRESHOLD = new BigDecimal("0.87");

    private static final Map<PricingTier, Long> LIST_PRICES;
    private static final Map<ExecutionTier, TierPolicy> POLICIES;

    static {
        Map<PricingTier, Long> prices = new EnumMap<>(PricingTier.class);
        prices.put(PricingTier.A, 29_900L);
        prices.put(PricingTier.B, 59_900L);
        prices.put(PricingTier.C, 99_900L);
        prices.put(PricingTier.D, 149_900L);
        LIST_PRICES = Collections.unmodifiableMap(prices);

        Map<ExecutionTier, TierPolicy> policies = new EnumMap<>(ExecutionTier.class);
        policies.put(ExecutionTier.A, new TierPolicy(2, 400,  QUALITY_THRESHOLD, 29_900L));
        policies.put(ExecutionTier.B, new TierPolicy(3, 800,  QUALITY_THRESHOLD, 59_900L));
        policies.put(ExecutionTier.C, new TierPolicy(4, 1200, QUALITY_THRESHOLD, 99_900L));
        POLICIES = Collections.unmodifiableMap(policies);
    }

    public TierPolicy policy(ExecutionTier tier) {
        if (tier == null) throw new IllegalArgumentException("tier must not be null");
        return POLICIES.get(tier);
    }

    public long listPriceCents(PricingTier tier) {
        if (tier == null) throw new IllegalArgumentException("tier must not be null");
        return LIST_PRICES.get(tier);
    }
}
