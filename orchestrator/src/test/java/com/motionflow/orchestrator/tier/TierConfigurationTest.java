package com.motionflow.orchestrator.tier;

import com.motionflow.orchestrator.model.ExecutionTier;
import com.motionflow.orchestrator.model.PricingTier;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class TierConfigurationTest {

    private final TierConfiguration tiers = new TierConfiguration();

    @Test
    void everyTier_sharesTheSameQualityThreshold() {
        for (ExecutionTier tier : ExecutionTier.values()) {
            assertThat(tiers.policy(tier).qualityThreshold()).isEqualByComparingTo(new BigDecimal("0.87"));
        }
    }

    @Test
    void policies_matchTierTable() {
        assertThat(tiers.policy(ExecutionTier.A).maxRevisionLoops()).isEqualTo(2);
        assertThat(tiers.policy(ExecutionTier.A).perCycleCostCapCents()).isEqualTo(400);
        assertThat(tiers.policy(ExecutionTier.B).maxRevisionLoops()).isEqualTo(3);
        assertThat(tiers.policy(ExecutionTier.C).perCycleCostCapCents()).isEqualTo(1200);
    }

    @Test
    void listPrices() {
        assertThat(tiers.listPriceCents(PricingTier.A)).isEqualTo(29_900L);
        assertThat(tiers.listPriceCents(PricingTier.D)).isEqualTo(149_900L);
    }
}
