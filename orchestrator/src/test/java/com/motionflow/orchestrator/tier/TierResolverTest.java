package com.motionflow.orchestrator.tier;

import com.motionflow.orchestrator.model.ExecutionTier;
import com.motionflow.orchestrator.model.PricingTier;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TierResolverTest {

    private final TierResolver resolver = new TierResolver();

    @Test
    void effectiveTier_isTheHigherOfTheTwo() {
        assertThat(resolver.resolveEffectiveTier(PricingTier.C, PricingTier.A)).isEqualTo(PricingTier.C);
        assertThat(resolver.resolveEffectiveTier(PricingTier.A, PricingTier.D)).isEqualTo(PricingTier.D);
        assertThat(resolver.resolveEffectiveTier(PricingTier.B, PricingTier.B)).isEqualTo(PricingTier.B);
    }

    @Test
    void effectiveTier_executionOverload() {
        assertThat(resolver.resolveEffectiveTier(ExecutionTier.A, ExecutionTier.C)).isEqualTo(ExecutionTier.C);
    }

    @Test
    void effectiveTier_missingInput_rejected() {
        assertThatThrownBy(() -> resolver.resolveEffectiveTier(PricingTier.A, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pricingTierD_runsOnExecutionTierC() {
        assertThat(resolver.toExecutionTier(PricingTier.D)).isEqualTo(ExecutionTier.C);
        assertThat(resolver.toExecutionTier(PricingTier.A)).isEqualTo(ExecutionTier.A);
    }
}
