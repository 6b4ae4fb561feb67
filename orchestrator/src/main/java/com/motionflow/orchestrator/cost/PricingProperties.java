package com.motionflow.orchestrator.cost;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Per-model token prices in US dollars per million tokens, bound from
 * {@code motionflow.pricing.*}. Missing entries fall back to the published
 * list prices.
 */
@ConfigurationProperties(prefix = "motionflow.pricing")
public record PricingProperties(ModelPrice sonnet, ModelPrice opus) {

    public PricingProperties {
        if (sonnet == null) sonnet = new ModelPrice(new BigDecimal("3"), new BigDecimal("15"));
        if (opus == null)   opus   = new ModelPrice(new BigDecimal("5"), new BigDecimal("25"));
    }

    public static PricingProperties defaults() {
        return new PricingProperties(null, null);
    }

    public record ModelPrice(BigDecimal inputPerMillion, BigDecimal outputPerMillion) {}
}
