package com.motionflow.orchestrator.cost;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Converts token usage into cost in cents.
 *
 * Models are priced by family (the id contains "opus" or "sonnet"). An id of
 * neither family is priced at the Opus rate so spend is never understated.
 */
@Component
public class ModelPricing {

    private static final Logger log = LoggerFactory.getLogger(ModelPricing.class);

    private static final BigDecimal ONE_MILLION = BigDecimal.valueOf(1_000_000);
    private static final BigDecimal CENTS_PER_DOLLAR = BigDecimal.valueOf(100);
    static final int COST_SCALE = 4;

    private final PricingProperties prices;

    public ModelPricing(PricingProperties prices) {
        this.prices = prices;
    }

    public BigDecimal costCents(String model, long inputTokens, long outputTokens) {
        if (inputTokens < 0 || outputTokens < 0) {
            throw new IllegalArgumentException("token counts must not be negative");
        }
        PricingProperties.ModelPrice price = priceFor(model);
        BigDecimal dollars = price.inputPerMillion().multiply(BigDecimal.valueOf(inputTokens))
                .add(price.outputPerMillion().multiply(BigDecimal.valueOf(outputTokens)))
                .divide(ONE_MILLION, 10, RoundingMode.HALF_UP);
        return dollars.multiply(CENTS_PER_DOLLAR).setScale(COST_SCALE, RoundingMode.HALF_UP);
    }

    private PricingProperties.ModelPrice priceFor(String model) {
        String id = model == null ? "" : model.toLowerCase(Locale.ROOT);
        if (id.contains("sonnet")) return prices.sonnet();
        if (id.contains("opus"))   return prices.opus();
        log.warn("No price entry for model '{}', charging Opus rate", model);
        return prices.opus();
    }
}
