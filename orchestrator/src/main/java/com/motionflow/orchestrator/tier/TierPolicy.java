package com.motionflow.orchestrator.tier;

import java.math.BigDecimal;

/**
 * Per-tier execution limits.
 *
 * @param maxRevisionLoops      how many VIII revision passes before a forced exit
 * @param perCycleCostCapCents  soft cap on PRIMARY spend within one revision cycle; the hard
 *                              cap is 1.5x this, applied to PRIMARY plus RETRY spend
 * @param qualityThreshold      minimum judge-simulation grade to pass
 * @param listPriceCents        price list entry for the matching pricing tier
 */
public record TierPolicy(int maxRevisionLoops,
                         long perCycleCostCapCents,
                         BigDecimal qualityThreshold,
                         long listPriceCents) {}
