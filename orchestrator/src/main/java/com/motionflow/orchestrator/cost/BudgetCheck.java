package com.motionflow.orchestrator.cost;

import java.math.BigDecimal;

/**
 * Result of a per-cycle budget evaluation. Amounts in cents.
 *
 * @param primaryOk  primary spend is within the per-cycle cap (soft limit)
 * @param totalOk    primary + retry spend is within cap x 1.5 (hard limit)
 */
public record BudgetCheck(boolean primaryOk,
                          boolean totalOk,
                          BigDecimal primaryCents,
                          BigDecimal totalCents,
                          BigDecimal softCapCents,
                          BigDecimal hardCapCents) {}
