package com.motionflow.orchestrator.cost;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Order spend split by source. Amounts in cents.
 *
 * {@code retryOverheadPercent} is empty until some primary spend exists.
 */
public record CostBreakdown(BigDecimal primaryCents,
                            BigDecimal retryCents,
                            BigDecimal totalCents,
                            Optional<BigDecimal> retryOverheadPercent) {}
