package com.motionflow.orchestrator.model;

import java.util.Optional;

/**
 * Execution/cost tier used by the phase registry and the budget governor.
 *
 * Distinct from {@link PricingTier}: the customer-facing price list has four
 * tiers, execution has three. See {@code TierResolver#toExecutionTier}.
 */
public enum ExecutionTier {
    A,
    B,
    C;

    public static Optional<ExecutionTier> fromCode(String raw) {
        if (raw == null) return Optional.empty();
        return switch (raw.trim().toUpperCase()) {
            case "A" -> Optional.of(A);
            case "B" -> Optional.of(B);
            case "C" -> Optional.of(C);
            default  -> Optional.empty();
        };
    }
}
