package com.motionflow.orchestrator.model;

import java.util.Optional;

/**
 * Customer billing / motion complexity tier.
 *
 * Declaration order is complexity rank: A is the simplest, D the most complex.
 */
public enum PricingTier {
    A,
    B,
    C,
    D;

    public int rank() {
        return ordinal();
    }

    public static Optional<PricingTier> fromCode(String raw) {
        if (raw == null) return Optional.empty();
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
