package com.motionflow.orchestrator.api.dto;

import com.motionflow.orchestrator.model.PricingTier;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/** {@code newTier} null keeps the order on its current tier. */
public record ResolveUpgradeRequest(@NotNull @Positive Long expectedVersion, PricingTier newTier) {}
