package com.motionflow.orchestrator.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/** {@code phase} is optional; without it the next straight-path phase is queued. */
public record AdvancePhaseRequest(@NotNull @Positive Long expectedVersion, String phase) {}
