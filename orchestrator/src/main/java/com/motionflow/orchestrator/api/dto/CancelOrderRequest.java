package com.motionflow.orchestrator.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record CancelOrderRequest(@NotNull @Positive Long expectedVersion, String reason) {}
