package com.motionflow.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record FlagConflictRequest(@NotNull @Positive Long expectedVersion, @NotBlank String reason) {}
