package com.motionflow.orchestrator.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record ResolveConflictRequest(@NotNull @Positive Long expectedVersion, boolean cleared) {}
