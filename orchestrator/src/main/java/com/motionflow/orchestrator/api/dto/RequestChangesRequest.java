package com.motionflow.orchestrator.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record RequestChangesRequest(@NotNull @Positive Long expectedVersion,
                                    @Size(max = 5000) String notes) {}
