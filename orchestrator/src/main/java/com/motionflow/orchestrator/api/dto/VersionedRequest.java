package com.motionflow.orchestrator.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Body for commands that carry nothing but the order version the caller
 * last read (start, approve, resolve-hold, dispute, flag-upgrade, ...).
 */
public record VersionedRequest(@NotNull @Positive Long expectedVersion) {}
