package com.motionflow.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request body for POST /orders/{id}/refund-override.
 *
 * The justification rules (length, required on deviation) are enforced by
 * the refund calculator, so a 400 from there carries the precise reason.
 */
public record RefundOverrideRequest(@NotNull @Positive Long expectedVersion,
                                    @NotNull @PositiveOrZero Long actualAmountCents,
                                    String justification,
                                    @NotBlank String adminId) {}
