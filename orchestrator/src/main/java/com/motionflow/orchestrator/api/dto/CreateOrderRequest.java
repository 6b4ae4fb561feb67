package com.motionflow.orchestrator.api.dto;

import com.motionflow.orchestrator.model.PricingTier;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request body for POST /orders.
 *
 * Required: motionType, customerEmail, motionTypeTier, paidTier
 * Optional: amountPaidCents (defaults to the list price of paidTier),
 *           separateStatementRequired (defaults to false)
 */
public record CreateOrderRequest(@NotBlank String motionType,
                                 @NotBlank @Email String customerEmail,
                                 @NotNull PricingTier motionTypeTier,
                                 @NotNull PricingTier paidTier,
                                 @PositiveOrZero Long amountPaidCents,
                                 boolean separateStatementRequired) {}
