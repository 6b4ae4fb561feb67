package com.motionflow.orchestrator.api.dto;

import com.motionflow.orchestrator.model.MotionOrder;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for order endpoints. {@code statusVersion} is what the
 * caller sends back as {@code expectedVersion} on its next command.
 */
public record OrderResponse(
        UUID    id,
        String  orderNumber,
        String  motionType,
        String  status,
        long    statusVersion,
        String  tier,
        String  pricingTier,
        String  currentPhase,
        long    amountPaidCents,
        int     revisionCount,
        boolean deliverableReady,
        boolean costCapTriggered,
        String  holdReason,
        Instant holdExpiresAt,
        Instant createdAt,
        Instant updatedAt
) {
    public static OrderResponse from(MotionOrder o) {
        return new OrderResponse(
                o.getId(),
                o.getOrderNumber(),
                o.getMotionType(),
                o.getStatus().name(),
                o.getStatusVersion(),
                o.getTier().name(),
                o.getPricingTier().name(),
                o.getCurrentPhase(),
                o.getAmountPaidCents(),
                o.getRevisionCount(),
                o.isDeliverableReady(),
                o.isCostCapTriggered(),
                o.getHoldReason(),
                o.getHoldExpiresAt(),
                o.getCreatedAt(),
                o.getUpdatedAt()
        );
    }
}
