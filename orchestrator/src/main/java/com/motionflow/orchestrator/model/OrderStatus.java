package com.motionflow.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a motion order.
 *
 * Allowed transitions live in {@code OrderStatusMachine}; this enum only
 * knows which states are terminal.
 */
public enum OrderStatus {
    INTAKE,
    PROCESSING,
    AWAITING_MODEL_CAPACITY,
    HOLD_PENDING,
    PROTOCOL_EXIT,
    UPGRADE_PENDING,
    PENDING_CONFLICT_REVIEW,
    AWAITING_APPROVAL,
    REVISION_REQUESTED,
    COMPLETED,
    CANCELLED_USER,
    CANCELLED_SYSTEM,
    CANCELLED_CONFLICT,
    REFUNDED,
    DISPUTED,
    FAILED;

    private static final Set<OrderStatus> TERMINAL = EnumSet.of(
            COMPLETED, CANCELLED_USER, CANCELLED_SYSTEM, CANCELLED_CONFLICT, REFUNDED, FAILED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
