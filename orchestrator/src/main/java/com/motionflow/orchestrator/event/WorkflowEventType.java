package com.motionflow.orchestrator.event;

public enum WorkflowEventType {
    ORDER_RECEIVED,
    PHASE_COMPLETED,
    HOLD_CREATED,
    HOLD_REMINDER,
    HOLD_ESCALATED,
    HOLD_AUTO_CANCELLED,
    DOCUMENTS_READY,
    REVISION_REQUESTED,
    ORDER_COMPLETED,
    ORDER_CANCELLED,
    PROTOCOL_EXIT,
    REFUND_OVERRIDDEN
}
