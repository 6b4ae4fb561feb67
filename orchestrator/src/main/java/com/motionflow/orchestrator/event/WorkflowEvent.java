package com.motionflow.orchestrator.event;

import com.motionflow.orchestrator.model.MotionOrder;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Something a notification collaborator (email, customer portal) may act on.
 * Carries enough of the order to render a message without another lookup.
 */
public record WorkflowEvent(WorkflowEventType type,
                            UUID orderId,
                            String orderNumber,
                            String motionType,
                            String recipient,
                            List<String> documents,
                            Map<String, Object> attributes,
                            Instant occurredAt) {

    public WorkflowEvent {
        documents  = documents == null ? List.of() : List.copyOf(documents);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static WorkflowEvent of(WorkflowEventType type, MotionOrder order, Map<String, Object> attributes) {
        return new WorkflowEvent(type, order.getId(), order.getOrderNumber(), order.getMotionType(),
                order.getCustomerEmail(), List.of(), attributes, Instant.now());
    }

    public WorkflowEvent withDocuments(List<String> docs) {
        return new WorkflowEvent(type, orderId, orderNumber, motionType, recipient, docs, attributes, occurredAt);
    }
}
