package com.motionflow.orchestrator.event;

import com.motionflow.orchestrator.model.MotionOrder;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Map;

/** Thin facade over Spring's publisher so callers build events one way. */
@Component
public class WorkflowEventPublisher {

    private final ApplicationEventPublisher publisher;

    public WorkflowEventPublisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    public void publish(WorkflowEvent event) {
        publisher.publishEvent(event);
    }

    public void publish(WorkflowEventType type, MotionOrder order) {
        publish(WorkflowEvent.of(type, order, Map.of()));
    }

    public void publish(WorkflowEventType type, MotionOrder order, Map<String, Object> attributes) {
        publish(WorkflowEvent.of(type, order, attributes));
    }
}
