package com.motionflow.orchestrator.lifecycle;

public class OrderNotFoundException extends RuntimeException {

    public OrderNotFoundException(Object orderRef) {
        super("Order not found: " + orderRef);
    }
}
