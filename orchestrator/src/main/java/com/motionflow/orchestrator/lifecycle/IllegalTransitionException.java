package com.motionflow.orchestrator.lifecycle;

import com.motionflow.orchestrator.model.OrderStatus;

public class IllegalTransitionException extends RuntimeException {

    private final OrderStatus from;
    private final OrderStatus to;

    public IllegalTransitionException(OrderStatus from, OrderStatus to) {
        super(from.isTerminal()
                ? "Order is in terminal status " + from + "; cannot move to " + to
                : "Transition " + from + " -> " + to + " is not allowed");
        this.from = from;
        this.to = to;
    }

    public IllegalTransitionException(OrderStatus current, String message) {
        super(message);
        this.from = current;
        this.to = null;
    }

    public OrderStatus from() { return from; }
    public OrderStatus to()   { return to; }
}
