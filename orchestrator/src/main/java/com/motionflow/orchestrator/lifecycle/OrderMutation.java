package com.motionflow.orchestrator.lifecycle;

import com.motionflow.orchestrator.model.ExecutionTier;
import com.motionflow.orchestrator.model.MotionOrder;
import com.motionflow.orchestrator.model.OrderStatus;

import java.time.Instant;

/**
 * The mutable lifecycle columns of an order, seeded from the row as read
 * and edited by the caller before the compare-and-set write.
 */
public final class OrderMutation {

    private OrderStatus   status;
    private String        currentPhase;
    private ExecutionTier tier;
    private String        holdReason;
    private Instant       holdTriggeredAt;
    private Instant       holdExpiresAt;
    private int           revisionCount;
    private boolean       costCapTriggered;
    private boolean       deliverableReady;

    private OrderMutation() {}

    static OrderMutation of(MotionOrder o) {
        OrderMutation m = new OrderMutation();
        m.status           = o.getStatus();
        m.currentPhase     = o.getCurrentPhase();
        m.tier             = o.getTier();
        m.holdReason       = o.getHoldReason();
        m.holdTriggeredAt  = o.getHoldTriggeredAt();
        m.holdExpiresAt    = o.getHoldExpiresAt();
        m.revisionCount    = o.getRevisionCount();
        m.costCapTriggered = o.isCostCapTriggered();
        m.deliverableReady = o.isDeliverableReady();
        return m;
    }

    OrderMutation status(OrderStatus s)                 { this.status = s; return this; }
    public OrderMutation currentPhase(String p)         { this.currentPhase = p; return this; }
    public OrderMutation tier(ExecutionTier t)          { this.tier = t; return this; }
    public OrderMutation revisionCount(int n)           { this.revisionCount = n; return this; }
    public OrderMutation costCapTriggered(boolean b)    { this.costCapTriggered = b; return this; }
    public OrderMutation deliverableReady(boolean b)    { this.deliverableReady = b; return this; }

    public OrderMutation hold(String reason, Instant triggeredAt, Instant expiresAt) {
        this.holdReason      = reason;
        this.holdTriggeredAt = triggeredAt;
        this.holdExpiresAt   = expiresAt;
        return this;
    }

    public OrderMutation clearHold() {
        return hold(null, null, null);
    }

    OrderStatus   status()           { return status; }
    String        currentPhase()     { return currentPhase; }
    ExecutionTier tier()             { return tier; }
    String        holdReason()       { return holdReason; }
    Instant       holdTriggeredAt()  { return holdTriggeredAt; }
    Instant       holdExpiresAt()    { return holdExpiresAt; }
    int           revisionCount()    { return revisionCount; }
    boolean       costCapTriggered() { return costCapTriggered; }
    boolean       deliverableReady() { return deliverableReady; }
}
