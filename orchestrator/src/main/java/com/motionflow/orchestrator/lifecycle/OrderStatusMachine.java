package com.motionflow.orchestrator.lifecycle;

import com.motionflow.orchestrator.model.OrderStatus;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.motionflow.orchestrator.model.OrderStatus.*;

/**
 * Allowed order status transitions.
 *
 *   INTAKE ──► PROCESSING ──► AWAITING_APPROVAL ──► COMPLETED
 *                 │  ▲              │
 *                 │  └── REVISION_REQUESTED ◄┘
 *                 ├──► AWAITING_MODEL_CAPACITY / HOLD_PENDING / UPGRADE_PENDING ──► back
 *                 ├──► PENDING_CONFLICT_REVIEW ──► PROCESSING | CANCELLED_CONFLICT
 *                 └──► PROTOCOL_EXIT ──► AWAITING_APPROVAL | CANCELLED_SYSTEM
 *
 * Terminal statuses have no outgoing edges.
 */
@Component
public class OrderStatusMachine {

    private static final Map<OrderStatus, Set<OrderStatus>> ALLOWED;

    static {
        Map<OrderStatus, Set<OrderStatus>> t = new EnumMap<>(OrderStatus.class);
        t.put(INTAKE, EnumSet.of(PROCESSING, PENDING_CONFLICT_REVIEW, CANCELLED_USER, CANCELLED_SYSTEM));
        t.put(PROCESSING, EnumSet.of(AWAITING_MODEL_CAPACITY, HOLD_PENDING, PROTOCOL_EXIT,
                PENDING_CONFLICT_REVIEW, UPGRADE_PENDING, AWAITING_APPROVAL,
                CANCELLED_USER, CANCELLED_SYSTEM, DISPUTED, FAILED));
        t.put(AWAITING_MODEL_CAPACITY, EnumSet.of(PROCESSING, CANCELLED_SYSTEM, FAILED));
        t.put(HOLD_PENDING, EnumSet.of(PROCESSING, CANCELLED_USER, CANCELLED_SYSTEM));
        t.put(PROTOCOL_EXIT, EnumSet.of(AWAITING_APPROVAL, CANCELLED_SYSTEM));
        t.put(UPGRADE_PENDING, EnumSet.of(PROCESSING, CANCELLED_USER, CANCELLED_SYSTEM));
        t.put(PENDING_CONFLICT_REVIEW, EnumSet.of(PROCESSING, CANCELLED_CONFLICT));
        t.put(AWAITING_APPROVAL, EnumSet.of(COMPLETED, REVISION_REQUESTED, CANCELLED_USER, DISPUTED));
        t.put(REVISION_REQUESTED, EnumSet.of(PROCESSING, CANCELLED_USER));
        t.put(DISPUTED, EnumSet.of(COMPLETED, REFUNDED));
        for (OrderStatus s : OrderStatus.values()) {
            if (s.isTerminal()) t.put(s, EnumSet.noneOf(OrderStatus.class));
        }
        for (OrderStatus s : OrderStatus.values()) {
            t.put(s, Collections.unmodifiableSet(t.get(s)));
        }
        ALLOWED = Collections.unmodifiableMap(t);
    }

    public boolean canTransition(OrderStatus from, OrderStatus to) {
        return from != null && to != null && ALLOWED.get(from).contains(to);
    }

    public void requireTransition(OrderStatus from, OrderStatus to) {
        if (!canTransition(from, to)) {
            throw new IllegalTransitionException(from, to);
        }
    }

    public Set<OrderStatus> allowedFrom(OrderStatus from) {
        return ALLOWED.get(from);
    }
}
