package com.motionflow.orchestrator.lifecycle;

import com.motionflow.orchestrator.model.MotionOrder;
import com.motionflow.orchestrator.model.OrderStatus;
import com.motionflow.orchestrator.repository.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Every write to an order's lifecycle columns goes through here.
 *
 * Each write reads the row, rejects a stale expectedVersion, validates the
 * status edge, then issues one conditional UPDATE keyed on that version.
 * Admin commands, the phase driver and the hold sweep all race through this
 * path; whoever loses gets a {@link ConcurrencyConflictException}.
 */
@Service
public class OrderLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(OrderLifecycleService.class);

    private final OrderRepository    orderRepo;
    private final OrderStatusMachine machine;
    private final Clock              clock;

    public OrderLifecycleService(OrderRepository orderRepo, OrderStatusMachine machine, Clock clock) {
        this.orderRepo = orderRepo;
        this.machine   = machine;
        this.clock     = clock;
    }

    @Transactional(readOnly = true)
    public MotionOrder get(UUID orderId) {
        return orderRepo.findById(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    /** Move the order to {@code target}, applying any extra column edits in the same write. */
    @Transactional
    public MotionOrder transition(UUID orderId, long expectedVersion, OrderStatus target,
                                  Consumer<OrderMutation> edits) {
        MotionOrder current = readAt(orderId, expectedVersion);
        machine.requireTransition(current.getStatus(), target);

        OrderMutation m = OrderMutation.of(current).status(target);
        edits.accept(m);
        MotionOrder updated = write(orderId, expectedVersion, m);
        log.info("Order {} {} -> {} (version {} -> {})",
                orderId, current.getStatus(), target, expectedVersion, updated.getStatusVersion());
        return updated;
    }

    @Transactional
    public MotionOrder transition(UUID orderId, long expectedVersion, OrderStatus target) {
        return transition(orderId, expectedVersion, target, m -> {});
    }

    /** Edit lifecycle columns without changing status. Refused once the order is terminal. */
    @Transactional
    public MotionOrder update(UUID orderId, long expectedVersion, Consumer<OrderMutation> edits) {
        MotionOrder current = readAt(orderId, expectedVersion);
        if (current.getStatus().isTerminal()) {
            throw new IllegalTransitionException(current.getStatus(),
                    "Order " + orderId + " is " + current.getStatus() + " and can no longer change");
        }
        OrderMutation m = OrderMutation.of(current);
        edits.accept(m);
        return write(orderId, expectedVersion, m);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private MotionOrder readAt(UUID orderId, long expectedVersion) {
        MotionOrder current = orderRepo.findById(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
        if (current.getStatusVersion() != expectedVersion) {
            throw new ConcurrencyConflictException(orderId, expectedVersion, current.getStatusVersion());
        }
        return current;
    }

    private MotionOrder write(UUID orderId, long expectedVersion, OrderMutation m) {
        int rows = orderRepo.compareAndSet(orderId, expectedVersion,
                m.status(), m.currentPhase(), m.tier(),
                m.holdReason(), m.holdTriggeredAt(), m.holdExpiresAt(),
                m.revisionCount(), m.costCapTriggered(), m.deliverableReady(),
                Instant.now(clock));
        if (rows == 0) {
            log.warn("Order {} lost a concurrent write at version {}", orderId, expectedVersion);
            throw new ConcurrencyConflictException(orderId, expectedVersion, null);
        }
        return orderRepo.findById(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
    }
}
