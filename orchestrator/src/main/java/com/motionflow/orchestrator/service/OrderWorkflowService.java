package com.motionflow.orchestrator.service;

import com.motionflow.orchestrator.event.WorkflowEvent;
import com.motionflow.orchestrator.event.WorkflowEventPublisher;
import com.motionflow.orchestrator.event.WorkflowEventType;
import com.motionflow.orchestrator.lifecycle.ConcurrencyConflictException;
import com.motionflow.orchestrator.lifecycle.HoldPolicy;
import com.motionflow.orchestrator.lifecycle.IllegalTransitionException;
import com.motionflow.orchestrator.lifecycle.OrderLifecycleService;
import com.motionflow.orchestrator.model.ExecutionTier;
import com.motionflow.orchestrator.model.MotionOrder;
import com.motionflow.orchestrator.model.OrderStatus;
import com.motionflow.orchestrator.model.PhaseCode;
import com.motionflow.orchestrator.model.PricingTier;
import com.motionflow.orchestrator.refund.RefundAuditRecord;
import com.motionflow.orchestrator.refund.RefundSuggestion;
import com.motionflow.orchestrator.refund.RefundSuggestionCalculator;
import com.motionflow.orchestrator.repository.OrderRepository;
import com.motionflow.orchestrator.tier.TierConfiguration;
import com.motionflow.orchestrator.tier.TierResolver;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Order-level commands shared by the admin API, the phase driver and the
 * scheduled jobs.
 *
 * Status changes go through {@link OrderLifecycleService} (version-checked
 * writes). Queueing the follow-up phase happens in the same transaction, so
 * an order is never PROCESSING without work queued for it unless a worker
 * is already running its phase.
 */
@Service
public class OrderWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(OrderWorkflowService.class);

    private static final DateTimeFormatter ORDER_DATE = DateTimeFormatter.BASIC_ISO_DATE;
    private static final String ORDER_NUMBER_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";

    public static final String EXIT_REVISION_LOOPS = "REVISION_LOOPS_EXHAUSTED";
    public static final String EXIT_COST_CAP       = "COST_CAP";
    public static final String HOLD_TIMEOUT        = "HOLD_TIMEOUT";

    private final OrderRepository            orderRepo;
    private final OrderLifecycleService      lifecycle;
    private final PhaseExecutionService      executions;
    private final PhasePlanner               planner;
    private final TierResolver               tierResolver;
    private final TierConfiguration          tiers;
    private final RefundSuggestionCalculator refunds;
    private final WorkflowEventPublisher     events;
    private final MeterRegistry              meters;
    private final Clock                      clock;

    public OrderWorkflowService(OrderRepository orderRepo,
                                OrderLifecycleService lifecycle,
                                PhaseExecutionService executions,
                                PhasePlanner planner,
                                TierResolver tierResolver,
                                TierConfiguration tiers,
                                RefundSuggestionCalculator refunds,
                                WorkflowEventPublisher events,
                                MeterRegistry meters,
                                Clock clock) {
        this.orderRepo    = orderRepo;
        this.lifecycle    = lifecycle;
        this.executions   = executions;
        this.planner      = planner;
        this.tierResolver = tierResolver;
        this.tiers        = tiers;
        this.refunds      = refunds;
        this.events       = events;
        this.meters       = meters;
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // Intake
    // ------------------------------------------------------------------

    public record NewOrder(String motionType,
                           String customerEmail,
                           PricingTier motionTypeTier,
                           PricingTier paidTier,
                           Long amountPaidCents,
                           boolean separateStatementRequired) {}

    /**
     * Create an order in INTAKE. It runs at the higher of the motion type's
     * tier and the tier paid for; settling any price difference is billing's job.
     */
    @Transactional
    public MotionOrder create(NewOrder req) {
        PricingTier effective = tierResolver.resolveEffectiveTier(req.motionTypeTier(), req.paidTier());
        ExecutionTier execTier = tierResolver.toExecutionTier(effective);
        long paid = req.amountPaidCents() != null ? req.amountPaidCents() : tiers.listPriceCents(req.paidTier());

        MotionOrder order = new MotionOrder(nextOrderNumber(), req.motionType(), req.customerEmail(),
                execTier, effective, paid);
        order.setSeparateStatementRequired(req.separateStatementRequired());
        order = orderRepo.save(order);

        if (effective != req.paidTier()) {
            log.info("Order {} runs at tier {} (paid {}); upgrade billing required",
                    order.getOrderNumber(), effective, req.paidTier());
        }
        events.publish(WorkflowEventType.ORDER_RECEIVED, order,
                Map.of("tier", execTier.name(), "pricingTier", effective.name(),
                       "upgradeRequired", effective != req.paidTier()));
        return order;
    }

    /** INTAKE -> PROCESSING and queue phase I. */
    @Transactional
    public MotionOrder start(UUID orderId, long expectedVersion) {
        PhaseCode first = planner.first();
        MotionOrder order = lifecycle.transition(orderId, expectedVersion, OrderStatus.PROCESSING,
                m -> m.currentPhase(first.code()));
        executions.enqueue(order, first, order.getRevisionCount());
        return order;
    }

    // ------------------------------------------------------------------
    // Phase progression
    // ------------------------------------------------------------------

    /**
     * Admin push: queue the next straight-path phase (or {@code target}) for
     * a PROCESSING order that has no work queued, e.g. after an execution was
     * parked for review.
     */
    @Transactional
    public MotionOrder advancePhase(UUID orderId, long expectedVersion, PhaseCode target) {
        MotionOrder order = lifecycle.get(orderId);
        if (order.getStatus() != OrderStatus.PROCESSING) {
            throw new IllegalTransitionException(order.getStatus(), "Only PROCESSING orders can advance a phase");
        }
        if (executions.hasOpenWork(orderId)) {
            throw new IllegalTransitionException(order.getStatus(), "Order " + orderId + " already has phase work in flight");
        }
        PhaseCode next = target != null ? target : currentPhase(order)
                .flatMap(p -> planner.next(p, order))
                .orElseThrow(() -> new IllegalTransitionException(order.getStatus(), "No phase left to advance to"));
        return queuePhase(orderId, expectedVersion, next, order.getRevisionCount(), order.isDeliverableReady());
    }

    /** Record the phase the order is in and queue its execution, in one transaction. */
    @Transactional
    public MotionOrder queuePhase(UUID orderId, long expectedVersion, PhaseCode phase,
                                  int revisionCount, boolean deliverableReady) {
        MotionOrder order = lifecycle.update(orderId, expectedVersion, m -> m
                .currentPhase(phase.code())
                .revisionCount(revisionCount)
                .deliverableReady(deliverableReady));
        executions.enqueue(order, phase, revisionCount);
        return order;
    }

    /** PROCESSING -> AWAITING_APPROVAL once final assembly is done. */
    @Transactional
    public MotionOrder deliver(UUID orderId, long expectedVersion, List<String> documents) {
        MotionOrder order = lifecycle.transition(orderId, expectedVersion, OrderStatus.AWAITING_APPROVAL,
                m -> m.deliverableReady(true));
        events.publish(WorkflowEvent.of(WorkflowEventType.DOCUMENTS_READY, order, Map.of())
                .withDocuments(documents));
        return order;
    }

    /** PROCESSING -> HOLD_PENDING with the 14-day clock started. */
    @Transactional
    public MotionOrder placeOnHold(UUID orderId, long expectedVersion, String reason) {
        Instant now = Instant.now(clock);
        MotionOrder order = lifecycle.transition(orderId, expectedVersion, OrderStatus.HOLD_PENDING,
                m -> m.hold(reason, now, HoldPolicy.expiresAt(now)));
        events.publish(WorkflowEventType.HOLD_CREATED, order, Map.of("reason", reason));
        return order;
    }

    /** HOLD_PENDING -> PROCESSING, re-running the phase that raised the hold. */
    @Transactional
    public MotionOrder resolveHold(UUID orderId, long expectedVersion) {
        MotionOrder order = lifecycle.transition(orderId, expectedVersion, OrderStatus.PROCESSING,
                m -> m.clearHold());
        return resumeWork(order);
    }

    @Transactional
    public MotionOrder awaitCapacity(UUID orderId, long expectedVersion) {
        return lifecycle.transition(orderId, expectedVersion, OrderStatus.AWAITING_MODEL_CAPACITY);
    }

    @Transactional
    public MotionOrder resumeFromCapacity(UUID orderId, long expectedVersion) {
        return resumeWork(lifecycle.transition(orderId, expectedVersion, OrderStatus.PROCESSING));
    }

    @Transactional
    public MotionOrder failOrder(UUID orderId, long expectedVersion, String reason) {
        MotionOrder order = lifecycle.transition(orderId, expectedVersion, OrderStatus.FAILED);
        log.error("Order {} FAILED: {}", orderId, reason);
        return order;
    }

    /**
     * Revision loops or budget ran out before the motion passed review.
     *
     * With a draft in hand the order goes to human review; without one it is
     * cancelled and the customer is offered a full refund.
     */
    @Transactional
    public MotionOrder protocolExit(UUID orderId, long expectedVersion, String reason) {
        boolean costCause = EXIT_COST_CAP.equals(reason);
        MotionOrder exited = lifecycle.transition(orderId, expectedVersion, OrderStatus.PROTOCOL_EXIT,
                m -> {
                    if (costCause) m.costCapTriggered(true);
                });
        meters.counter("motionflow.protocol_exit", "reason", reason).increment();

        Map<String, Object> attrs = new HashMap<>();
        attrs.put("reason", reason);
        attrs.put("revisionCount", exited.getRevisionCount());

        MotionOrder result;
        if (exited.isDeliverableReady()) {
            result = lifecycle.transition(orderId, exited.getStatusVersion(), OrderStatus.AWAITING_APPROVAL);
            attrs.put("outcome", OrderStatus.AWAITING_APPROVAL.name());
        } else {
            result = lifecycle.transition(orderId, exited.getStatusVersion(), OrderStatus.CANCELLED_SYSTEM);
            RefundSuggestion refund = refunds.fullRefund(result.getAmountPaidCents(), result.getCurrentPhase());
            attrs.put("outcome", OrderStatus.CANCELLED_SYSTEM.name());
            attrs.put("refundPercentage", refund.percentage());
            attrs.put("refundAmountCents", refund.amountCents());
            events.publish(WorkflowEventType.ORDER_CANCELLED, result, Map.copyOf(attrs));
        }
        log.warn("Order {} protocol exit ({}): now {}", orderId, reason, result.getStatus());
        events.publish(WorkflowEventType.PROTOCOL_EXIT, result, attrs);
        return result;
    }

    // ------------------------------------------------------------------
    // Customer / admin checkpoints
    // ------------------------------------------------------------------

    @Transactional
    public MotionOrder approve(UUID orderId, long expectedVersion) {
        MotionOrder order = lifecycle.transition(orderId, expectedVersion, OrderStatus.COMPLETED);
        events.publish(WorkflowEventType.ORDER_COMPLETED, order);
        return order;
    }

    /**
     * AWAITING_APPROVAL -> REVISION_REQUESTED -> PROCESSING with phase VIII
     * queued. An order already at its revision-loop limit exits straight
     * back to review instead.
     */
    @Transactional
    public MotionOrder requestChanges(UUID orderId, long expectedVersion, String notes) {
        MotionOrder requested = lifecycle.transition(orderId, expectedVersion, OrderStatus.REVISION_REQUESTED);
        events.publish(WorkflowEventType.REVISION_REQUESTED, requested,
                notes == null ? Map.of() : Map.of("notes", notes));

        int maxLoops = tiers.policy(requested.getTier()).maxRevisionLoops();
        MotionOrder processing = lifecycle.transition(orderId, requested.getStatusVersion(), OrderStatus.PROCESSING,
                m -> m.currentPhase(PhaseCode.VIII.code()));
        if (processing.getRevisionCount() >= maxLoops) {
            return protocolExit(orderId, processing.getStatusVersion(), EXIT_REVISION_LOOPS);
        }
        return queuePhase(orderId, processing.getStatusVersion(), PhaseCode.VIII,
                processing.getRevisionCount() + 1, processing.isDeliverableReady());
    }

    public record Cancellation(MotionOrder order, RefundSuggestion refund) {}

    /** Customer/admin cancellation with a phase-based refund suggestion. */
    @Transactional
    public Cancellation cancel(UUID orderId, long expectedVersion, String reason) {
        MotionOrder order = lifecycle.transition(orderId, expectedVersion, OrderStatus.CANCELLED_USER);
        RefundSuggestion refund = refunds.calculateRefundSuggestion(order.getAmountPaidCents(), order.getCurrentPhase());
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("refundPercentage", refund.percentage());
        attrs.put("refundAmountCents", refund.amountCents());
        attrs.put("requiresManualReview", refund.requiresManualReview());
        if (reason != null) attrs.put("reason", reason);
        events.publish(WorkflowEventType.ORDER_CANCELLED, order, attrs);
        return new Cancellation(order, refund);
    }

    public RefundSuggestion refundSuggestion(UUID orderId) {
        MotionOrder order = lifecycle.get(orderId);
        return refunds.calculateRefundSuggestion(order.getAmountPaidCents(), order.getCurrentPhase());
    }

    /**
     * Record the refund an admin actually issued. A disputed order moves to
     * REFUNDED; for an already-cancelled order only the version is checked.
     */
    @Transactional
    public RefundAuditRecord overrideRefund(UUID orderId, long expectedVersion, long actualCents,
                                            String justification, String adminId) {
        MotionOrder order = lifecycle.get(orderId);
        if (order.getStatusVersion() != expectedVersion) {
            throw new ConcurrencyConflictException(orderId, expectedVersion, order.getStatusVersion());
        }
        RefundSuggestion suggested = refunds.calculateRefundSuggestion(order.getAmountPaidCents(), order.getCurrentPhase());
        refunds.validateOverride(suggested, order.getAmountPaidCents(), actualCents, justification);

        if (order.getStatus() == OrderStatus.DISPUTED) {
            lifecycle.transition(orderId, expectedVersion, OrderStatus.REFUNDED);
        } else if (!order.getStatus().name().startsWith("CANCELLED")) {
            throw new IllegalTransitionException(order.getStatus(),
                    "Refunds can only be recorded for cancelled or disputed orders");
        }

        RefundAuditRecord audit = refunds.buildAuditRecord(orderId, suggested, order.getAmountPaidCents(),
                actualCents, justification, adminId);
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("suggestedAmountCents", audit.suggestedAmountCents());
        attrs.put("actualAmountCents", audit.actualAmountCents());
        attrs.put("deviated", audit.deviated());
        attrs.put("adminId", String.valueOf(adminId));
        events.publish(WorkflowEventType.REFUND_OVERRIDDEN, order, attrs);
        log.info("Refund for order {} recorded by {}: {} cents (suggested {})",
                orderId, adminId, actualCents, suggested.amountCents());
        return audit;
    }

    @Transactional
    public MotionOrder dispute(UUID orderId, long expectedVersion) {
        return lifecycle.transition(orderId, expectedVersion, OrderStatus.DISPUTED);
    }

    /** Settle a dispute without a refund. Refunds go through {@link #overrideRefund}. */
    @Transactional
    public MotionOrder closeDispute(UUID orderId, long expectedVersion) {
        MotionOrder order = lifecycle.transition(orderId, expectedVersion, OrderStatus.COMPLETED);
        events.publish(WorkflowEventType.ORDER_COMPLETED, order);
        return order;
    }

    @Transactional
    public MotionOrder flagConflict(UUID orderId, long expectedVersion, String reason) {
        return lifecycle.transition(orderId, expectedVersion, OrderStatus.PENDING_CONFLICT_REVIEW,
                m -> m.hold(reason, Instant.now(clock), null));
    }

    /** Conflict check outcome: cleared orders resume, others are cancelled. */
    @Transactional
    public MotionOrder resolveConflict(UUID orderId, long expectedVersion, boolean cleared) {
        if (!cleared) {
            MotionOrder order = lifecycle.transition(orderId, expectedVersion, OrderStatus.CANCELLED_CONFLICT,
                    m -> m.clearHold());
            events.publish(WorkflowEventType.ORDER_CANCELLED, order, Map.of("reason", "conflict of interest"));
            return order;
        }
        MotionOrder order = lifecycle.transition(orderId, expectedVersion, OrderStatus.PROCESSING,
                m -> m.clearHold());
        return resumeWork(order);
    }

    @Transactional
    public MotionOrder flagUpgrade(UUID orderId, long expectedVersion) {
        return lifecycle.transition(orderId, expectedVersion, OrderStatus.UPGRADE_PENDING);
    }

    /** Billing settled: continue at {@code newTier} (or the current one). */
    @Transactional
    public MotionOrder resolveUpgrade(UUID orderId, long expectedVersion, PricingTier newTier) {
        MotionOrder order = lifecycle.transition(orderId, expectedVersion, OrderStatus.PROCESSING, m -> {
            if (newTier != null) m.tier(tierResolver.toExecutionTier(newTier));
        });
        return resumeWork(order);
    }

    // ------------------------------------------------------------------
    // Hold sweep
    // ------------------------------------------------------------------

    /**
     * Emit hold reminders whose threshold was crossed since the previous
     * sweep and auto-cancel holds that reached 14 days. Orders under legal
     * hold are never cancelled. A version conflict skips the order until the
     * next sweep.
     */
    public int sweepHolds(Duration sweepInterval) {
        Instant now = Instant.now(clock);
        int cancelled = 0;
        for (MotionOrder order : orderRepo.findByStatus(OrderStatus.HOLD_PENDING)) {
            if (order.getHoldTriggeredAt() == null) continue;
            HoldPolicy.Stage stage = HoldPolicy.stage(order.getHoldTriggeredAt(), now);
            HoldPolicy.Stage before = HoldPolicy.stage(order.getHoldTriggeredAt(), now.minus(sweepInterval));
            try {
                if (stage == HoldPolicy.Stage.AUTO_CANCEL) {
                    if (order.isLegalHold()) {
                        log.info("Order {} hold expired but is under legal hold; not cancelling", order.getId());
                        continue;
                    }
                    autoCancel(order);
                    cancelled++;
                } else if (stage != before) {
                    events.publish(stage == HoldPolicy.Stage.ESCALATION
                                    ? WorkflowEventType.HOLD_ESCALATED : WorkflowEventType.HOLD_REMINDER,
                            order, Map.of("stage", stage.name(), "reason", String.valueOf(order.getHoldReason())));
                }
            } catch (ConcurrencyConflictException e) {
                log.info("Hold sweep skipped order {}: {}", order.getId(), e.getMessage());
            }
        }
        return cancelled;
    }

    /** Resume every order parked on model capacity. */
    public int resumeCapacityWaits() {
        int resumed = 0;
        for (MotionOrder order : orderRepo.findByStatus(OrderStatus.AWAITING_MODEL_CAPACITY)) {
            try {
                resumeFromCapacity(order.getId(), order.getStatusVersion());
                resumed++;
            } catch (ConcurrencyConflictException e) {
                log.info("Capacity resume skipped order {}: {}", order.getId(), e.getMessage());
            }
        }
        return resumed;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void autoCancel(MotionOrder order) {
        MotionOrder cancelled = lifecycle.transition(order.getId(), order.getStatusVersion(),
                OrderStatus.CANCELLED_SYSTEM);
        // Hold timeouts always refund in full, whatever phase the order reached.
        RefundSuggestion refund = refunds.fullRefund(cancelled.getAmountPaidCents(), cancelled.getCurrentPhase(),
                "Hold unresolved after " + HoldPolicy.AUTO_CANCEL_AFTER.toDays() + " days");
        events.publish(WorkflowEventType.HOLD_AUTO_CANCELLED, cancelled,
                Map.of("refundPercentage", refund.percentage(), "refundAmountCents", refund.amountCents(),
                       "refundReason", HOLD_TIMEOUT));
        log.warn("Order {} auto-cancelled after {} on hold", order.getId(), HoldPolicy.AUTO_CANCEL_AFTER);
    }

    /** Queue the order's current phase again (phase I if none was recorded). */
    private MotionOrder resumeWork(MotionOrder order) {
        if (executions.hasOpenWork(order.getId())) return order;
        PhaseCode phase = currentPhase(order).orElse(planner.first());
        executions.enqueue(order, phase, order.getRevisionCount());
        return order;
    }

    private static Optional<PhaseCode> currentPhase(MotionOrder order) {
        return PhaseCode.fromCode(order.getCurrentPhase());
    }

    private String nextOrderNumber() {
        StringBuilder suffix = new StringBuilder();
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        for (int i = 0; i < 6; i++) {
            suffix.append(ORDER_NUMBER_ALPHABET.charAt(rnd.nextInt(ORDER_NUMBER_ALPHABET.length())));
        }
        return "MF-" + LocalDate.now(clock.withZone(ZoneOffset.UTC)).format(ORDER_DATE) + "-" + suffix;
    }
}
