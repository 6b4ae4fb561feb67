package com.motionflow.orchestrator.api;

import com.motionflow.orchestrator.api.dto.AdvancePhaseRequest;
import com.motionflow.orchestrator.api.dto.CancelOrderRequest;
import com.motionflow.orchestrator.api.dto.CancellationResponse;
import com.motionflow.orchestrator.api.dto.CostReportResponse;
import com.motionflow.orchestrator.api.dto.CreateOrderRequest;
import com.motionflow.orchestrator.api.dto.FlagConflictRequest;
import com.motionflow.orchestrator.api.dto.OrderResponse;
import com.motionflow.orchestrator.api.dto.PhaseExecutionResponse;
import com.motionflow.orchestrator.api.dto.RefundOverrideRequest;
import com.motionflow.orchestrator.api.dto.RequestChangesRequest;
import com.motionflow.orchestrator.api.dto.ResolveConflictRequest;
import com.motionflow.orchestrator.api.dto.ResolveUpgradeRequest;
import com.motionflow.orchestrator.api.dto.SearchHitResponse;
import com.motionflow.orchestrator.api.dto.VersionedRequest;
import com.motionflow.orchestrator.cost.BudgetCheck;
import com.motionflow.orchestrator.cost.BudgetGovernor;
import com.motionflow.orchestrator.cost.CostTracker;
import com.motionflow.orchestrator.lifecycle.OrderLifecycleService;
import com.motionflow.orchestrator.model.MotionOrder;
import com.motionflow.orchestrator.model.PhaseCode;
import com.motionflow.orchestrator.refund.RefundAuditRecord;
import com.motionflow.orchestrator.refund.RefundSuggestion;
import com.motionflow.orchestrator.search.OrderSearchService;
import com.motionflow.orchestrator.service.OrderWorkflowService;
import com.motionflow.orchestrator.service.OrderWorkflowService.Cancellation;
import com.motionflow.orchestrator.service.OrderWorkflowService.NewOrder;
import com.motionflow.orchestrator.service.PhaseExecutionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for the order lifecycle.
 *
 * Every command carries the {@code expectedVersion} the caller last read;
 * a stale version answers 409 and the caller refetches.
 *
 * POST /orders                          create an order (INTAKE)
 * POST /orders/{id}/start               INTAKE -> PROCESSING, queue phase I
 * POST /orders/{id}/advance             queue the next (or a named) phase
 * POST /orders/{id}/approve             customer approval -> COMPLETED
 * POST /orders/{id}/request-changes     customer revision request
 * POST /orders/{id}/cancel              cancel with a refund suggestion
 * POST /orders/{id}/refund-override     record the refund actually issued
 * POST /orders/{id}/resolve-hold        HOLD_PENDING -> PROCESSING
 * POST /orders/{id}/flag-conflict       -> PENDING_CONFLICT_REVIEW
 * POST /orders/{id}/resolve-conflict    cleared -> PROCESSING, else cancelled
 * POST /orders/{id}/flag-upgrade        -> UPGRADE_PENDING
 * POST /orders/{id}/resolve-upgrade     UPGRADE_PENDING -> PROCESSING
 * POST /orders/{id}/dispute             AWAITING_APPROVAL -> DISPUTED
 * POST /orders/{id}/close-dispute       DISPUTED -> COMPLETED
 * GET  /orders/{id}                     current order state
 * GET  /orders/{id}/phases              phase executions, oldest first
 * GET  /orders/{id}/costs               cost ledger with primary/retry split
 * GET  /orders/{id}/budget              current revision cycle budget check
 * GET  /orders/{id}/refund-suggestion   what a cancellation now would refund
 * GET  /orders/search?q=                fuzzy admin search
 */
@RestController
@RequestMapping("/orders")
public class OrderController {

    private final OrderWorkflowService  workflow;
    private final OrderLifecycleService lifecycle;
    private final PhaseExecutionService executions;
    private final CostTracker           costTracker;
    private final BudgetGovernor        budget;
    private final OrderSearchService    search;

    public OrderController(OrderWorkflowService workflow,
                           OrderLifecycleService lifecycle,
                           PhaseExecutionService executions,
                           CostTracker costTracker,
                           BudgetGovernor budget,
                           OrderSearchService search) {
        this.workflow    = workflow;
        this.lifecycle   = lifecycle;
        this.executions  = executions;
        this.costTracker = costTracker;
        this.budget      = budget;
        this.search      = search;
    }

    // ------------------------------------------------------------------
    // Intake
    // ------------------------------------------------------------------

    /**
     * Example:
     *   curl -X POST http://localhost:8080/orders \
     *     -H "Content-Type: application/json" \
     *     -d '{"motionType":"MOTION_TO_COMPEL","customerEmail":"a@firm.com",
     *          "motionTypeTier":"B","paidTier":"B"}'
     */
    @PostMapping
    public ResponseEntity<OrderResponse> create(@Valid @RequestBody CreateOrderRequest req) {
        MotionOrder order = workflow.create(new NewOrder(req.motionType(), req.customerEmail(),
                req.motionTypeTier(), req.paidTier(), req.amountPaidCents(), req.separateStatementRequired()));
        return ResponseEntity.status(HttpStatus.CREATED).body(OrderResponse.from(order));
    }

    @PostMapping("/{id}/start")
    public OrderResponse start(@PathVariable UUID id, @Valid @RequestBody VersionedRequest req) {
        return OrderResponse.from(workflow.start(id, req.expectedVersion()));
    }

    @PostMapping("/{id}/advance")
    public OrderResponse advance(@PathVariable UUID id, @Valid @RequestBody AdvancePhaseRequest req) {
        PhaseCode target = null;
        if (req.phase() != null && !req.phase().isBlank()) {
            target = PhaseCode.fromCode(req.phase())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown phase: " + req.phase()));
        }
        return OrderResponse.from(workflow.advancePhase(id, req.expectedVersion(), target));
    }

    // ------------------------------------------------------------------
    // Customer checkpoints
    // ------------------------------------------------------------------

    @PostMapping("/{id}/approve")
    public OrderResponse approve(@PathVariable UUID id, @Valid @RequestBody VersionedRequest req) {
        return OrderResponse.from(workflow.approve(id, req.expectedVersion()));
    }

    @PostMapping("/{id}/request-changes")
    public OrderResponse requestChanges(@PathVariable UUID id, @Valid @RequestBody RequestChangesRequest req) {
        return OrderResponse.from(workflow.requestChanges(id, req.expectedVersion(), req.notes()));
    }

    @PostMapping("/{id}/cancel")
    public CancellationResponse cancel(@PathVariable UUID id, @Valid @RequestBody CancelOrderRequest req) {
        Cancellation c = workflow.cancel(id, req.expectedVersion(), req.reason());
        return new CancellationResponse(OrderResponse.from(c.order()), c.refund());
    }

    @PostMapping("/{id}/dispute")
    public OrderResponse dispute(@PathVariable UUID id, @Valid @RequestBody VersionedRequest req) {
        return OrderResponse.from(workflow.dispute(id, req.expectedVersion()));
    }

    @PostMapping("/{id}/close-dispute")
    public OrderResponse closeDispute(@PathVariable UUID id, @Valid @RequestBody VersionedRequest req) {
        return OrderResponse.from(workflow.closeDispute(id, req.expectedVersion()));
    }

    // ------------------------------------------------------------------
    // Admin interventions
    // ------------------------------------------------------------------

    @PostMapping("/{id}/refund-override")
    public RefundAuditRecord overrideRefund(@PathVariable UUID id, @Valid @RequestBody RefundOverrideRequest req) {
        return workflow.overrideRefund(id, req.expectedVersion(), req.actualAmountCents(),
                req.justification(), req.adminId());
    }

    @PostMapping("/{id}/resolve-hold")
    public OrderResponse resolveHold(@PathVariable UUID id, @Valid @RequestBody VersionedRequest req) {
        return OrderResponse.from(workflow.resolveHold(id, req.expectedVersion()));
    }

    @PostMapping("/{id}/flag-conflict")
    public OrderResponse flagConflict(@PathVariable UUID id, @Valid @RequestBody FlagConflictRequest req) {
        return OrderResponse.from(workflow.flagConflict(id, req.expectedVersion(), req.reason()));
    }

    @PostMapping("/{id}/resolve-conflict")
    public OrderResponse resolveConflict(@PathVariable UUID id, @Valid @RequestBody ResolveConflictRequest req) {
        return OrderResponse.from(workflow.resolveConflict(id, req.expectedVersion(), req.cleared()));
    }

    @PostMapping("/{id}/flag-upgrade")
    public OrderResponse flagUpgrade(@PathVariable UUID id, @Valid @RequestBody VersionedRequest req) {
        return OrderResponse.from(workflow.flagUpgrade(id, req.expectedVersion()));
    }

    @PostMapping("/{id}/resolve-upgrade")
    public OrderResponse resolveUpgrade(@PathVariable UUID id, @Valid @RequestBody ResolveUpgradeRequest req) {
        return OrderResponse.from(workflow.resolveUpgrade(id, req.expectedVersion(), req.newTier()));
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    /** Returns 404 if the order ID is not found. */
    @GetMapping("/{id}")
    public OrderResponse getOrder(@PathVariable UUID id) {
        return OrderResponse.from(lifecycle.get(id));
    }

    @GetMapping("/{id}/phases")
    public List<PhaseExecutionResponse> getPhases(@PathVariable UUID id) {
        lifecycle.get(id);
        return executions.forOrder(id).stream()
                .map(PhaseExecutionResponse::from)
                .toList();
    }

    @GetMapping("/{id}/costs")
    public CostReportResponse getCosts(@PathVariable UUID id) {
        lifecycle.get(id);
        return CostReportResponse.from(costTracker.costBySource(id), costTracker.entries(id));
    }

    @GetMapping("/{id}/budget")
    public BudgetCheck getBudget(@PathVariable UUID id) {
        return budget.checkBudgetEnforcement(lifecycle.get(id));
    }

    @GetMapping("/{id}/refund-suggestion")
    public RefundSuggestion getRefundSuggestion(@PathVariable UUID id) {
        return workflow.refundSuggestion(id);
    }

    @GetMapping("/search")
    public List<SearchHitResponse> search(@RequestParam("q") String query,
                                          @RequestParam(defaultValue = "0.5") double minScore,
                                          @RequestParam(defaultValue = "20") int limit) {
        return search.search(query, minScore, limit).stream()
                .map(SearchHitResponse::from)
                .toList();
    }
}
