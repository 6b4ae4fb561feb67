package com.motionflow.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.motionflow.orchestrator.citation.CitationAnalyzer;
import com.motionflow.orchestrator.citation.CitationReport;
import com.motionflow.orchestrator.claude.ExternalCallException;
import com.motionflow.orchestrator.claude.ModelClient;
import com.motionflow.orchestrator.claude.ModelRequest;
import com.motionflow.orchestrator.claude.ModelResponse;
import com.motionflow.orchestrator.cost.BudgetExceededException;
import com.motionflow.orchestrator.cost.BudgetCheck;
import com.motionflow.orchestrator.cost.BudgetGovernor;
import com.motionflow.orchestrator.cost.CostRecordRequest;
import com.motionflow.orchestrator.cost.CostTracker;
import com.motionflow.orchestrator.event.WorkflowEventPublisher;
import com.motionflow.orchestrator.event.WorkflowEventType;
import com.motionflow.orchestrator.lifecycle.ConcurrencyConflictException;
import com.motionflow.orchestrator.lifecycle.OrderLifecycleService;
import com.motionflow.orchestrator.model.CostSource;
import com.motionflow.orchestrator.model.MotionOrder;
import com.motionflow.orchestrator.model.OrderStatus;
import com.motionflow.orchestrator.model.PhaseCode;
import com.motionflow.orchestrator.model.PhaseExecution;
import com.motionflow.orchestrator.routing.PhaseRegistry;
import com.motionflow.orchestrator.routing.PhaseRoute;
import com.motionflow.orchestrator.tier.TierConfiguration;
import com.motionflow.orchestrator.tier.TierPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs one claimed phase execution end to end.
 *
 *   1. check the order is still PROCESSING (cancellation is only seen here)
 *   2. pre-dispatch budget gate
 *   3. route through the registry, call the model
 *   4. record cost, then enforce the hard budget
 *   5. analyse citations / grade, store the execution outcome
 *   6. decide what happens to the order next
 *
 * A model call in flight is never interrupted; its cost is written before
 * any exit is taken.
 */
@Component
public class PhaseDriver {

    private static final Logger log = LoggerFactory.getLogger(PhaseDriver.class);

    static final int MIN_AUTHORITIES = 4;

    private static final Set<PhaseCode> CITATION_PHASES =
            Set.of(PhaseCode.V, PhaseCode.V_1, PhaseCode.VII_1, PhaseCode.VIII);

    private static final Pattern DOCUMENT_LINE = Pattern.compile("(?m)^\\s*[-*]\\s+(.+?)\\s*$");

    private final OrderLifecycleService  lifecycle;
    private final OrderWorkflowService   workflow;
    private final PhaseExecutionService  executions;
    private final ExecutionHeartbeat     heartbeat;
    private final PhasePlanner           planner;
    private final PhasePrompts           prompts;
    private final PhaseRegistry          registry;
    private final TierConfiguration      tiers;
    private final ModelClient            modelClient;
    private final CostTracker            costTracker;
    private final BudgetGovernor         budget;
    private final CitationAnalyzer       citations;
    private final WorkflowEventPublisher events;
    private final ObjectMapper           objectMapper;
    private final MeterRegistry          meters;

    public PhaseDriver(OrderLifecycleService lifecycle,
                       OrderWorkflowService workflow,
                       PhaseExecutionService executions,
                       ExecutionHeartbeat heartbeat,
                       PhasePlanner planner,
                       PhasePrompts prompts,
                       PhaseRegistry registry,
                       TierConfiguration tiers,
                       ModelClient modelClient,
                       CostTracker costTracker,
                       BudgetGovernor budget,
                       CitationAnalyzer citations,
                       WorkflowEventPublisher events,
                       ObjectMapper objectMapper,
                       MeterRegistry meters) {
        this.lifecycle    = lifecycle;
        this.workflow     = workflow;
        this.executions   = executions;
        this.heartbeat    = heartbeat;
        this.planner      = planner;
        this.prompts      = prompts;
        this.registry     = registry;
        this.tiers        = tiers;
        this.modelClient  = modelClient;
        this.costTracker  = costTracker;
        this.budget       = budget;
        this.citations    = citations;
        this.events       = events;
        this.objectMapper = objectMapper;
        this.meters       = meters;
    }

    // ------------------------------------------------------------------
    // Entry point, called by PhaseScheduler on a worker thread
    // ------------------------------------------------------------------

    public void run(PhaseExecution exec) {
        MDC.put("orderId",     exec.getOrder().getId().toString());
        MDC.put("executionId", exec.getId().toString());
        MDC.put("phase",       exec.getPhaseCode());
        MDC.put("attempt",     String.valueOf(exec.getAttempt()));
        try {
            runPhase(exec);
        } finally {
            MDC.clear();
        }
    }

    private void runPhase(PhaseExecution exec) {
        PhaseCode phase = exec.phase();
        MotionOrder order = lifecycle.get(exec.getOrder().getId());

        if (order.getStatus() != OrderStatus.PROCESSING) {
            executions.block(exec, "Order is " + order.getStatus());
            return;
        }

        BudgetCheck gate = budget.checkBudgetEnforcement(order);
        if (!gate.totalOk()) {
            executions.block(exec, "Cycle hard cap reached before dispatch");
            exitSafely(order, OrderWorkflowService.EXIT_COST_CAP);
            return;
        }

        PhaseRoute route = registry.lookup(phase, order.getTier());
        log.info("Running phase {} for order {} on {} (reasoning={}, maxTokens={})",
                phase, order.getOrderNumber(), route.model(), route.reasoningBudget(), route.maxTokens());

        ModelRequest request = ModelRequest.from(route,
                prompts.system(phase), prompts.user(phase, order, executions.completedOutputs(order.getId())));
        ModelResponse response;
        try (ExecutionHeartbeat.Beat beat = heartbeat.start(exec)) {
            response = call(phase, route, request);
        } catch (ExternalCallException e) {
            handleCallFailure(exec, order, route, e);
            return;
        }

        CostSource source = exec.getAttempt() == 0 ? CostSource.PRIMARY : CostSource.RETRY;
        costTracker.record(new CostRecordRequest(order.getId(), phase.code(), route.model(), order.getTier().name(),
                response.inputTokens(), response.outputTokens(), source,
                exec.getAttempt() + 1, exec.getRevisionCycle(), null));

        Outcome outcome = analyse(phase, response.text());
        executions.complete(exec, outcome.deliverable(), outcome.qualityScore(), outcome.citationJson());

        try {
            budget.checkAfterWrite(order);
        } catch (BudgetExceededException e) {
            log.warn("{}", e.getMessage());
            exitSafely(lifecycle.get(order.getId()), OrderWorkflowService.EXIT_COST_CAP);
            return;
        }

        events.publish(WorkflowEventType.PHASE_COMPLETED, order, Map.of("phase", phase.code()));
        applyOutcome(exec, phase, outcome);
    }

    // ------------------------------------------------------------------
    // Model call (the heartbeat keeps the execution claimed meanwhile)
    // ------------------------------------------------------------------

    private ModelResponse call(PhaseCode phase, PhaseRoute route, ModelRequest request) {
        Timer.Sample sample = Timer.start(meters);
        String status = "ok";
        try {
            return modelClient.complete(request);
        } catch (ExternalCallException e) {
            status = e.isCapacity() ? "capacity" : "error";
            throw e;
        } finally {
            sample.stop(meters.timer("motionflow.model.duration", "phase", phase.code(), "model", route.model()));
            meters.counter("motionflow.model.calls", "phase", phase.code(), "model", route.model(), "status", status)
                    .increment();
        }
    }

    /**
     * Failed calls still cost a ledger row (RETRY, zero tokens) so retry
     * overhead stays visible. Capacity errors park the order instead of
     * spending an attempt.
     */
    private void handleCallFailure(PhaseExecution exec, MotionOrder order, PhaseRoute route, ExternalCallException e) {
        costTracker.record(new CostRecordRequest(order.getId(), exec.getPhaseCode(), route.model(),
                order.getTier().name(), 0, 0, CostSource.RETRY, exec.getAttempt() + 1, exec.getRevisionCycle(),
                errorMetadata(e)));

        if (e.isCapacity()) {
            executions.block(exec, "Model capacity: HTTP " + e.statusCode());
            try {
                workflow.awaitCapacity(order.getId(), order.getStatusVersion());
            } catch (ConcurrencyConflictException conflict) {
                log.warn("Order {} changed while parking for capacity: {}", order.getId(), conflict.getMessage());
            }
            return;
        }

        if (!executions.fail(exec, e.getMessage())) {
            try {
                workflow.failOrder(order.getId(), order.getStatusVersion(),
                        "Phase " + exec.getPhaseCode() + " failed " + PhaseExecutionService.MAX_ATTEMPTS + " times");
            } catch (ConcurrencyConflictException conflict) {
                log.warn("Order {} changed before it could be failed: {}", order.getId(), conflict.getMessage());
            }
        }
    }

    // ------------------------------------------------------------------
    // Outcome
    // ------------------------------------------------------------------

    record Outcome(String deliverable, BigDecimal qualityScore, CitationReport citations, String citationJson) {}

    private Outcome analyse(PhaseCode phase, String text) {
        String deliverable = ResponseParser.deliverable(text);
        BigDecimal score = null;
        if (phase == PhaseCode.VII) {
            score = ResponseParser.extractQualityScore(text).orElseGet(() -> {
                log.warn("Judge simulation returned no readable grade; scoring 0");
                return BigDecimal.ZERO;
            });
        }
        CitationReport report = null;
        String json = null;
        if (CITATION_PHASES.contains(phase)) {
            report = citations.analyze(deliverable);
            json = toJson(report);
        }
        return new Outcome(deliverable, score, report, json);
    }

    /**
     * Move the order on. The order is re-read first because an admin may have
     * acted during the model call; a lost race is retried once against the
     * fresh row, then the execution is parked for review.
     */
    private void applyOutcome(PhaseExecution exec, PhaseCode phase, Outcome outcome) {
        for (int tries = 0; tries < 2; tries++) {
            MotionOrder order = lifecycle.get(exec.getOrder().getId());
            if (order.getStatus() != OrderStatus.PROCESSING) {
                log.info("Order {} is {} after phase {}; not advancing", order.getId(), order.getStatus(), phase);
                return;
            }
            try {
                decide(order, phase, outcome);
                return;
            } catch (ConcurrencyConflictException e) {
                log.warn("Conflict applying phase {} outcome to order {}: {}", phase, order.getId(), e.getMessage());
            }
        }
        executions.requireReview(exec, "Could not apply outcome after repeated version conflicts");
    }

    private void decide(MotionOrder order, PhaseCode phase, Outcome outcome) {
        long v = order.getStatusVersion();
        switch (phase) {
            case V -> {
                int authorities = outcome.citations().uniqueAuthorityCount();
                if (authorities < MIN_AUTHORITIES) {
                    // phase V is re-run once the hold is resolved
                    workflow.placeOnHold(order.getId(), v,
                            "Draft cites " + authorities + " authorities; at least " + MIN_AUTHORITIES + " required");
                    return;
                }
                straightOn(order, phase, true);
            }
            case VII -> {
                TierPolicy policy = tiers.policy(order.getTier());
                if (outcome.qualityScore().compareTo(policy.qualityThreshold()) >= 0) {
                    log.info("Order {} passed judge simulation with {}", order.getId(), outcome.qualityScore());
                    straightOn(order, phase, order.isDeliverableReady());
                } else if (order.getRevisionCount() >= policy.maxRevisionLoops()) {
                    log.info("Order {} scored {} with no revision loops left", order.getId(), outcome.qualityScore());
                    workflow.protocolExit(order.getId(), v, OrderWorkflowService.EXIT_REVISION_LOOPS);
                } else {
                    workflow.queuePhase(order.getId(), v, PhaseCode.VIII,
                            order.getRevisionCount() + 1, order.isDeliverableReady());
                }
            }
            case VIII -> workflow.queuePhase(order.getId(), v, PhaseCode.VII_1,
                    order.getRevisionCount(), order.isDeliverableReady());
            case VII_1 -> workflow.queuePhase(order.getId(), v, PhaseCode.VII,
                    order.getRevisionCount(), order.isDeliverableReady());
            case X -> workflow.deliver(order.getId(), v, documents(outcome.deliverable()));
            default -> straightOn(order, phase, order.isDeliverableReady());
        }
    }

    private void straightOn(MotionOrder order, PhaseCode completed, boolean deliverableReady) {
        PhaseCode next = planner.next(completed, order).orElseThrow(
                () -> new IllegalStateException("No phase follows " + completed));
        workflow.queuePhase(order.getId(), order.getStatusVersion(), next, order.getRevisionCount(), deliverableReady);
    }

    private void exitSafely(MotionOrder order, String reason) {
        try {
            if (order.getStatus() == OrderStatus.PROCESSING) {
                workflow.protocolExit(order.getId(), order.getStatusVersion(), reason);
            }
        } catch (ConcurrencyConflictException e) {
            log.warn("Protocol exit for order {} lost a race: {}", order.getId(), e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Bullet lines of the final assembly output name the documents in the package. */
    static List<String> documents(String assembly) {
        List<String> docs = new ArrayList<>();
        Matcher m = DOCUMENT_LINE.matcher(assembly == null ? "" : assembly);
        while (m.find()) docs.add(m.group(1));
        return docs;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise citation report: {}", e.getMessage());
            return null;
        }
    }

    private String errorMetadata(ExternalCallException e) {
        try {
            return objectMapper.writeValueAsString(Map.of(
                    "error", String.valueOf(e.getMessage()), "status", e.statusCode()));
        } catch (JsonProcessingException ex) {
            return null;
        }
    }
}
