package com.motionflow.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.motionflow.orchestrator.TestOrders;
import com.motionflow.orchestrator.citation.CaseLawCitationExtractor;
import com.motionflow.orchestrator.citation.CaseLawCitationParser;
import com.motionflow.orchestrator.citation.CaseLawDeduplicator;
import com.motionflow.orchestrator.citation.CitationAnalyzer;
import com.motionflow.orchestrator.citation.CitationTruncationFilter;
import com.motionflow.orchestrator.citation.StatutoryCitationExtractor;
import com.motionflow.orchestrator.claude.ExternalCallException;
import com.motionflow.orchestrator.claude.ModelClient;
import com.motionflow.orchestrator.claude.ModelResponse;
import com.motionflow.orchestrator.cost.BudgetCheck;
import com.motionflow.orchestrator.cost.BudgetExceededException;
import com.motionflow.orchestrator.cost.BudgetGovernor;
import com.motionflow.orchestrator.cost.CostRecordRequest;
import com.motionflow.orchestrator.cost.CostTracker;
import com.motionflow.orchestrator.event.WorkflowEventPublisher;
import com.motionflow.orchestrator.lifecycle.ConcurrencyConflictException;
import com.motionflow.orchestrator.lifecycle.OrderLifecycleService;
import com.motionflow.orchestrator.model.CostSource;
import com.motionflow.orchestrator.model.ExecutionTier;
import com.motionflow.orchestrator.model.MotionOrder;
import com.motionflow.orchestrator.model.OrderStatus;
import com.motionflow.orchestrator.model.PhaseCode;
import com.motionflow.orchestrator.model.PhaseExecution;
import com.motionflow.orchestrator.routing.PhaseRegistry;
import com.motionflow.orchestrator.routing.PhaseRoute;
import com.motionflow.orchestrator.tier.TierConfiguration;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PhaseDriver: what happens to the order after each kind of
 * phase outcome, and how model failures are accounted for.
 */
@ExtendWith(MockitoExtension.class)
class PhaseDriverTest {

    private static final PhaseRoute SONNET = new PhaseRoute("claude-sonnet-4-20250514", null, 64_000, 4);
    private static final BudgetCheck WITHIN_BUDGET = new BudgetCheck(true, true,
            BigDecimal.ZERO, BigDecimal.ZERO, new BigDecimal("800"), new BigDecimal("1200"));

    @Mock OrderLifecycleService  lifecycle;
    @Mock OrderWorkflowService   workflow;
    @Mock PhaseExecutionService  executions;
    @Mock PhasePrompts           prompts;
    @Mock PhaseRegistry          registry;
    @Mock ModelClient            modelClient;
    @Mock CostTracker            costTracker;
    @Mock BudgetGovernor         budget;
    @Mock WorkflowEventPublisher events;

    SimpleMeterRegistry meters;
    ExecutionHeartbeat  heartbeat;
    PhaseDriver         driver;
    MotionOrder         order;

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        driver = driverWithHeartbeatEvery(Duration.ofHours(1));

        order = TestOrders.order(OrderStatus.PROCESSING, ExecutionTier.B);
        order.setStatusVersion(3);
        lenient().when(lifecycle.get(order.getId())).thenReturn(order);
    }

    @AfterEach
    void tearDown() {
        heartbeat.shutdown();
    }

    // ------------------------------------------------------------------
    // Gates before the model call
    // ------------------------------------------------------------------

    @Test
    void orderNoLongerProcessing_blocksWithoutCallingModel() {
        order.setStatus(OrderStatus.CANCELLED_USER);
        PhaseExecution exec = TestOrders.execution(order, PhaseCode.III, 0);

        driver.run(exec);

        verify(executions).block(eq(exec), contains("CANCELLED_USER"));
        verifyNoInteractions(modelClient, costTracker);
    }

    @Test
    void hardCapReachedBeforeDispatch_exitsOnCost() {
        PhaseExecution exec = TestOrders.execution(order, PhaseCode.IV, 0);
        when(budget.checkBudgetEnforcement(order)).thenReturn(new BudgetCheck(false, false,
                new BigDecimal("900"), new BigDecimal("1300"), new BigDecimal("800"), new BigDecimal("1200")));

        driver.run(exec);

        verify(executions).block(eq(exec), anyString());
        verify(workflow).protocolExit(order.getId(), 3, OrderWorkflowService.EXIT_COST_CAP);
        verifyNoInteractions(modelClient);
    }

    // ------------------------------------------------------------------
    // Successful calls
    // ------------------------------------------------------------------

    @Test
    void straightPathPhase_recordsPrimaryCostAndQueuesNext() {
        PhaseExecution exec = TestOrders.execution(order, PhaseCode.III, 0);
        givenModelReturns(PhaseCode.III, "<result>issues identified</result>");

        driver.run(exec);

        ArgumentCaptor<CostRecordRequest> cost = ArgumentCaptor.forClass(CostRecordRequest.class);
        verify(costTracker).record(cost.capture());
        assertThat(cost.getValue().source()).isEqualTo(CostSource.PRIMARY);
        assertThat(cost.getValue().attempt()).isEqualTo(1);
        assertThat(cost.getValue().tier()).isEqualTo("B");
        assertThat(cost.getValue().inputTokens()).isEqualTo(1_200);

        verify(executions).complete(exec, "issues identified", null, null);
        verify(workflow).queuePhase(order.getId(), 3, PhaseCode.IV, 0, false);
        assertThat(meters.counter("motionflow.model.calls",
                "phase", "III", "model", SONNET.model(), "status", "ok").count()).isEqualTo(1.0);
    }

    @Test
    void retryAttempt_recordsRetryCost() {
        PhaseExecution exec = TestOrders.execution(order, PhaseCode.II, 1);
        givenModelReturns(PhaseCode.II, "<result>facts</result>");

        driver.run(exec);

        ArgumentCaptor<CostRecordRequest> cost = ArgumentCaptor.forClass(CostRecordRequest.class);
        verify(costTracker).record(cost.capture());
        assertThat(cost.getValue().source()).isEqualTo(CostSource.RETRY);
        assertThat(cost.getValue().attempt()).isEqualTo(2);
    }

    @Test
    void hardCapCrossedByThisCall_exitsAfterRecordingCost() {
        PhaseExecution exec = TestOrders.execution(order, PhaseCode.IV, 0);
        givenModelReturns(PhaseCode.IV, "<result>research</result>");
        when(budget.checkAfterWrite(order)).thenThrow(new BudgetExceededException(order.getId(), "cycle",
                new BigDecimal("1250"), new BigDecimal("1200")));

        driver.run(exec);

        verify(costTracker).record(any());
        verify(workflow).protocolExit(order.getId(), 3, OrderWorkflowService.EXIT_COST_CAP);
        verify(workflow, never()).queuePhase(any(), anyLong(), any(), anyInt(), anyBoolean());
    }

    @Test
    void draftWithTooFewAuthorities_placesOrderOnHold() {
        PhaseExecution exec = TestOrders.execution(order, PhaseCode.V, 0);
        givenModelReturns(PhaseCode.V, "<result>See Celotex Corp. v. Catrett, 477 U.S. 317 (1986).</result>");

        driver.run(exec);

        verify(workflow).placeOnHold(eq(order.getId()), eq(3L), contains("1 authorities"));
        verify(workflow, never()).queuePhase(any(), anyLong(), any(), anyInt(), anyBoolean());
    }

    @Test
    void draftWithEnoughAuthorities_marksDeliverableReady() {
        PhaseExecution exec = TestOrders.execution(order, PhaseCode.V, 0);
        givenModelReturns(PhaseCode.V, """
                <result>
                Celotex Corp. v. Catrett, 477 U.S. 317 (1986); Anderson v. Liberty Lobby, Inc., 477 U.S. 242 (1986).
                See Cal. Code Civ. Proc. § 2030.300, Fed. R. Civ. P. 37 and 42 U.S.C. § 1983.
                </result>
                """);

        driver.run(exec);

        verify(workflow).queuePhase(order.getId(), 3, PhaseCode.V_1, 0, true);
    }

    @Test
    void judgeBelowThreshold_withLoopsLeft_startsRevision() {
        order.setRevisionCount(1);
        PhaseExecution exec = TestOrders.execution(order, PhaseCode.VII, 0);
        givenModelReturns(PhaseCode.VII, "<result>{\"grade\": \"B\"}</result>");

        driver.run(exec);

        verify(executions).complete(eq(exec), anyString(), eq(new BigDecimal("0.83")), isNull());
        verify(workflow).queuePhase(order.getId(), 3, PhaseCode.VIII, 2, false);
    }

    @Test
    void judgeBelowThreshold_loopsExhausted_protocolExit() {
        order.setRevisionCount(3);
        order.setDeliverableReady(true);
        PhaseExecution exec = TestOrders.execution(order, PhaseCode.VII, 0);
        givenModelReturns(PhaseCode.VII, "{\"score\": 0.70}");

        driver.run(exec);

        verify(workflow).protocolExit(order.getId(), 3, OrderWorkflowService.EXIT_REVISION_LOOPS);
    }

    @Test
    void judgeWithoutGrade_countsAsFailing() {
        PhaseExecution exec = TestOrders.execution(order, PhaseCode.VII, 0);
        givenModelReturns(PhaseCode.VII, "The motion is persuasive.");

        driver.run(exec);

        verify(executions).complete(eq(exec), anyString(), eq(BigDecimal.ZERO), isNull());
        verify(workflow).queuePhase(order.getId(), 3, PhaseCode.VIII, 1, false);
    }

    @Test
    void judgePasses_continuesStraightPath() {
        PhaseExecution exec = TestOrders.execution(order, PhaseCode.VII, 0);
        givenModelReturns(PhaseCode.VII, "{\"score\": 0.9}");

        driver.run(exec);

        verify(workflow).queuePhase(order.getId(), 3, PhaseCode.VIII_5, 0, false);
    }

    @Test
    void revisionPhase_queuesCitationRecheck() {
        PhaseExecution exec = TestOrders.execution(order, PhaseCode.VIII, 0);
        givenModelReturns(PhaseCode.VIII, "<result>revised draft</result>");

        driver.run(exec);

        verify(workflow).queuePhase(order.getId(), 3, PhaseCode.VII_1, 0, false);
    }

    @Test
    void citationRecheck_returnsToJudge() {
        PhaseExecution exec = TestOrders.execution(order, PhaseCode.VII_1, 0);
        givenModelReturns(PhaseCode.VII_1, "<result>citations verified</result>");

        driver.run(exec);

        verify(workflow).queuePhase(order.getId(), 3, PhaseCode.VII, 0, false);
    }

    @Test
    void finalAssembly_deliversListedDocuments() {
        PhaseExecution exec = TestOrders.execution(order, PhaseCode.X, 0);
        givenModelReturns(PhaseCode.X, """
                <result>
                Filing package:
                - Notice of Motion and Motion to Compel
                - Memorandum of Points and Authorities
                * Proposed Order
                </result>
                """);

        driver.run(exec);

        verify(workflow).deliver(order.getId(), 3, List.of(
                "Notice of Motion and Motion to Compel",
                "Memorandum of Points and Authorities",
                "Proposed Order"));
    }

    @Test
    void repeatedConflicts_parkExecutionForReview() {
        PhaseExecution exec = TestOrders.execution(order, PhaseCode.III, 0);
        givenModelReturns(PhaseCode.III, "<result>ok</result>");
        when(workflow.queuePhase(any(), anyLong(), any(), anyInt(), anyBoolean()))
                .thenThrow(new ConcurrencyConflictException(order.getId(), 3, 4L));

        driver.run(exec);

        verify(workflow, times(2)).queuePhase(any(), anyLong(), any(), anyInt(), anyBoolean());
        verify(executions).requireReview(eq(exec), anyString());
    }

    // ------------------------------------------------------------------
    // Failed calls
    // ------------------------------------------------------------------

    @Test
    void capacityError_parksOrderWithoutSpendingAttempt() {
        PhaseExecution exec = TestOrders.execution(order, PhaseCode.VI, 0);
        givenRoute(PhaseCode.VI);
        when(modelClient.complete(any())).thenThrow(new ExternalCallException(529, "overloaded"));

        driver.run(exec);

        ArgumentCaptor<CostRecordRequest> cost = ArgumentCaptor.forClass(CostRecordRequest.class);
        verify(costTracker).record(cost.capture());
        assertThat(cost.getValue().source()).isEqualTo(CostSource.RETRY);
        assertThat(cost.getValue().inputTokens()).isZero();
        assertThat(cost.getValue().metadata()).contains("529");

        verify(executions).block(eq(exec), contains("529"));
        verify(workflow).awaitCapacity(order.getId(), 3);
        verify(executions, never()).fail(any(), anyString());
    }

    @Test
    void otherError_onLastAttempt_failsOrder() {
        PhaseExecution exec = TestOrders.execution(order, PhaseCode.IX, 2);
        givenRoute(PhaseCode.IX);
        when(modelClient.complete(any())).thenThrow(new ExternalCallException(500, "server error"));
        when(executions.fail(exec, "server error")).thenReturn(false);

        driver.run(exec);

        verify(workflow).failOrder(eq(order.getId()), eq(3L), contains("IX"));
        assertThat(meters.counter("motionflow.model.calls",
                "phase", "IX", "model", SONNET.model(), "status", "error").count()).isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Heartbeat during long calls
    // ------------------------------------------------------------------

    @Test
    void slowModelCall_keepsHeartbeatFreshUntilCallReturns() throws Exception {
        heartbeat.shutdown();
        driver = driverWithHeartbeatEvery(Duration.ofMillis(20));
        PhaseExecution exec = TestOrders.execution(order, PhaseCode.V, 0);
        givenRoute(PhaseCode.V);
        when(executions.heartbeat(exec.getId())).thenReturn(true);
        when(modelClient.complete(any())).thenAnswer(inv -> {
            Thread.sleep(300);
            return new ModelResponse("<result>draft</result>", 1_200, 800);
        });

        driver.run(exec);

        verify(executions, atLeast(2)).heartbeat(exec.getId());

        // Beats stop once the call has returned.
        Thread.sleep(50);
        clearInvocations(executions);
        Thread.sleep(150);
        verify(executions, never()).heartbeat(any());
    }

    @Test
    void mdcIsClearedAfterRun() {
        PhaseExecution exec = TestOrders.execution(order, PhaseCode.III, 0);
        givenModelReturns(PhaseCode.III, "<result>ok</result>");

        driver.run(exec);

        assertThat(MDC.get("orderId")).isNull();
    }

    @Test
    void documents_readsBulletLinesOnly() {
        assertThat(PhaseDriver.documents("Intro\n- Motion\n  * Declaration of Counsel\nclosing")).containsExactly(
                "Motion", "Declaration of Counsel");
        assertThat(PhaseDriver.documents(null)).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private PhaseDriver driverWithHeartbeatEvery(Duration interval) {
        heartbeat = new ExecutionHeartbeat(executions, interval);
        CitationAnalyzer citations = new CitationAnalyzer(new CaseLawCitationExtractor(),
                new CitationTruncationFilter(), new CaseLawDeduplicator(new CaseLawCitationParser()),
                new StatutoryCitationExtractor());
        return new PhaseDriver(lifecycle, workflow, executions, heartbeat, new PhasePlanner(), prompts, registry,
                new TierConfiguration(), modelClient, costTracker, budget, citations, events,
                new ObjectMapper(), meters);
    }

    private void givenRoute(PhaseCode phase) {
        when(budget.checkBudgetEnforcement(order)).thenReturn(WITHIN_BUDGET);
        when(registry.lookup(phase, ExecutionTier.B)).thenReturn(SONNET);
        when(prompts.system(phase)).thenReturn("system");
        when(prompts.user(eq(phase), eq(order), any())).thenReturn("user");
        when(executions.completedOutputs(order.getId())).thenReturn(Map.of());
    }

    private void givenModelReturns(PhaseCode phase, String text) {
        givenRoute(phase);
        when(modelClient.complete(any())).thenReturn(new ModelResponse(text, 1_200, 800));
    }
}
