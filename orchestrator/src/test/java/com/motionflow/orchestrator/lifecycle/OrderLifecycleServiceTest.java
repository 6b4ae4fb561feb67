package com.motionflow.orchestrator.lifecycle;

import com.motionflow.orchestrator.TestOrders;
import com.motionflow.orchestrator.model.MotionOrder;
import com.motionflow.orchestrator.model.OrderStatus;
import com.motionflow.orchestrator.repository.OrderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for OrderLifecycleService. The repository is mocked, so these
 * cover the read-validate-write sequence; the conditional UPDATE itself is
 * exercised against H2 in OrderRepositoryCasTest.
 */
@ExtendWith(MockitoExtension.class)
class OrderLifecycleServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    @Mock OrderRepository orderRepo;

    OrderLifecycleService service;

    @BeforeEach
    void setUp() {
        service = new OrderLifecycleService(orderRepo, new OrderStatusMachine(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void transition_matchingVersion_writesWithThatVersionAndNewStatus() {
        MotionOrder current = TestOrders.order(OrderStatus.INTAKE);
        MotionOrder after   = copyAt(current, OrderStatus.PROCESSING, 2);
        when(orderRepo.findById(current.getId())).thenReturn(Optional.of(current), Optional.of(after));
        when(orderRepo.compareAndSet(eq(current.getId()), eq(1L), eq(OrderStatus.PROCESSING), eq("I"),
                any(), any(), any(), any(), anyInt(), anyBoolean(), anyBoolean(), eq(NOW))).thenReturn(1);

        MotionOrder result = service.transition(current.getId(), 1, OrderStatus.PROCESSING, m -> m.currentPhase("I"));

        assertThat(result.getStatusVersion()).isEqualTo(2);
        assertThat(result.getStatus()).isEqualTo(OrderStatus.PROCESSING);
    }

    @Test
    void transition_staleVersion_conflictWithoutWriting() {
        MotionOrder current = TestOrders.order(OrderStatus.PROCESSING);
        current.setStatusVersion(5);
        when(orderRepo.findById(current.getId())).thenReturn(Optional.of(current));

        assertThatThrownBy(() -> service.transition(current.getId(), 4, OrderStatus.AWAITING_APPROVAL))
                .isInstanceOf(ConcurrencyConflictException.class)
                .hasMessageContaining("refresh and retry");
        verify(orderRepo, never()).compareAndSet(any(), anyLong(), any(), any(), any(), any(), any(), any(),
                anyInt(), anyBoolean(), anyBoolean(), any());
    }

    @Test
    void transition_lostRace_zeroRowsIsConflict() {
        MotionOrder current = TestOrders.order(OrderStatus.PROCESSING);
        when(orderRepo.findById(current.getId())).thenReturn(Optional.of(current));
        when(orderRepo.compareAndSet(any(), anyLong(), any(), any(), any(), any(), any(), any(),
                anyInt(), anyBoolean(), anyBoolean(), any())).thenReturn(0);

        assertThatThrownBy(() -> service.transition(current.getId(), 1, OrderStatus.HOLD_PENDING))
                .isInstanceOf(ConcurrencyConflictException.class);
    }

    @Test
    void transition_fromTerminal_rejectedBeforeWrite() {
        MotionOrder current = TestOrders.order(OrderStatus.COMPLETED);
        when(orderRepo.findById(current.getId())).thenReturn(Optional.of(current));

        assertThatThrownBy(() -> service.transition(current.getId(), 1, OrderStatus.PROCESSING))
                .isInstanceOf(IllegalTransitionException.class);
        verify(orderRepo, never()).compareAndSet(any(), anyLong(), any(), any(), any(), any(), any(), any(),
                anyInt(), anyBoolean(), anyBoolean(), any());
    }

    @Test
    void update_terminalOrder_refused() {
        MotionOrder current = TestOrders.order(OrderStatus.REFUNDED);
        when(orderRepo.findById(current.getId())).thenReturn(Optional.of(current));

        assertThatThrownBy(() -> service.update(current.getId(), 1, m -> m.revisionCount(1)))
                .isInstanceOf(IllegalTransitionException.class);
    }

    @Test
    void update_keepsStatusAndPassesEdits() {
        MotionOrder current = TestOrders.order(OrderStatus.PROCESSING);
        when(orderRepo.findById(current.getId())).thenReturn(Optional.of(current));
        when(orderRepo.compareAndSet(any(), anyLong(), any(), any(), any(), any(), any(), any(),
                anyInt(), anyBoolean(), anyBoolean(), any())).thenReturn(1);

        service.update(current.getId(), 1, m -> m.currentPhase("VIII").revisionCount(2));

        verify(orderRepo).compareAndSet(eq(current.getId()), eq(1L), eq(OrderStatus.PROCESSING), eq("VIII"),
                any(), isNull(), isNull(), isNull(), eq(2), eq(false), eq(false), eq(NOW));
    }

    @Test
    void get_missingOrder_notFound() {
        UUID id = UUID.randomUUID();
        when(orderRepo.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.get(id)).isInstanceOf(OrderNotFoundException.class);
    }

    private static MotionOrder copyAt(MotionOrder o, OrderStatus status, long version) {
        MotionOrder copy = TestOrders.order(status, o.getTier());
        TestOrders.setId(copy, o.getId());
        copy.setStatusVersion(version);
        return copy;
    }
}
