package com.motionflow.orchestrator.cost;

import com.motionflow.orchestrator.model.CostEntry;
import com.motionflow.orchestrator.model.CostSource;
import com.motionflow.orchestrator.repository.CostEntryRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CostTracker. The repository is mocked; pricing is real.
 */
@ExtendWith(MockitoExtension.class)
class CostTrackerTest {

    @Mock CostEntryRepository       costRepo;
    @Mock ApplicationEventPublisher events;

    SimpleMeterRegistry meters;
    CostTracker tracker;

    private final UUID orderId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        meters  = new SimpleMeterRegistry();
        tracker = new CostTracker(costRepo, new ModelPricing(PricingProperties.defaults()), events, meters);
    }

    // ------------------------------------------------------------------
    // record()
    // ------------------------------------------------------------------

    @Test
    void record_validTier_storesEntryWithComputedCost() {
        when(costRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));

        CostEntry entry = tracker.record(request("B", CostSource.PRIMARY));

        assertThat(entry.getTier()).isEqualTo("B");
        assertThat(entry.getTotalCostCents()).isEqualByComparingTo("1.05");
        assertThat(meters.counter("motionflow.cost.recorded", "tier", "B", "source", "PRIMARY").count())
                .isEqualTo(1.0);
        verifyNoInteractions(events);
    }

    @Test
    void record_unknownTier_stillWritesUnderSentinelAndAlerts() {
        when(costRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));

        CostEntry entry = tracker.record(request("Z", CostSource.RETRY));

        assertThat(entry.getTier()).isEqualTo(CostEntry.UNKNOWN_TIER);
        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(events).publishEvent(event.capture());
        assertThat(event.getValue()).isInstanceOfSatisfying(UnknownTierRecordedEvent.class,
                e -> assertThat(e.rawTier()).isEqualTo("Z"));
    }

    @Test
    void record_nullTier_treatedAsUnknown() {
        when(costRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));

        CostEntry entry = tracker.record(request(null, CostSource.PRIMARY));

        assertThat(entry.getTier()).isEqualTo(CostEntry.UNKNOWN_TIER);
    }

    // ------------------------------------------------------------------
    // Aggregates
    // ------------------------------------------------------------------

    @Test
    void costBySource_computesRetryOverhead() {
        when(costRepo.sumByOrderAndSource(orderId, CostSource.PRIMARY)).thenReturn(new BigDecimal("200"));
        when(costRepo.sumByOrderAndSource(orderId, CostSource.RETRY)).thenReturn(new BigDecimal("50"));

        CostBreakdown b = tracker.costBySource(orderId);

        assertThat(b.totalCents()).isEqualByComparingTo("250");
        assertThat(b.retryOverheadPercent()).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("25"));
    }

    @Test
    void breakdown_noPrimarySpend_hasNoOverhead() {
        CostBreakdown b = CostTracker.breakdown(BigDecimal.ZERO, new BigDecimal("3"));

        assertThat(b.retryOverheadPercent()).isEmpty();
        assertThat(b.totalCents()).isEqualByComparingTo("3");
    }

    private CostRecordRequest request(String tier, CostSource source) {
        return new CostRecordRequest(orderId, "V", "claude-sonnet-4-20250514", tier,
                1_000, 500, source, 1, 0, null);
    }
}
