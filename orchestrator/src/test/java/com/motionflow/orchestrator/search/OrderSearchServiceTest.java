package com.motionflow.orchestrator.search;

import com.motionflow.orchestrator.model.ExecutionTier;
import com.motionflow.orchestrator.model.MotionOrder;
import com.motionflow.orchestrator.model.PricingTier;
import com.motionflow.orchestrator.repository.OrderRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrderSearchServiceTest {

    @Mock OrderRepository orderRepo;

    @Test
    void search_ranksBestFieldMatchFirstAndDropsWeakHits() {
        MotionOrder compel = order("MF-20260101-AAAAAA", "MOTION_TO_COMPEL", "alice@firm.com");
        MotionOrder msj    = order("MF-20260102-BBBBBB", "SUMMARY_JUDGMENT", "bob@firm.com");
        when(orderRepo.findAll()).thenReturn(List.of(msj, compel));

        List<OrderSearchService.Hit> hits = new OrderSearchService(orderRepo)
                .search("alice", OrderSearchService.DEFAULT_MIN_SCORE, 10);

        assertThat(hits).extracting(OrderSearchService.Hit::order).containsExactly(compel);
        assertThat(hits.get(0).score()).isEqualTo(1.0);
    }

    @Test
    void blankQuery_returnsNothingWithoutLoading() {
        assertThat(new OrderSearchService(orderRepo).search(" ", 0.5, 10)).isEmpty();
        verifyNoInteractions(orderRepo);
    }

    private static MotionOrder order(String number, String type, String email) {
        return new MotionOrder(number, type, email, ExecutionTier.A, PricingTier.A, 29_900L);
    }
}
