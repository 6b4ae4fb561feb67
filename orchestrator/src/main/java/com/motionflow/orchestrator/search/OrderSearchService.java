package com.motionflow.orchestrator.search;

import com.motionflow.orchestrator.model.MotionOrder;
import com.motionflow.orchestrator.repository.OrderRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Admin free-text search over orders. Each order scores the best of its
 * order number, motion type and customer email against the query.
 */
@Service
public class OrderSearchService {

    public static final double DEFAULT_MIN_SCORE = 0.5;

    private final OrderRepository orderRepo;

    public OrderSearchService(OrderRepository orderRepo) {
        this.orderRepo = orderRepo;
    }

    public record Hit(MotionOrder order, double score) {}

    @Transactional(readOnly = true)
    public List<Hit> search(String query, double minScore, int limit) {
        if (query == null || query.isBlank()) return List.of();
        return orderRepo.findAll().stream()
                .map(o -> new Hit(o, score(query, o)))
                .filter(h -> h.score() >= minScore)
                .sorted(Comparator.comparingDouble(Hit::score).reversed()
                        .thenComparing(h -> h.order().getCreatedAt(), Comparator.reverseOrder()))
                .limit(Math.max(1, limit))
                .toList();
    }

    static double score(String query, MotionOrder order) {
        return Stream.of(order.getOrderNumber(), order.getMotionType(), order.getCustomerEmail())
                .mapToDouble(field -> FuzzyMatcher.score(query, field))
                .max()
                .orElse(0.0);
    }
}
