package com.motionflow.orchestrator.api.dto;

import com.motionflow.orchestrator.search.OrderSearchService;

public record SearchHitResponse(OrderResponse order, double score) {

    public static SearchHitResponse from(OrderSearchService.Hit hit) {
        return new SearchHitResponse(OrderResponse.from(hit.order()), hit.score());
    }
}
