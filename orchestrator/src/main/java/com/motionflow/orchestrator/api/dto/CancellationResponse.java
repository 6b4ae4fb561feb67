package com.motionflow.orchestrator.api.dto;

import com.motionflow.orchestrator.refund.RefundSuggestion;

public record CancellationResponse(OrderResponse order, RefundSuggestion refund) {}
