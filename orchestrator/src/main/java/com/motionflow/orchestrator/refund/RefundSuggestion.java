package com.motionflow.orchestrator.refund;

/**
 * Advisory refund for an order cancelled at a given phase.
 *
 * @param percentage           0..100
 * @param amountCents          paid x percentage / 100, rounded half-up
 * @param requiresManualReview the phase was not recognised and the 50% fallback applied
 */
public record RefundSuggestion(int percentage, long amountCents, String phase,
                               boolean requiresManualReview, String reasoning) {}
