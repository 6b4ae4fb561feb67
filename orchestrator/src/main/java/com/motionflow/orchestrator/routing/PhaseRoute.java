package com.motionflow.orchestrator.routing;

/**
 * Routing decision for one (phase, tier) cell.
 *
 * @param model            Anthropic model id
 * @param reasoningBudget  extended-thinking budget in tokens, or null when the
 *                         phase runs without extended thinking
 * @param maxTokens        output token cap sent with the request
 * @param batchSize        how many citations one model call verifies
 */
public record PhaseRoute(String model, Integer reasoningBudget, int maxTokens, int batchSize) {

    public boolean usesReasoning() {
        return reasoningBudget != null;
    }
}
