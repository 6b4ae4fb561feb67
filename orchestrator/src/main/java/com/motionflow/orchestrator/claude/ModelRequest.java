package com.motionflow.orchestrator.claude;

import com.motionflow.orchestrator.routing.PhaseRoute;

/**
 * One model call. Routing fields always come from a {@link PhaseRoute}.
 */
public record ModelRequest(String model, Integer reasoningBudget, int maxTokens, String system, String prompt) {

    public static ModelRequest from(PhaseRoute route, String system, String prompt) {
        return new ModelRequest(route.model(), route.reasoningBudget(), route.maxTokens(), system, prompt);
    }
}
