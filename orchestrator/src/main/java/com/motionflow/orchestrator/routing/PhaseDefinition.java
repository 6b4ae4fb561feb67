package com.motionflow.orchestrator.routing;

import com.motionflow.orchestrator.model.PhaseCode;

/** Static metadata for one pipeline phase. */
public record PhaseDefinition(PhaseCode code, String displayName, int executionOrder, String promptKey) {}
