package com.motionflow.orchestrator.routing;

/**
 * Thrown when a (phase, tier) pair has no routing entry.
 *
 * Always fatal: callers must never substitute a default model or budget.
 */
public class LookupException extends RuntimeException {

    public LookupException(String message) {
        super(message);
    }
}
