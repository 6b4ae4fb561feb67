package com.motionflow.orchestrator.model;

/**
 * Execution state of a single phase attempt.
 *
 * Transitions:
 *   PENDING     → IN_PROGRESS (claimed by a worker)
 *   IN_PROGRESS → COMPLETED | REQUIRES_REVIEW | BLOCKED
 *   IN_PROGRESS → FAILED   (max attempts exhausted or fatal error)
 *   FAILED      → PENDING  (reset for retry, increments attempt counter)
 */
public enum PhaseExecutionStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    BLOCKED,
    FAILED,
    REQUIRES_REVIEW
}
