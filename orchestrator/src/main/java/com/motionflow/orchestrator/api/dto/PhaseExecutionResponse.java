package com.motionflow.orchestrator.api.dto;

import com.motionflow.orchestrator.model.PhaseExecution;
import com.motionflow.orchestrator.model.PhaseExecutionStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of one phase execution returned by GET /orders/{id}/phases.
 * citationSummary is the citation report JSON for drafting and revision phases.
 */
public record PhaseExecutionResponse(
        UUID                 id,
        String               phase,
        PhaseExecutionStatus status,
        int                  attempt,
        int                  revisionCycle,
        BigDecimal           qualityScore,
        String               workerId,
        Instant              createdAt,
        Instant              startedAt,
        Instant              finishedAt,
        String               errorMessage,
        String               citationSummary
) {
    public static PhaseExecutionResponse from(PhaseExecution e) {
        return new PhaseExecutionResponse(
                e.getId(),
                e.getPhaseCode(),
                e.getStatus(),
                e.getAttempt(),
                e.getRevisionCycle(),
                e.getQualityScore(),
                e.getWorkerId(),
                e.getCreatedAt(),
                e.getStartedAt(),
                e.getFinishedAt(),
                e.getErrorMessage(),
                e.getCitationSummary()
        );
    }
}
