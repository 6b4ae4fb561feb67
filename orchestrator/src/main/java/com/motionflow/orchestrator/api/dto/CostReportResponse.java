package com.motionflow.orchestrator.api.dto;

import com.motionflow.orchestrator.cost.CostBreakdown;
import com.motionflow.orchestrator.model.CostEntry;
import com.motionflow.orchestrator.model.CostSource;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/** GET /orders/{id}/costs: ledger rows plus the primary/retry split. */
public record CostReportResponse(BigDecimal primaryCents,
                                 BigDecimal retryCents,
                                 BigDecimal totalCents,
                                 BigDecimal retryOverheadPercent,
                                 List<Entry> entries) {

    public record Entry(String phase, String model, String tier, long inputTokens, long outputTokens,
                        BigDecimal costCents, CostSource source, int attempt, int revisionCycle,
                        Instant createdAt) {

        static Entry from(CostEntry c) {
            return new Entry(c.getPhaseCode(), c.getModel(), c.getTier(), c.getInputTokens(),
                    c.getOutputTokens(), c.getTotalCostCents(), c.getSource(), c.getAttempt(),
                    c.getRevisionCycle(), c.getCreatedAt());
        }
    }

    public static CostReportResponse from(CostBreakdown breakdown, List<CostEntry> entries) {
        return new CostReportResponse(
                breakdown.primaryCents(),
                breakdown.retryCents(),
                breakdown.totalCents(),
                breakdown.retryOverheadPercent().orElse(null),
                entries.stream().map(Entry::from).toList());
    }
}
