package com.motionflow.orchestrator.cost;

import com.motionflow.orchestrator.model.CostSource;

import java.util.UUID;

/**
 * Everything needed to append one ledger row.
 *
 * {@code tier} is a raw string: the tracker validates it and
 * falls back to the UNKNOWN sentinel instead of refusing the write.
 */
public record CostRecordRequest(UUID orderId,
                                String phaseCode,
                                String model,
                                String tier,
                                long inputTokens,
                                long outputTokens,
                                CostSource source,
                                int attempt,
                                int revisionCycle,
                                String metadata) {}
