package com.motionflow.orchestrator.cost;

import java.util.UUID;

/** A ledger row was written with the UNKNOWN tier sentinel. */
public record UnknownTierRecordedEvent(UUID costEntryId, UUID orderId, String phaseCode, String rawTier) {}
