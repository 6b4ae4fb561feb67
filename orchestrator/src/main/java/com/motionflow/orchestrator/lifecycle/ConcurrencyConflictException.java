package com.motionflow.orchestrator.lifecycle;

import java.util.UUID;

/**
 * The caller's view of the order is stale. Not a fault: refetch and retry.
 */
public class ConcurrencyConflictException extends RuntimeException {

    private final UUID orderId;
    private final long expectedVersion;

    public ConcurrencyConflictException(UUID orderId, long expectedVersion, Long actualVersion) {
        super(actualVersion == null
                ? "Order %s changed concurrently (expected version %d); refresh and retry"
                        .formatted(orderId, expectedVersion)
                : "Order %s is at version %d, caller expected %d; refresh and retry"
                        .formatted(orderId, actualVersion, expectedVersion));
        this.orderId = orderId;
        this.expectedVersion = expectedVersion;
    }

    public UUID orderId()         { return orderId; }
    public long expectedVersion() { return expectedVersion; }
}
