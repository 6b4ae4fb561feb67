package com.motionflow.orchestrator.cost;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Out-of-band alerting for ledger rows that could not be attributed to a tier.
 * Runs on the async pool so the cost write path never waits on it.
 */
@Component
public class CostAlertListener {

    private static final Logger log = LoggerFactory.getLogger(CostAlertListener.class);

    private final Counter unknownTier;

    public CostAlertListener(MeterRegistry meters) {
        this.unknownTier = Counter.builder("motionflow.cost.unknown_tier")
                .description("Cost entries recorded with the UNKNOWN tier sentinel")
                .register(meters);
    }

    @Async
    @EventListener
    public void onUnknownTier(UnknownTierRecordedEvent e) {
        unknownTier.increment();
        log.error("Cost entry {} for order {} (phase {}) recorded with UNKNOWN tier; caller passed '{}'",
                e.costEntryId(), e.orderId(), e.phaseCode(), e.rawTier());
    }
}
