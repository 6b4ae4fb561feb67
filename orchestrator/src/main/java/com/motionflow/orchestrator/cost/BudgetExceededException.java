package com.motionflow.orchestrator.cost;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Hard spend limit breached. The phase driver turns this into a protocol
 * exit; it never reaches an API caller.
 */
public class BudgetExceededException extends RuntimeException {

    private final UUID orderId;
    private final BigDecimal spentCents;
    private final BigDecimal limitCents;

    public BudgetExceededException(UUID orderId, String scope, BigDecimal spentCents, BigDecimal limitCents) {
        super("Order %s breached %s budget: spent %s cents, limit %s cents"
                .formatted(orderId, scope, spentCents.toPlainString(), limitCents.toPlainString()));
        this.orderId    = orderId;
        this.spentCents = spentCents;
        this.limitCents = limitCents;
    }

    public UUID       orderId()    { return orderId; }
    public BigDecimal spentCents() { return spentCents; }
    public BigDecimal limitCents() { return limitCents; }
}
