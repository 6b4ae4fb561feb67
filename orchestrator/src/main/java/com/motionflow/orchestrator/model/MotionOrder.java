package com.motionflow.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One motion-drafting order submitted by a customer.
 *
 * Every lifecycle write goes through {@code OrderRepository#compareAndSet},
 * which bumps status_version by exactly one and only succeeds when the caller
 * presents the version it last observed. Setters exist for intake and tests;
 * services never save a loaded order back wholesale.
 *
 * DB table: orders  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "orders")
public class MotionOrder {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "order_number", nullable = false, unique = true)
    private String orderNumber;

    @Column(name = "motion_type", nullable = false)
    private String motionType;

    @Column(name = "customer_email", nullable = false)
    private String customerEmail;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OrderStatus status = OrderStatus.INTAKE;

    // Optimistic lock. Starts at 1, +1 per successful write.
    @Column(name = "status_version", nullable = false)
    private long statusVersion = 1;

    // Execution tier after resolveEffectiveTier; drives routing and budgets.
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExecutionTier tier;

    // What the customer paid for.
    @Enumerated(EnumType.STRING)
    @Column(name = "pricing_tier", nullable = false)
    private PricingTier pricingTier;

    @Column(name = "current_phase")
    private String currentPhase;

    @Column(name = "amount_paid_cents", nullable = false)
    private long amountPaidCents;

    @Column(name = "cost_cap_triggered", nullable = false)
    private boolean costCapTriggered = false;

    @Column(name = "hold_reason")
    private String holdReason;

    @Column(name = "hold_triggered_at")
    private Instant holdTriggeredAt;

    @Column(name = "hold_expires_at")
    private Instant holdExpiresAt;

    @Column(name = "revision_count", nullable = false)
    private int revisionCount = 0;

    // Litigation hold: blocks automatic cancellation and retention deletion.
    @Column(name = "legal_hold", nullable = false)
    private boolean legalHold = false;

    // Set once drafting (phase V) has produced a motion we could hand over.
    @Column(name = "deliverable_ready", nullable = false)
    private boolean deliverableReady = false;

    @Column(name = "separate_statement_required", nullable = false)
    private boolean separateStatementRequired = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected MotionOrder() {}   // required by JPA

    public MotionOrder(String orderNumber, String motionType, String customerEmail,
                       ExecutionTier tier, PricingTier pricingTier, long amountPaidCents) {
        this.orderNumber     = orderNumber;
        this.motionType      = motionType;
        this.customerEmail   = customerEmail;
        this.tier            = tier;
        this.pricingTier     = pricingTier;
        this.amountPaidCents = amountPaidCents;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()                  { return id; }
    public String        getOrderNumber()         { return orderNumber; }
    public String        getMotionType()          { return motionType; }
    public String        getCustomerEmail()       { return customerEmail; }
    public OrderStatus   getStatus()              { return status; }
    public long          getStatusVersion()       { return statusVersion; }
    public ExecutionTier getTier()                { return tier; }
    public PricingTier   getPricingTier()         { return pricingTier; }
    public String        getCurrentPhase()        { return currentPhase; }
    public long          getAmountPaidCents()     { return amountPaidCents; }
    public boolean       isCostCapTriggered()     { return costCapTriggered; }
    public String        getHoldReason()          { return holdReason; }
    public Instant       getHoldTriggeredAt()     { return holdTriggeredAt; }
    public Instant       getHoldExpiresAt()       { return holdExpiresAt; }
    public int           getRevisionCount()       { return revisionCount; }
    public boolean       isLegalHold()            { return legalHold; }
    public boolean       isDeliverableReady()     { return deliverableReady; }
    public boolean       isSeparateStatementRequired() { return separateStatementRequired; }
    public Instant       getCreatedAt()           { return createdAt; }
    public Instant       getUpdatedAt()           { return updatedAt; }

    public void setStatus(OrderStatus status)                 { this.status = status; }
    public void setStatusVersion(long v)                      { this.statusVersion = v; }
    public void setTier(ExecutionTier tier)                   { this.tier = tier; }
    public void setCurrentPhase(String currentPhase)          { this.currentPhase = currentPhase; }
    public void setCostCapTriggered(boolean v)                { this.costCapTriggered = v; }
    public void setHoldReason(String holdReason)              { this.holdReason = holdReason; }
    public void setHoldTriggeredAt(Instant t)                 { this.holdTriggeredAt = t; }
    public void setHoldExpiresAt(Instant t)                   { this.holdExpiresAt = t; }
    public void setRevisionCount(int v)                       { this.revisionCount = v; }
    public void setLegalHold(boolean v)                       { this.legalHold = v; }
    public void setDeliverableReady(boolean v)                { this.deliverableReady = v; }
    public void setSeparateStatementRequired(boolean v)       { this.separateStatementRequired = v; }
}
