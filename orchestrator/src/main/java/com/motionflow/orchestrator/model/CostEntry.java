package com.motionflow.orchestrator.model;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One row of the model-call cost ledger.
 *
 * Append-only: there are no setters, and nothing updates or deletes rows.
 * The order id is a plain column rather than a relation so ledger inserts
 * never touch (or lock) the order row.
 *
 * DB table: cost_entries  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "cost_entries")
public class CostEntry {

    /** Stored in the tier column when the caller passed no valid execution tier. */
    public static final String UNKNOWN_TIER = "UNKNOWN";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "order_id", nullable = false, updatable = false)
    private UUID orderId;

    @Column(name = "phase_code", nullable = false, updatable = false)
    private String phaseCode;

    @Column(nullable = false, updatable = false)
    private String model;

    // "A" | "B" | "C" | "UNKNOWN"
    @Column(nullable = false, updatable = false)
    private String tier;

    @Column(name = "input_tokens", nullable = false, updatable = false)
    private long inputTokens;

    @Column(name = "output_tokens", nullable = false, updatable = false)
    private long outputTokens;

    // Minor currency units (cents), fractional.
    @Column(name = "total_cost_cents", nullable = false, updatable = false, precision = 14, scale = 4)
    private BigDecimal totalCostCents;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private CostSource source;

    @Column(nullable = false, updatable = false)
    private int attempt;

    @Column(name = "revision_cycle", nullable = false, updatable = false)
    private int revisionCycle;

    // Free-form JSON (error text, request id, ...).
    @Column(columnDefinition = "TEXT", updatable = false)
    private String metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected CostEntry() {}   // required by JPA

    public CostEntry(UUID orderId, String phaseCode, String model, String tier,
                     long inputTokens, long outputTokens, BigDecimal totalCostCents,
                     CostSource source, int attempt, int revisionCycle, String metadata) {
        this.orderId        = orderId;
        this.phaseCode      = phaseCode;
        this.model          = model;
        this.tier           = tier;
        this.inputTokens    = inputTokens;
        this.outputTokens   = outputTokens;
        this.totalCostCents = totalCostCents;
        this.source         = source;
        this.attempt        = attempt;
        this.revisionCycle  = revisionCycle;
        this.metadata       = metadata;
    }

    public UUID       getId()             { return id; }
    public UUID       getOrderId()        { return orderId; }
    public String     getPhaseCode()      { return phaseCode; }
    public String     getModel()          { return model; }
    public String     getTier()           { return tier; }
    public long       getInputTokens()    { return inputTokens; }
    public long       getOutputTokens()   { return outputTokens; }
    public BigDecimal getTotalCostCents() { return totalCostCents; }
    public CostSource getSource()         { return source; }
    public int        getAttempt()        { return attempt; }
    public int        getRevisionCycle()  { return revisionCycle; }
    public String     getMetadata()       { return metadata; }
    public Instant    getCreatedAt()      { return createdAt; }
}
