package com.motionflow.orchestrator.model;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One attempt at running a pipeline phase for an order.
 *
 * The scheduler claims a PENDING row via SELECT FOR UPDATE SKIP LOCKED,
 * sets status = IN_PROGRESS and worker_id, then a worker thread runs the
 * phase driver and records the outcome here.
 *
 * DB table: phase_executions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "phase_executions")
public class PhaseExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "order_id", nullable = false)
    private MotionOrder order;

    @Column(name = "phase_code", nullable = false)
    private String phaseCode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PhaseExecutionStatus status = PhaseExecutionStatus.PENDING;

    // How many times this phase has been attempted (starts at 0).
    @Column(nullable = false)
    private int attempt = 0;

    // Revision cycle this attempt belongs to; scopes the per-cycle budget.
    @Column(name = "revision_cycle", nullable = false)
    private int revisionCycle = 0;

    @Column(name = "quality_score", precision = 5, scale = 4)
    private BigDecimal qualityScore;

    @Column(name = "worker_id")
    private String workerId;

    @Column(name = "heartbeat_at")
    private Instant heartbeatAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    // Raw model output for the phase.
    @Column(name = "output_text", columnDefinition = "TEXT")
    private String outputText;

    // CitationReport as JSON, only for citation-bearing phases.
    @Column(name = "citation_summary", columnDefinition = "TEXT")
    private String citationSummary;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected PhaseExecution() {}   // required by JPA

    public PhaseExecution(MotionOrder order, PhaseCode phase, int revisionCycle) {
        this.order         = order;
        this.phaseCode     = phase.code();
        this.revisionCycle = revisionCycle;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID                 getId()             { return id; }
    public MotionOrder          getOrder()          { return order; }
    public String               getPhaseCode()      { return phaseCode; }
    public PhaseExecutionStatus getStatus()         { return status; }
    public int                  getAttempt()        { return attempt; }
    public int                  getRevisionCycle()  { return revisionCycle; }
    public BigDecimal           getQualityScore()   { return qualityScore; }
    public String               getWorkerId()       { return workerId; }
    public Instant              getHeartbeatAt()    { return heartbeatAt; }
    public Instant              getCreatedAt()      { return createdAt; }
    public Instant              getStartedAt()      { return startedAt; }
    public Instant              getFinishedAt()     { return finishedAt; }
    public String               getErrorMessage()   { return errorMessage; }
    public String               getOutputText()     { return outputText; }
    public String               getCitationSummary() { return citationSummary; }

    /** Typed phase; the column only ever holds codes written from {@link PhaseCode}. */
    public PhaseCode phase() {
        return PhaseCode.fromCode(phaseCode).orElseThrow(
                () -> new IllegalStateException("Corrupt phase code on execution " + id + ": " + phaseCode));
    }

    public void setStatus(PhaseExecutionStatus status)   { this.status = status; }
    public void setQualityScore(BigDecimal score)        { this.qualityScore = score; }
    public void setWorkerId(String workerId)             { this.workerId = workerId; }
    public void setHeartbeatAt(Instant t)                { this.heartbeatAt = t; }
    public void setStartedAt(Instant t)                  { this.startedAt = t; }
    public void setFinishedAt(Instant t)                 { this.finishedAt = t; }
    public void setErrorMessage(String errorMessage)     { this.errorMessage = errorMessage; }
    public void setOutputText(String outputText)         { this.outputText = outputText; }
    public void setCitationSummary(String summary)       { this.citationSummary = summary; }
    public void incrementAttempt()                       { this.attempt++; }
}
