package com.motionflow.orchestrator.refund;

import java.time.Instant;
import java.util.UUID;

/** What an admin refunded compared with what the calculator suggested. */
public record RefundAuditRecord(UUID orderId,
                                String phase,
                                long paidCents,
                                int suggestedPercentage,
                                long suggestedAmountCents,
                                int actualPercentage,
                                long actualAmountCents,
                                boolean deviated,
                                String justification,
                                String adminId,
                                Instant recordedAt) {}
