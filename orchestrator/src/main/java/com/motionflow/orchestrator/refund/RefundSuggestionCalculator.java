package com.motionflow.orchestrator.refund;

import com.motionflow.orchestrator.model.PhaseCode;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Suggests how much of the payment to return when an order is cancelled,
 * based on how far through the pipeline the work got.
 *
 *   I, II, III                         85%   research not yet started
 *   IV                                 65%   research done
 *   V, V.1, VI                         40%   draft exists
 *   VII, VII.1, VIII, VIII.5, IX, IX.1 20%   review and revision work done
 *   X                                   0%   assembly finished, admin discretion
 *   unknown / missing                  50%   flagged for manual review
 *
 * The figure is advisory. Admins may refund a different amount through
 * {@link #validateOverride} with a written justification.
 */
@Component
public class RefundSuggestionCalculator {

    static final int FALLBACK_PERCENTAGE = 50;
    static final int MIN_JUSTIFICATION_LENGTH = 10;

    private final Clock clock;

    public RefundSuggestionCalculator() {
        this(Clock.systemUTC());
    }

    RefundSuggestionCalculator(Clock clock) {
        this.clock = clock;
    }

    public RefundSuggestion calculateRefundSuggestion(long paidCents, String phase) {
        if (paidCents < 0) throw new IllegalArgumentException("paidCents must not be negative");

        PhaseCode code = PhaseCode.fromCode(phase).orElse(null);
        if (code == null) {
            return new RefundSuggestion(FALLBACK_PERCENTAGE, amount(paidCents, FALLBACK_PERCENTAGE),
                    phase, true, "Phase '" + phase + "' not recognised; manual review required");
        }
        int pct = percentageFor(code);
        return new RefundSuggestion(pct, amount(paidCents, pct), code.code(), false, reasoning(code));
    }

    /** Full refund, used when a protocol exit cancels an order with nothing to deliver. */
    public RefundSuggestion fullRefund(long paidCents, String phase) {
        return fullRefund(paidCents, phase, "Order cancelled by the system before a deliverable existed");
    }

    /** Full refund with the caller's reason, e.g. a hold that timed out. */
    public RefundSuggestion fullRefund(long paidCents, String phase, String reasoning) {
        return new RefundSuggestion(100, paidCents, phase, false, reasoning);
    }

    /**
     * @throws InvalidRefundOverrideException if the actual amount differs from
     *         the suggestion without a justification of at least ten characters,
     *         or lies outside 0..paid
     */
    public void validateOverride(RefundSuggestion suggested, long paidCents, long actualCents, String justification) {
        if (actualCents < 0 || actualCents > paidCents) {
            throw new InvalidRefundOverrideException(
                    "Refund amount " + actualCents + " must be between 0 and " + paidCents);
        }
        if (actualCents != suggested.amountCents()) {
            String trimmed = justification == null ? "" : justification.trim();
            if (trimmed.length() < MIN_JUSTIFICATION_LENGTH) {
                throw new InvalidRefundOverrideException(
                        "Overriding the suggested refund requires a justification of at least "
                                + MIN_JUSTIFICATION_LENGTH + " characters");
            }
        }
    }

    public RefundAuditRecord buildAuditRecord(UUID orderId, RefundSuggestion suggested, long paidCents,
                                              long actualCents, String justification, String adminId) {
        int actualPct = paidCents == 0 ? 0 : BigDecimal.valueOf(actualCents)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(paidCents), 0, RoundingMode.HALF_UP)
                .intValue();
        return new RefundAuditRecord(orderId, suggested.phase(), paidCents,
                suggested.percentage(), suggested.amountCents(),
                actualPct, actualCents,
                actualCents != suggested.amountCents(),
                justification == null ? null : justification.trim(),
                adminId, Instant.now(clock));
    }

    static int percentageFor(PhaseCode phase) {
        return switch (phase) {
            case I, II, III -> 85;
            case IV -> 65;
            case V, V_1, VI -> 40;
            case VII, VII_1, VIII, VIII_5, IX, IX_1 -> 20;
            case X -> 0;
        };
    }

    private static String reasoning(PhaseCode phase) {
        return switch (phase) {
            case I, II, III -> "Cancelled before legal research began";
            case IV -> "Research complete, drafting not started";
            case V, V_1, VI -> "Initial draft produced";
            case VII, VII_1, VIII, VIII_5, IX, IX_1 -> "Review and revision work performed";
            case X -> "Final assembly complete; any refund is at admin discretion";
        };
    }

    private static long amount(long paidCents, int percentage) {
        return BigDecimal.valueOf(paidCents)
                .multiply(BigDecimal.valueOf(percentage))
                .divide(BigDecimal.valueOf(100), 0, RoundingMode.HALF_UP)
                .longValueExact();
    }
}
