package com.motionflow.orchestrator.lifecycle;

import java.time.Duration;
import java.time.Instant;

/**
 * Escalation ladder for an order waiting on customer evidence.
 *
 *   < 24h    INITIAL
 *   >= 24h   REMINDER
 *   >= 72h   ESCALATION
 *   >= 168h  FINAL_REMINDER
 *   >= 336h  AUTO_CANCEL
 */
public final class HoldPolicy {

    public enum Stage { INITIAL, REMINDER, ESCALATION, FINAL_REMINDER, AUTO_CANCEL }

    public static final Duration REMINDER_AFTER       = Duration.ofHours(24);
    public static final Duration ESCALATION_AFTER     = Duration.ofHours(72);
    public static final Duration FINAL_REMINDER_AFTER = Duration.ofHours(168);
    public static final Duration AUTO_CANCEL_AFTER    = Duration.ofHours(336);

    private HoldPolicy() {}

    public static Instant expiresAt(Instant triggeredAt) {
        return triggeredAt.plus(AUTO_CANCEL_AFTER);
    }

    public static Stage stage(Instant triggeredAt, Instant now) {
        Duration waited = Duration.between(triggeredAt, now);
        if (waited.compareTo(AUTO_CANCEL_AFTER) >= 0)    return Stage.AUTO_CANCEL;
        if (waited.compareTo(FINAL_REMINDER_AFTER) >= 0) return Stage.FINAL_REMINDER;
        if (waited.compareTo(ESCALATION_AFTER) >= 0)     return Stage.ESCALATION;
        if (waited.compareTo(REMINDER_AFTER) >= 0)       return Stage.REMINDER;
        return Stage.INITIAL;
    }
}
