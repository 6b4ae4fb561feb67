package com.motionflow.orchestrator.service;

import com.motionflow.orchestrator.model.ExecutionTier;
import com.motionflow.orchestrator.model.MotionOrder;
import com.motionflow.orchestrator.model.PhaseCode;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

/**
 * Which phase comes next on the straight-through path.
 *
 * VIII (revisions) and VII.1 (post-revision citation check) only run inside
 * the revision loop the driver starts after a failed judge simulation, so
 * the straight path never lands on them. Tier A orders skip opposition
 * anticipation (VI) and caption validation (VIII.5); the separate statement
 * check (IX.1) only runs when the motion needs one.
 */
@Component
public class PhasePlanner {

    private static final Set<PhaseCode> REVISION_LOOP_ONLY = Set.of(PhaseCode.VIII, PhaseCode.VII_1);

    public PhaseCode first() {
        return PhaseCode.I;
    }

    public boolean shouldSkip(PhaseCode phase, MotionOrder order) {
        return switch (phase) {
            case VI, VIII_5 -> order.getTier() == ExecutionTier.A;
            case IX_1 -> !order.isSeparateStatementRequired();
            default -> false;
        };
    }

    /** Next phase after {@code completed} on the straight path, or empty after X. */
    public Optional<PhaseCode> next(PhaseCode completed, MotionOrder order) {
        PhaseCode[] all = PhaseCode.values();
        for (int i = completed.ordinal() + 1; i < all.length; i++) {
            PhaseCode candidate = all[i];
            if (REVISION_LOOP_ONLY.contains(candidate)) continue;
            if (shouldSkip(candidate, order)) continue;
            return Optional.of(candidate);
        }
        return Optional.empty();
    }
}
