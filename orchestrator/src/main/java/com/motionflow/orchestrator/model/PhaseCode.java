package com.motionflow.orchestrator.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The fourteen steps of the motion generation pipeline, in execution order.
 *
 * Each constant carries its ordinal code as it appears on the wire and in
 * the phase_executions table ("V.1", "VIII.5", ...).
 */
public enum PhaseCode {
    I("I"),
    II("II"),
    III("III"),
    IV("IV"),
    V("V"),
    V_1("V.1"),
    VI("VI"),
    VII("VII"),
    VII_1("VII.1"),
    VIII("VIII"),
    VIII_5("VIII.5"),
    IX("IX"),
    IX_1("IX.1"),
    X("X");

    private final String code;

    PhaseCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /** 1-based position in the pipeline. */
    public int order() {
        return ordinal() + 1;
    }

    public boolean isFinal() {
        return this == X;
    }

    /**
     * Parse a phase code. Accepts "V.1" as well as "PHASE_V.1" and is
     * case-insensitive; anything else yields empty.
     */
    public static Optional<PhaseCode> fromCode(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String cleaned = raw.trim().toUpperCase();
        if (cleaned.startsWith("PHASE_")) cleaned = cleaned.substring("PHASE_".length());
        String candidate = cleaned;
        return Arrays.stream(values())
                .filter(p -> p.code.equals(candidate))
                .findFirst();
    }

    @Override
    public String toString() {
        return code;
    }
}
