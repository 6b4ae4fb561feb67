package com.motionflow.orchestrator.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls structured pieces out of a phase's model output:
 *   1. the <result> block   : the phase deliverable handed to later phases
 *   2. the judge grade      : numeric "score" (0..1 or 0..100) or letter "grade" ("B+")
 */
public final class ResponseParser {

    private static final Pattern RESULT_TAG = Pattern.compile("<result>(.*?)</result>", Pattern.DOTALL);

    private static final Pattern NUMERIC_SCORE = Pattern.compile(
            "\"(?:score|quality_score|numeric_grade)\"\\s*:\\s*(\\d+(?:\\.\\d+)?)");

    private static final Pattern LETTER_GRADE = Pattern.compile(
            "\"grade\"\\s*:\\s*\"([A-Fa-f][+-]?)\"");

    // B+ is the pass mark
    private static final Map<String, BigDecimal> LETTER_VALUES = Map.ofEntries(
            Map.entry("A+", new BigDecimal("0.97")), Map.entry("A",  new BigDecimal("0.93")),
            Map.entry("A-", new BigDecimal("0.90")), Map.entry("B+", new BigDecimal("0.87")),
            Map.entry("B",  new BigDecimal("0.83")), Map.entry("B-", new BigDecimal("0.80")),
            Map.entry("C+", new BigDecimal("0.77")), Map.entry("C",  new BigDecimal("0.73")),
            Map.entry("C-", new BigDecimal("0.70")), Map.entry("D+", new BigDecimal("0.67")),
            Map.entry("D",  new BigDecimal("0.63")), Map.entry("D-", new BigDecimal("0.60")),
            Map.entry("F",  new BigDecimal("0.50")));

    private ResponseParser() {}

    /** Content of the first <result>...</result>, or empty when the model omitted it. */
    public static Optional<String> extractResult(String response) {
        if (response == null) return Optional.empty();
        Matcher m = RESULT_TAG.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }

    /** The deliverable text: the <result> block when present, else the whole response. */
    public static String deliverable(String response) {
        return extractResult(response).orElse(response == null ? "" : response.strip());
    }

    /**
     * Judge-simulation quality score on a 0..1 scale. A numeric score wins
     * over a letter grade; values above 1 are read as percentages.
     */
    public static Optional<BigDecimal> extractQualityScore(String response) {
        if (response == null) return Optional.empty();
        Matcher numeric = NUMERIC_SCORE.matcher(response);
        if (numeric.find()) {
            BigDecimal v = new BigDecimal(numeric.group(1));
            if (v.compareTo(BigDecimal.ONE) > 0) v = v.divide(BigDecimal.valueOf(100), 4, RoundingMode.HALF_UP);
            return v.compareTo(BigDecimal.ONE) > 0 ? Optional.empty() : Optional.of(v);
        }
        Matcher letter = LETTER_GRADE.matcher(response);
        if (letter.find()) {
            return Optional.ofNullable(LETTER_VALUES.get(letter.group(1).toUpperCase()));
        }
        return Optional.empty();
    }
}
