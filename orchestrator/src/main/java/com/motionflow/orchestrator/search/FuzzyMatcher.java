package com.motionflow.orchestrator.search;

import java.util.Locale;

/**
 * Edit-distance similarity for free-text order search. Pure and stateless.
 *
 *   query is a substring of target      -> 1.0
 *   otherwise                           -> 1 - levenshtein / max(len)
 *   target starts with query's first 3  -> +0.2, capped at 1.0
 *   either side empty                   -> 0.0
 *
 * Comparison is case-insensitive.
 */
public final class FuzzyMatcher {

    static final double PREFIX_BOOST = 0.2;
    static final int    PREFIX_LENGTH = 3;

    private FuzzyMatcher() {}

    public static double score(String query, String target) {
        if (query == null || target == null) return 0.0;
        String q = query.trim().toLowerCase(Locale.ROOT);
        String t = target.trim().toLowerCase(Locale.ROOT);
        if (q.isEmpty() || t.isEmpty()) return 0.0;
        if (t.contains(q)) return 1.0;

        int maxLen = Math.max(q.length(), t.length());
        double score = 1.0 - (double) levenshtein(q, t) / maxLen;
        if (q.length() >= PREFIX_LENGTH && t.startsWith(q.substring(0, PREFIX_LENGTH))) {
            score = Math.min(1.0, score + PREFIX_BOOST);
        }
        return Math.max(0.0, score);
    }

    /** Classic two-row dynamic programme. */
    public static int levenshtein(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) prev[j] = j;

        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }
}
