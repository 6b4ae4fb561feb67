package com.motionflow.orchestrator.citation;

import java.util.List;

/**
 * A parsed case-law citation such as {@code 123 So.3d 456, 460}.
 *
 * {@code reporter} is whitespace-normalised ("So. 3d" and "So.3d" compare
 * equal). Pinpoints keep first-seen order with duplicates removed.
 */
public record CaseLawCitation(String raw, int volume, String reporter, int page, List<String> pinpoints) {

    public CaseLawCitation {
        pinpoints = List.copyOf(pinpoints);
    }

    /** Grouping key: volume, reporter and first page, ignoring pinpoints. */
    public String baseKey() {
        return volume + " " + reporter + " " + page;
    }

    /** Canonical text, pinpoints included. Parsing it back yields an equal citation. */
    public String canonical() {
        return pinpoints.isEmpty() ? baseKey() : baseKey() + ", " + String.join(", ", pinpoints);
    }
}
