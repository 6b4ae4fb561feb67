package com.motionflow.orchestrator.citation;

/**
 * A statute, code article or court rule found in motion text.
 *
 * {@code verified} is always false: the extractor only recognises the shape
 * of a reference, it does not check that the provision exists.
 */
public record StatutoryCitation(String raw, String jurisdiction, String family, String article, boolean verified) {

    public static StatutoryCitation unverified(String raw, String jurisdiction, String family, String article) {
        return new StatutoryCitation(raw, jurisdiction, family, article, false);
    }
}
