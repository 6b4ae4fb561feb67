package com.motionflow.orchestrator.citation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Deduplicated statutory citations, in first-seen order. */
public record StatutoryExtractionResult(List<StatutoryCitation> citations) {

    public StatutoryExtractionResult {
        citations = List.copyOf(citations);
    }

    public Map<String, List<StatutoryCitation>> byJurisdiction() {
        return citations.stream().collect(Collectors.groupingBy(
                StatutoryCitation::jurisdiction, LinkedHashMap::new, Collectors.toList()));
    }

    public Map<String, List<StatutoryCitation>> byFamily() {
        return citations.stream().collect(Collectors.groupingBy(
                StatutoryCitation::family, LinkedHashMap::new, Collectors.toList()));
    }

    public int count() {
        return citations.size();
    }
}
