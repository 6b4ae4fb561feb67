package com.motionflow.orchestrator.citation;

import java.util.List;

/** Both citation pipelines' output for one phase. */
public record CitationReport(List<CaseLawCitation> caseLaw,
                             List<CitationTruncationFilter.Removal> truncationsRemoved,
                             int unparseableCaseLaw,
                             StatutoryExtractionResult statutory) {

    public int uniqueAuthorityCount() {
        return caseLaw.size() + statutory.count();
    }
}
