package com.motionflow.orchestrator.citation;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the case-law and statutory pipelines side by side over one text.
 * The two never share results: a statute is not a case and vice versa.
 */
@Component
public class CitationAnalyzer {

    private final CaseLawCitationExtractor   caseLawExtractor;
    private final CitationTruncationFilter   truncationFilter;
    private final CaseLawDeduplicator        deduplicator;
    private final StatutoryCitationExtractor statutoryExtractor;

    public CitationAnalyzer(CaseLawCitationExtractor caseLawExtractor,
                            CitationTruncationFilter truncationFilter,
                            CaseLawDeduplicator deduplicator,
                            StatutoryCitationExtractor statutoryExtractor) {
        this.caseLawExtractor   = caseLawExtractor;
        this.truncationFilter   = truncationFilter;
        this.deduplicator       = deduplicator;
        this.statutoryExtractor = statutoryExtractor;
    }

    public CitationReport analyze(String text) {
        return analyze(text, caseLawExtractor.extract(text));
    }

    /** Analyze with a case-law list supplied by the caller (e.g. one the model returned). */
    public CitationReport analyze(String text, List<String> rawCaseLaw) {
        CitationTruncationFilter.Result filtered = truncationFilter.filter(rawCaseLaw);
        CaseLawDeduplicator.Result deduped = deduplicator.dedup(filtered.kept());
        return new CitationReport(
                deduped.citations(),
                filtered.removed(),
                deduped.unparseable(),
                statutoryExtractor.extract(text));
    }
}
