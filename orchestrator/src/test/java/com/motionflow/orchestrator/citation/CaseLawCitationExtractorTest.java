package com.motionflow.orchestrator.citation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CaseLawCitationExtractorTest {

    private final CaseLawCitationExtractor extractor = new CaseLawCitationExtractor();

    @Test
    void parallelCitation_splitsIntoOneCitationPerReporter() {
        String text = "Bell Atl. Corp. v. Twombly, 550 U.S. 544, 555, 127 S. Ct. 1955, 167 L. Ed. 2d 929 (2007).";

        assertThat(extractor.extract(text))
                .containsExactly("550 U.S. 544, 555", "127 S. Ct. 1955", "167 L. Ed. 2d 929");
    }

    @Test
    void pinpointsAndRangesStayWithTheirCase() {
        assertThat(extractor.extract("See 477 U.S. 317, 322-23, 325 (1986)."))
                .containsExactly("477 U.S. 317, 322-23, 325");
    }

    @Test
    void codeSectionsAreNotCaseLaw() {
        assertThat(extractor.extract("Under 42 U.S.C. 1983 and 28 U.S.C. 1331.")).isEmpty();
    }

    @Test
    void blankText_extractsNothing() {
        assertThat(extractor.extract(null)).isEmpty();
        assertThat(extractor.extract("  ")).isEmpty();
    }

    @Test
    void parallelCitation_countsEachReporterAsAnAuthority() {
        CaseLawCitationParser parser = new CaseLawCitationParser();
        CitationAnalyzer analyzer = new CitationAnalyzer(extractor, new CitationTruncationFilter(),
                new CaseLawDeduplicator(parser), new StatutoryCitationExtractor());

        CitationReport report = analyzer.analyze("550 U.S. 544, 555, 127 S. Ct. 1955, 167 L. Ed. 2d 929 (2007)");

        assertThat(report.caseLaw()).hasSize(3);
        assertThat(report.caseLaw().get(0).pinpoints()).containsExactly("555");
    }
}
