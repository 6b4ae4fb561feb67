package com.motionflow.orchestrator.citation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CitationAnalyzerTest {

    private final CaseLawCitationParser parser = new CaseLawCitationParser();
    private final CitationAnalyzer analyzer = new CitationAnalyzer(
            new CaseLawCitationExtractor(),
            new CitationTruncationFilter(),
            new CaseLawDeduplicator(parser),
            new StatutoryCitationExtractor());

    @Test
    void caseLawAndStatutesCountedSeparately() {
        CitationReport report = analyzer.analyze("""
                Under Celotex Corp. v. Catrett, 477 U.S. 317, 322 (1986), the movant bears the burden.
                Louisiana follows suit. Babin v. Winn-Dixie, 764 So. 2d 37, 40 (La. 2000).
                The court again noted in Celotex, 477 U.S. 317, 325, that ...
                See La. C.C.P. Art. 966 and 42 U.S.C. § 1983.
                """);

        assertThat(report.caseLaw()).extracting(CaseLawCitation::baseKey)
                .containsExactly("477 U.S. 317", "764 So.2d 37");
        assertThat(report.caseLaw().get(0).pinpoints()).containsExactly("322", "325");
        assertThat(report.statutory().count()).isEqualTo(2);
        assertThat(report.uniqueAuthorityCount()).isEqualTo(4);
    }

    @Test
    void codeSectionsAreNotReadAsCaseLaw() {
        CitationReport report = analyzer.analyze("42 U.S.C. § 1983 and 28 U.S.C. § 1331");

        assertThat(report.caseLaw()).isEmpty();
        assertThat(report.statutory().count()).isEqualTo(2);
    }
}
