package com.motionflow.orchestrator.citation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Finds statute and court-rule references in free text.
 *
 * Patterns run in table order. A citation is identified by (family,
 * article), compared case-insensitively; the first occurrence wins and later
 * repeats are dropped. Output is sorted by position in the text.
 */
@Component
public class StatutoryCitationExtractor {

    private final List<StatutoryPattern> patterns;

    public StatutoryCitationExtractor() {
        this(StatutoryPatternTable.DEFAULT);
    }

    public StatutoryCitationExtractor(List<StatutoryPattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    public StatutoryExtractionResult extract(String text) {
        if (text == null || text.isBlank()) return new StatutoryExtractionResult(List.of());

        record Hit(int start, StatutoryCitation citation) {}
        Set<String> seen = new HashSet<>();
        List<Hit> hits = new ArrayList<>();

        for (StatutoryPattern p : patterns) {
            Matcher m = p.pattern().matcher(text);
            while (m.find()) {
                String article = p.article(m);
                String key = (p.family() + "|" + article).toLowerCase(Locale.ROOT);
                if (seen.add(key)) {
                    hits.add(new Hit(m.start(), StatutoryCitation.unverified(
                            m.group().trim(), p.jurisdiction(), p.family(), article)));
                }
            }
        }
        hits.sort(Comparator.comparingInt(Hit::start));
        return new StatutoryExtractionResult(hits.stream().map(Hit::citation).toList());
    }
}
