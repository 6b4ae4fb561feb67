package com.motionflow.orchestrator.citation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Collapses case-law citations that point at the same case.
 *
 * Citations are grouped by {@link CaseLawCitation#baseKey()}; each group
 * becomes one citation whose pinpoints are the ordered union of the group's
 * pinpoints. Groups keep the order in which their first member appeared.
 * Running the result back through {@link #dedupCitations} changes nothing.
 *
 * Statutory references never come through here; see
 * {@link StatutoryCitationExtractor}.
 */
@Component
public class CaseLawDeduplicator {

    private final CaseLawCitationParser parser;

    public CaseLawDeduplicator(CaseLawCitationParser parser) {
        this.parser = parser;
    }

    /** Parse then dedup raw strings. Unparseable strings are dropped and counted. */
    public Result dedup(List<String> raw) {
        List<CaseLawCitation> parsed = new ArrayList<>();
        int unparseable = 0;
        for (String s : raw) {
            Optional<CaseLawCitation> c = parser.parse(s);
            if (c.isPresent()) parsed.add(c.get());
            else unparseable++;
        }
        List<CaseLawCitation> unique = dedupCitations(parsed);
        return new Result(unique, raw.size(), unparseable, parsed.size() - unique.size());
    }

    public List<CaseLawCitation> dedupCitations(List<CaseLawCitation> citations) {
        Map<String, CaseLawCitation> first = new LinkedHashMap<>();
        Map<String, Set<String>> pinpoints = new LinkedHashMap<>();
        for (CaseLawCitation c : citations) {
            first.putIfAbsent(c.baseKey(), c);
            pinpoints.computeIfAbsent(c.baseKey(), k -> new LinkedHashSet<>()).addAll(c.pinpoints());
        }

        List<CaseLawCitation> out = new ArrayList<>(first.size());
        first.forEach((key, head) -> {
            List<String> merged = new ArrayList<>(pinpoints.get(key));
            CaseLawCitation m = new CaseLawCitation(head.raw(), head.volume(), head.reporter(), head.page(), merged);
            // raw of a merged group is its canonical form so a second pass sees the same text
            out.add(merged.equals(head.pinpoints()) ? m
                    : new CaseLawCitation(m.canonical(), m.volume(), m.reporter(), m.page(), merged));
        });
        return out;
    }

    /**
     * @param citations       unique citations, pinpoints merged
     * @param inputCount      raw strings received
     * @param unparseable     strings that were not a volume/reporter/page citation
     * @param mergedAway      parsed citations folded into another entry
     */
    public record Result(List<CaseLawCitation> citations, int inputCount, int unparseable, int mergedAway) {}
}
