package com.motionflow.orchestrator.citation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a single case-law citation string into volume / reporter / page /
 * pinpoints. A trailing court-and-year parenthetical is tolerated and dropped.
 *
 *   "123 So.3d 456, 460"            -> 123 | So.3d | 456 | [460]
 *   "185 So. 3d 94 (La. 2016)"      -> 185 | So.3d | 94  | []
 *   "550 U.S. 544, 555-56, 570"     -> 550 | U.S.  | 544 | [555-56, 570]
 */
@Component
public class CaseLawCitationParser {

    private static final Pattern CITATION = Pattern.compile(
            "^\\s*(\\d{1,4})\\s+([A-Za-z][A-Za-z0-9.'\\s]*?)\\s+(\\d{1,5})"
          + "((?:\\s*,\\s*\\d{1,5}(?:\\s*[-–]\\s*\\d{1,5})?)*)"
          + "\\s*(?:\\([^)]*\\))?\\s*\\.?\\s*$");

    private static final Pattern PINPOINT = Pattern.compile("\\d{1,5}(?:\\s*[-–]\\s*\\d{1,5})?");

    public Optional<CaseLawCitation> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        Matcher m = CITATION.matcher(raw);
        if (!m.matches()) return Optional.empty();

        String reporter = normaliseReporter(m.group(2));
        if (reporter.isEmpty() || reporter.chars().noneMatch(Character::isLetter)) return Optional.empty();

        return Optional.of(new CaseLawCitation(
                raw.trim(),
                Integer.parseInt(m.group(1)),
                reporter,
                Integer.parseInt(m.group(3)),
                pinpoints(m.group(4))));
    }

    static String normaliseReporter(String reporter) {
        return reporter.replaceAll("\\s+", "");
    }

    private static List<String> pinpoints(String tail) {
        if (tail == null || tail.isBlank()) return List.of();
        Set<String> seen = new LinkedHashSet<>();
        Matcher m = PINPOINT.matcher(tail);
        while (m.find()) {
            seen.add(m.group().replaceAll("\\s+", "").replace('–', '-'));
        }
        return new ArrayList<>(seen);
    }
}
