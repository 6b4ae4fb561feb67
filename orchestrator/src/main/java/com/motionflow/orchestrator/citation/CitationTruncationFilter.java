package com.motionflow.orchestrator.citation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Removes partial case-law extractions before deduplication.
 *
 * Extractors regularly emit a cut-off copy of a citation next to the full
 * one, e.g. "185 So. 3" alongside "185 So. 3d 94". The short copy looks like
 * a complete citation (volume 185, reporter So., page 3), so completeness
 * alone cannot catch it. Candidates are checked longest first:
 *
 *   1. prefix of a kept citation whose continuation
 *      starts a reporter series ("d ", "th ", ...)    -> SERIES_TRUNCATION
 *   2. incomplete prefix of a kept citation          -> PREFIX_TRUNCATION
 *   3. incomplete non-prefix substring of one        -> SUBSTRING_OF_LONGER_CITATION
 *   4. no volume, reporter or page on its own        -> INCOMPLETE
 *
 * "100 F.3d 200" and "100 F.3d 200, 205" are both complete and both kept;
 * merging them is the deduplicator's job.
 */
@Component
public class CitationTruncationFilter {

    public enum Reason { INCOMPLETE, SERIES_TRUNCATION, PREFIX_TRUNCATION, SUBSTRING_OF_LONGER_CITATION }

    public record Removal(String citation, Reason reason, String subsumedBy) {}

    public record Result(List<String> kept, List<Removal> removed) {}

    private static final Pattern SERIES_CONTINUATION = Pattern.compile("^(?:d|th|nd|rd|st)\\s", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_VOLUME = Pattern.compile("^\\d+\\s");
    private static final Pattern TRAILING_NUMBER = Pattern.compile("\\d+\\s*(?:\\([^)]*\\))?\\s*$");

    private static final List<Pattern> REPORTERS = List.of(
            // federal
            Pattern.compile("U\\.\\s*S\\."), Pattern.compile("S\\.\\s*Ct\\."), Pattern.compile("L\\.\\s*Ed\\."),
            Pattern.compile("F\\.(?:\\s*(?:2d|3d|4th))?"), Pattern.compile("F\\.\\s*Supp\\.(?:\\s*(?:2d|3d))?"),
            Pattern.compile("B\\.\\s*R\\."), Pattern.compile("Fed\\.\\s*Cl\\."),
            // regional
            Pattern.compile("So\\.(?:\\s*(?:2d|3d))?"), Pattern.compile("S\\.\\s*E\\.(?:\\s*2d)?"),
            Pattern.compile("N\\.\\s*E\\.(?:\\s*(?:2d|3d))?"), Pattern.compile("N\\.\\s*W\\.(?:\\s*2d)?"),
            Pattern.compile("S\\.\\s*W\\.(?:\\s*(?:2d|3d))?"), Pattern.compile("A\\.(?:\\s*(?:2d|3d))?"),
            Pattern.compile("P\\.(?:\\s*(?:2d|3d))?"),
            // state
            Pattern.compile("Cal\\.\\s*(?:2d|3d|4th|5th|App\\.|Rptr\\.)?"),
            Pattern.compile("N\\.\\s*Y\\.(?:\\s*S\\.(?:\\s*(?:2d|3d))?)?"),
            Pattern.compile("La\\."), Pattern.compile("Wis\\.(?:\\s*2d)?"), Pattern.compile("Ill\\.(?:\\s*2d)?"));

    public Result filter(List<String> raw) {
        List<String> candidates = new ArrayList<>();
        for (String r : raw) {
            if (r != null && !r.isBlank()) candidates.add(r.trim());
        }
        candidates.sort(Comparator.comparingInt(String::length).reversed());

        List<Removal> removed = new ArrayList<>();
        List<String> kept = new ArrayList<>();
        for (String c : candidates) {
            Optional<Removal> removal = kept.stream()
                    .map(longer -> truncationOf(c, longer))
                    .flatMap(Optional::stream)
                    .findFirst();
            if (removal.isPresent()) removed.add(removal.get());
            else if (!isComplete(c)) removed.add(new Removal(c, Reason.INCOMPLETE, null));
            else kept.add(c);
        }
        // restore input order for the survivors
        List<String> ordered = new ArrayList<>();
        for (String r : raw) {
            if (r != null && kept.remove(r.trim())) ordered.add(r.trim());
        }
        return new Result(ordered, removed);
    }

    /** Volume, a known reporter and a trailing page number. */
    public static boolean isComplete(String citation) {
        if (citation == null) return false;
        String s = citation.trim();
        if (s.length() < 6) return false;
        if (!LEADING_VOLUME.matcher(s).find()) return false;
        if (REPORTERS.stream().noneMatch(p -> p.matcher(s).find())) return false;
        return TRAILING_NUMBER.matcher(s).find();
    }

    private static Optional<Removal> truncationOf(String shorter, String longer) {
        if (shorter.length() >= longer.length()) return Optional.empty();

        if (longer.startsWith(shorter)) {
            String continuation = longer.substring(shorter.length());
            if (SERIES_CONTINUATION.matcher(continuation).find()) {
                return Optional.of(new Removal(shorter, Reason.SERIES_TRUNCATION, longer));
            }
            return isComplete(shorter) ? Optional.empty()
                    : Optional.of(new Removal(shorter, Reason.PREFIX_TRUNCATION, longer));
        }

        String s = shorter.toLowerCase(Locale.ROOT);
        String l = longer.toLowerCase(Locale.ROOT);
        if (l.contains(s) && !isComplete(shorter)) {
            return Optional.of(new Removal(shorter, Reason.SUBSTRING_OF_LONGER_CITATION, longer));
        }
        return Optional.empty();
    }
}
