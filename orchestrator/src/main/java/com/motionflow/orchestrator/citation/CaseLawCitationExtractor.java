package com.motionflow.orchestrator.citation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls "volume reporter page[, pinpoint...]" strings out of motion text.
 *
 * Reporters are listed longest form first so "F. Supp. 2d" is not read as
 * "F.". "U.S." must not be followed by "C." so code sections stay out.
 * A number followed by a reporter is the volume of the next parallel
 * citation, never a pinpoint of the current one.
 */
@Component
public class CaseLawCitationExtractor {

    private static final String REPORTER = String.join("|",
            "U\\.\\s?S\\.(?!\\s?C\\.)",
            "S\\.\\s?Ct\\.",
            "L\\.\\s?Ed\\.(?:\\s?2d)?",
            "F\\.\\s?Supp\\.(?:\\s?(?:2d|3d))?",
            "F\\.(?:\\s?(?:2d|3d|4th))?",
            "B\\.\\s?R\\.",
            "Fed\\.\\s?Cl\\.",
            "So\\.(?:\\s?(?:2d|3d))?",
            "S\\.\\s?E\\.(?:\\s?2d)?",
            "N\\.\\s?E\\.(?:\\s?(?:2d|3d))?",
            "N\\.\\s?W\\.(?:\\s?2d)?",
            "S\\.\\s?W\\.(?:\\s?(?:2d|3d))?",
            "A\\.(?:\\s?(?:2d|3d))?",
            "P\\.(?:\\s?(?:2d|3d))?",
            "Cal\\.\\s?Rptr\\.(?:\\s?(?:2d|3d))?",
            "Cal\\.\\s?App\\.(?:\\s?(?:2d|3d|4th|5th))?",
            "Cal\\.(?:\\s?(?:2d|3d|4th|5th))?",
            "N\\.\\s?Y\\.\\s?S\\.(?:\\s?(?:2d|3d))?",
            "N\\.\\s?Y\\.(?:\\s?(?:2d|3d))?",
            "Wis\\.(?:\\s?2d)?",
            "Ill\\.(?:\\s?2d)?");

    private static final Pattern CITATION = Pattern.compile(
            "\\b(\\d{1,4})\\s+(?:" + REPORTER + ")\\s+\\d{1,5}(?![\\d:])"
          + "(?:\\s*,\\s*\\d{1,5}(?:\\s*[-–]\\s*\\d{1,5})?(?![\\d:])(?!\\s+(?:" + REPORTER + ")))*");

    public List<String> extract(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) return out;
        Matcher m = CITATION.matcher(text);
        while (m.find()) {
            out.add(m.group().trim());
        }
        return out;
    }
}
