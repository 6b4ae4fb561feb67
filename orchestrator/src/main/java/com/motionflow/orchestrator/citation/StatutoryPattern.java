package com.motionflow.orchestrator.citation;

import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One recognisable citation form. The article/section is every capture
 * group of the pattern joined with ':' (so "La. R.S. 9:2800" and
 * "42 U.S.C. § 1983" both yield title:section).
 */
public record StatutoryPattern(Pattern pattern, String family, String jurisdiction) {

    public static StatutoryPattern of(String regex, String family, String jurisdiction) {
        return new StatutoryPattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), family, jurisdiction);
    }

    String article(Matcher m) {
        StringJoiner joined = new StringJoiner(":");
        for (int g = 1; g <= m.groupCount(); g++) {
            if (m.group(g) != null) joined.add(m.group(g).replaceAll("\\s+", ""));
        }
        return joined.toString();
    }
}
