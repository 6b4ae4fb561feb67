package com.motionflow.orchestrator.citation;

import java.util.List;

/**
 * Registered statutory citation forms, applied in this order.
 *
 * Supporting a new jurisdiction means appending entries here.
 */
public final class StatutoryPatternTable {

    private static final String SECTION = "\\s*§+\\s*";
    private static final String ART     = "\\s*Art(?:icle|s)?\\.?\\s*";

    public static final List<StatutoryPattern> DEFAULT = List.of(
            // Louisiana
            StatutoryPattern.of("\\bLa\\.\\s*C\\.\\s*C\\.\\s*P\\." + ART + "(\\d+(?:\\.\\d+)?)",
                    "LA_CODE_CIV_PROC", "LA"),
            StatutoryPattern.of("\\bLa\\.\\s*Code\\s+Civ\\.\\s*Proc\\." + ART + "(\\d+(?:\\.\\d+)?)",
                    "LA_CODE_CIV_PROC", "LA"),
            StatutoryPattern.of("\\bLa\\.\\s*C\\.\\s*C\\." + ART + "(\\d+(?:\\.\\d+)?)",
                    "LA_CIVIL_CODE", "LA"),
            StatutoryPattern.of("\\bLa\\.\\s*C\\.\\s*E\\." + ART + "(\\d+(?:\\.\\d+)?)",
                    "LA_CODE_EVID", "LA"),
            StatutoryPattern.of("\\bLa\\.\\s*R\\.\\s*S\\.\\s*(\\d+):\\s*(\\d+(?:\\.\\d+)?)",
                    "LA_REVISED_STATUTES", "LA"),
            // California
            StatutoryPattern.of("\\bCal(?:\\.|ifornia)\\s*(?:Code\\s+)?Civ(?:\\.|il)\\s*Proc(?:\\.|edure)\\s*(?:Code)?" + SECTION
                            + "(\\d+[a-z]?(?:\\.\\d+)?)",
                    "CA_CODE_CIV_PROC", "CA"),
            StatutoryPattern.of("\\bCode\\s+Civ\\.\\s*Proc\\." + SECTION + "(\\d+[a-z]?(?:\\.\\d+)?)",
                    "CA_CODE_CIV_PROC", "CA"),
            StatutoryPattern.of("\\bCal\\.\\s*Evid\\.\\s*Code" + SECTION + "(\\d+(?:\\.\\d+)?)",
                    "CA_EVID_CODE", "CA"),
            StatutoryPattern.of("\\bCal\\.\\s*Civ\\.\\s*Code" + SECTION + "(\\d+(?:\\.\\d+)?)",
                    "CA_CIVIL_CODE", "CA"),
            // Federal
            StatutoryPattern.of("\\b(\\d+)\\s+U\\.\\s*S\\.\\s*C\\.(?:\\s*A\\.)?" + SECTION + "(\\d+[a-z]?)",
                    "USC", "FED"),
            StatutoryPattern.of("\\b(\\d+)\\s+C\\.\\s*F\\.\\s*R\\.\\s*§*\\s*(\\d+(?:\\.\\d+)?)",
                    "CFR", "FED"),
            StatutoryPattern.of("\\bFed\\.\\s*R\\.\\s*Civ\\.\\s*P\\.\\s*(\\d+(?:\\.\\d+)?)",
                    "FRCP", "FED"),
            StatutoryPattern.of("\\bFed\\.\\s*R\\.\\s*Evid\\.\\s*(\\d+)",
                    "FRE", "FED")
    );

    private StatutoryPatternTable() {}
}
