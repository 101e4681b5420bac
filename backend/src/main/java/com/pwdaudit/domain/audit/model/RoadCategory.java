package com.pwdaudit.domain.audit.model;

import java.util.Locale;

public enum RoadCategory {
    SH,
    MDR,
    NH,
    OTHER;

    /**
     * Lenient lookup used by the row factory. Accepts the short code or the long form
     * ("State Highway", "Major District Road", "National Highway"); anything else is OTHER.
     */
    public static RoadCategory fromText(String text) {
        if (text == null || text.isBlank()) {
            return OTHER;
        }
        String value = text.trim().toUpperCase(Locale.ROOT).replaceAll("[^A-Z]", "");
        return switch (value) {
            case "SH", "STATEHIGHWAY" -> SH;
            case "MDR", "MAJORDISTRICTROAD" -> MDR;
            case "NH", "NATIONALHIGHWAY" -> NH;
            default -> OTHER;
        };
    }
}
