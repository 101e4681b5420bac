package com.pwdaudit.domain.audit.model;

import java.util.Locale;

public enum WorkType {
    SURVEY,
    ORIGINAL,
    IMPROVEMENT,
    MAINTENANCE,
    OTHER;

    /**
     * Every type except SURVEY puts something on the ground.
     */
    public boolean isExecutionPhase() {
        return this != SURVEY;
    }

    public static WorkType fromText(String text) {
        if (text == null || text.isBlank()) {
            return OTHER;
        }
        String value = text.trim().toLowerCase(Locale.ROOT);
        if (value.contains("survey") || value.contains("सर्वेक्षण")) return SURVEY;
        if (value.contains("maint") || value.contains("repair") || value.contains("देखभाल")) return MAINTENANCE;
        if (value.contains("improv") || value.contains("widen") || value.contains("strength")) return IMPROVEMENT;
        if (value.contains("original") || value.contains("new") || value.contains("construct")) return ORIGINAL;
        return OTHER;
    }
}
