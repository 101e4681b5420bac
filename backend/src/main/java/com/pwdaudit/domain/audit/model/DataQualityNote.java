package com.pwdaudit.domain.audit.model;

/**
 * Data-quality finding reported next to the flags. Never a red flag by itself.
 *
 * @param rowNumber source row the note is about
 * @param type      whether the whole row was dropped or only one rule was skipped
 * @param flagType  the skipped rule (null for excluded rows)
 * @param message   human-readable reason
 */
public record DataQualityNote(
        int rowNumber,
        Type type,
        FlagType flagType,
        String message
) {
    public enum Type {
        EXCLUDED_RECORD,
        RULE_SKIPPED
    }

    public static DataQualityNote excluded(int rowNumber, String message) {
        return new DataQualityNote(rowNumber, Type.EXCLUDED_RECORD, null, message);
    }

    public static DataQualityNote ruleSkipped(int rowNumber, FlagType flagType, String message) {
        return new DataQualityNote(rowNumber, Type.RULE_SKIPPED, flagType, message);
    }
}
