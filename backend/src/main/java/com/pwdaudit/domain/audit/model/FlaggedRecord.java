package com.pwdaudit.domain.audit.model;

import java.util.List;

/**
 * A red-flagged record with its flags in evaluation order.
 */
public record FlaggedRecord(
        RecordRef record,
        List<Flag> flags,
        Severity highestSeverity
) {
    public FlaggedRecord {
        flags = List.copyOf(flags);
    }

    public boolean hasFlag(FlagType type) {
        return flags.stream().anyMatch(f -> f.flagType() == type);
    }
}
