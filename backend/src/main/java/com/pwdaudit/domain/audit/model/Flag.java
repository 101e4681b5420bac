package com.pwdaudit.domain.audit.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One violation found on one record.
 *
 * @param flagType    which of the eight rules fired
 * @param severity    LOW, MEDIUM or HIGH
 * @param description human-readable sentence for the report
 * @param details     rule-specific evidence in insertion order; peer records are referenced by row number
 */
public record Flag(
        FlagType flagType,
        Severity severity,
        String description,
        Map<String, Object> details
) {
    public Flag {
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public int flagId() {
        return flagType.flagId();
    }

    public String flagName() {
        return flagType.flagName();
    }
}
