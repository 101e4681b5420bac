package com.pwdaudit.domain.audit.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Counters for the report header.
 */
public record AnalysisSummary(
        int totalRows,
        int validRecords,
        int excludedRows,
        int redFlaggedCount,
        int greenFlaggedCount,
        int totalFlags,
        Map<FlagType, Integer> flagsByType,
        Map<Severity, Integer> flagsBySeverity,
        Map<DataQualityNote.Type, Integer> notesByType
) {
    public AnalysisSummary {
        flagsByType = Collections.unmodifiableMap(new EnumMap<>(flagsByType));
        flagsBySeverity = Collections.unmodifiableMap(new EnumMap<>(flagsBySeverity));
        notesByType = Collections.unmodifiableMap(new EnumMap<>(notesByType));
    }

    public static AnalysisSummary of(int totalRows,
                                     List<FlaggedRecord> red,
                                     List<RecordRef> green,
                                     List<DataQualityNote> notes) {
        Map<FlagType, Integer> byType = new EnumMap<>(FlagType.class);
        for (FlagType type : FlagType.values()) byType.put(type, 0);
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) bySeverity.put(severity, 0);
        Map<DataQualityNote.Type, Integer> byNote = new EnumMap<>(DataQualityNote.Type.class);
        for (DataQualityNote.Type type : DataQualityNote.Type.values()) byNote.put(type, 0);

        int totalFlags = 0;
        for (FlaggedRecord record : red) {
            for (Flag flag : record.flags()) {
                byType.merge(flag.flagType(), 1, Integer::sum);
                bySeverity.merge(flag.severity(), 1, Integer::sum);
                totalFlags++;
            }
        }
        for (DataQualityNote note : notes) {
            byNote.merge(note.type(), 1, Integer::sum);
        }

        int valid = red.size() + green.size();
        return new AnalysisSummary(totalRows, valid, totalRows - valid,
                red.size(), green.size(), totalFlags, byType, bySeverity, byNote);
    }
}
