package com.pwdaudit.infrastructure.audit.batch;

import com.pwdaudit.domain.audit.model.DataQualityNote;
import com.pwdaudit.domain.audit.model.Flag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Flags produced by cross-record rules, keyed by the row number of the record they belong to.
 */
public record BatchFindings(
        Map<Integer, List<Flag>> flagsByRow,
        List<DataQualityNote> notes
) {
    public BatchFindings {
        Map<Integer, List<Flag>> copy = new TreeMap<>();
        flagsByRow.forEach((row, flags) -> copy.put(row, List.copyOf(flags)));
        flagsByRow = Collections.unmodifiableMap(copy);
        notes = List.copyOf(notes);
    }

    public static BatchFindings empty() {
        return new BatchFindings(Map.of(), List.of());
    }

    public List<Flag> flagsFor(int rowNumber) {
        return flagsByRow.getOrDefault(rowNumber, List.of());
    }

    public int flagCount() {
        return flagsByRow.values().stream().mapToInt(List::size).sum();
    }

    /**
     * This object's flags first, then {@code other}'s, per row.
     */
    public BatchFindings merge(BatchFindings other) {
        Map<Integer, List<Flag>> merged = new TreeMap<>();
        flagsByRow.forEach((row, flags) -> merged.computeIfAbsent(row, r -> new ArrayList<>()).addAll(flags));
        other.flagsByRow.forEach((row, flags) -> merged.computeIfAbsent(row, r -> new ArrayList<>()).addAll(flags));
        List<DataQualityNote> mergedNotes = new ArrayList<>(notes);
        mergedNotes.addAll(other.notes);
        return new BatchFindings(merged, mergedNotes);
    }
}
