package com.pwdaudit.domain.audit.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one analysis run. Every valid record is in exactly one of
 * {@code redFlagged} or {@code greenFlagged}, both in input order.
 *
 * @param asOf             the date time-based rules were evaluated against
 * @param redFlagged       records with at least one flag
 * @param greenFlagged     records with none
 * @param summary          counters per flag type, severity and note type
 * @param dataQualityNotes excluded rows and skipped rules, in row order
 */
public record AnalysisResult(
        LocalDate asOf,
        List<FlaggedRecord> redFlagged,
        List<RecordRef> greenFlagged,
        AnalysisSummary summary,
        List<DataQualityNote> dataQualityNotes
) {
    public AnalysisResult {
        redFlagged = List.copyOf(redFlagged);
        greenFlagged = List.copyOf(greenFlagged);
        dataQualityNotes = List.copyOf(dataQualityNotes);
    }

    public Optional<FlaggedRecord> findRed(int rowNumber) {
        return redFlagged.stream().filter(r -> r.record().rowNumber() == rowNumber).findFirst();
    }

    public boolean isGreen(int rowNumber) {
        return greenFlagged.stream().anyMatch(r -> r.rowNumber() == rowNumber);
    }
}
