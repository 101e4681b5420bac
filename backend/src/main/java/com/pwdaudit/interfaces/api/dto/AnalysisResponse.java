package com.pwdaudit.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pwdaudit.domain.audit.model.AnalysisResult;
import com.pwdaudit.domain.audit.model.AnalysisSummary;
import com.pwdaudit.domain.audit.model.DataQualityNote;
import com.pwdaudit.domain.audit.model.Flag;
import com.pwdaudit.domain.audit.model.FlaggedRecord;
import com.pwdaudit.domain.audit.model.RecordRef;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisResponse(
        LocalDate asOf,
        Summary summary,
        List<RedFlaggedEntry> redFlagged,
        List<RecordEntry> greenFlagged,
        List<NoteEntry> dataQualityNotes
) {
    public record RecordEntry(int rowNumber, String serialNo, String budgetItemNo, String workName) {}

    public record FlagEntry(int flagId, String flagName, String severity, String description,
                            Map<String, Object> details) {}

    public record RedFlaggedEntry(RecordEntry record, String highestSeverity, List<FlagEntry> flags) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record NoteEntry(int rowNumber, String type, Integer flagId, String message) {}

    public record Summary(int totalRows, int validRecords, int excludedRows,
                          int redFlagged, int greenFlagged, int totalFlags,
                          Map<String, Integer> flagsByType,
                          Map<String, Integer> flagsBySeverity,
                          Map<String, Integer> notesByType) {}

    public static AnalysisResponse from(AnalysisResult result) {
        return new AnalysisResponse(
                result.asOf(),
                toSummary(result.summary()),
                result.redFlagged().stream().map(AnalysisResponse::toRedEntry).toList(),
                result.greenFlagged().stream().map(AnalysisResponse::toRecordEntry).toList(),
                result.dataQualityNotes().stream().map(AnalysisResponse::toNoteEntry).toList()
        );
    }

    private static RecordEntry toRecordEntry(RecordRef ref) {
        return new RecordEntry(ref.rowNumber(), ref.serialNo(), ref.budgetItemNo(), ref.workName());
    }

    private static RedFlaggedEntry toRedEntry(FlaggedRecord flagged) {
        return new RedFlaggedEntry(
                toRecordEntry(flagged.record()),
                flagged.highestSeverity().name(),
                flagged.flags().stream().map(AnalysisResponse::toFlagEntry).toList());
    }

    private static FlagEntry toFlagEntry(Flag flag) {
        return new FlagEntry(flag.flagId(), flag.flagName(), flag.severity().name(),
                flag.description(), flag.details());
    }

    private static NoteEntry toNoteEntry(DataQualityNote note) {
        Integer flagId = note.flagType() != null ? note.flagType().flagId() : null;
        return new NoteEntry(note.rowNumber(), note.type().name(), flagId, note.message());
    }

    private static Summary toSummary(AnalysisSummary summary) {
        Map<String, Integer> byType = new LinkedHashMap<>();
        summary.flagsByType().forEach((type, count) -> byType.put(type.flagName(), count));
        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        summary.flagsBySeverity().forEach((severity, count) -> bySeverity.put(severity.name(), count));
        Map<String, Integer> byNote = new LinkedHashMap<>();
        summary.notesByType().forEach((type, count) -> byNote.put(type.name(), count));

        return new Summary(summary.totalRows(), summary.validRecords(), summary.excludedRows(),
                summary.redFlaggedCount(), summary.greenFlaggedCount(), summary.totalFlags(),
                byType, bySeverity, byNote);
    }
}
