package com.pwdaudit.infrastructure.audit.pipeline;

import com.pwdaudit.domain.audit.model.AnalysisResult;
import com.pwdaudit.domain.audit.model.AnalysisSummary;
import com.pwdaudit.domain.audit.model.DataQualityNote;
import com.pwdaudit.domain.audit.model.Flag;
import com.pwdaudit.domain.audit.model.FlaggedRecord;
import com.pwdaudit.domain.audit.model.RecordRef;
import com.pwdaudit.domain.audit.model.Severity;
import com.pwdaudit.domain.audit.model.WorkRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Folds record-local and batch flags into the final red/green partition.
 * <p>
 * Per record, flags keep evaluation order: record rules first, then overlap, then splitting.
 * Records keep input order in both lists. Notes are stable-sorted by row number.
 * </p>
 */
@Component
public class FlagAggregator {

    public AnalysisResult aggregate(AnalysisPipelineContext ctx) {
        List<FlaggedRecord> red = new ArrayList<>();
        List<RecordRef> green = new ArrayList<>();

        for (WorkRecord record : ctx.getRecords()) {
            List<Flag> flags = new ArrayList<>(ctx.getRecordFlags().getOrDefault(record.rowNumber(), List.of()));
            flags.addAll(ctx.getBatchFindings().flagsFor(record.rowNumber()));

            if (flags.isEmpty()) {
                green.add(RecordRef.from(record));
            } else {
                red.add(new FlaggedRecord(RecordRef.from(record), flags, highestSeverity(flags)));
            }
        }

        List<DataQualityNote> notes = ctx.allNotes();
        notes.sort(Comparator.comparingInt(DataQualityNote::rowNumber));

        AnalysisSummary summary = AnalysisSummary.of(ctx.getTotalRows(), red, green, notes);
        return new AnalysisResult(ctx.getAsOf(), red, green, summary, notes);
    }

    static Severity highestSeverity(List<Flag> flags) {
        Severity highest = Severity.LOW;
        for (Flag flag : flags) {
            highest = Severity.max(highest, flag.severity());
        }
        return highest;
    }
}
