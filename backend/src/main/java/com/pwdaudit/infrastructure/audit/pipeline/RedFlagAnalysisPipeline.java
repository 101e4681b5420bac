package com.pwdaudit.infrastructure.audit.pipeline;

import com.pwdaudit.domain.audit.model.AnalysisResult;
import com.pwdaudit.domain.audit.model.AuditThresholds;
import com.pwdaudit.domain.audit.model.RawWorkRow;
import com.pwdaudit.domain.audit.model.WorkRecord;
import com.pwdaudit.domain.audit.service.RedFlagAnalysisService;
import com.pwdaudit.infrastructure.audit.batch.CrossRecordBatchAnalyzer;
import com.pwdaudit.infrastructure.audit.ingest.RecordValidation;
import com.pwdaudit.infrastructure.audit.ingest.WorkRecordFactory;
import com.pwdaudit.infrastructure.audit.rule.ExecutionWorkIndex;
import com.pwdaudit.infrastructure.audit.rule.RuleContext;
import com.pwdaudit.infrastructure.audit.rule.SingleRecordEvaluator;
import com.pwdaudit.infrastructure.audit.rule.SingleRecordEvaluator.RecordEvaluation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Orchestrates one analysis run:
 * <p>
 * validate → record rules (input order) → batch rules (whole set) → aggregate
 * </p>
 * Synchronous and free of I/O. The same rows, thresholds and date always give an equal result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedFlagAnalysisPipeline implements RedFlagAnalysisService {

    private final WorkRecordFactory workRecordFactory;
    private final SingleRecordEvaluator singleRecordEvaluator;
    private final CrossRecordBatchAnalyzer batchAnalyzer;
    private final FlagAggregator flagAggregator;

    @Override
    public AnalysisResult analyze(List<RawWorkRow> rows, AuditThresholds thresholds, LocalDate asOf) {
        AnalysisPipelineContext ctx = newContext(thresholds, asOf);
        ctx.setTotalRows(rows.size());

        // 1. Validate
        validate(ctx, rows);

        return run(ctx);
    }

    @Override
    public AnalysisResult analyzeRecords(List<WorkRecord> records, AuditThresholds thresholds, LocalDate asOf) {
        requireUniqueRows(records);
        AnalysisPipelineContext ctx = newContext(thresholds, asOf);
        ctx.setTotalRows(records.size());
        ctx.getRecords().addAll(records);

        return run(ctx);
    }

    private AnalysisResult run(AnalysisPipelineContext ctx) {
        log.info("Red flag analysis started: {} rows, {} valid records, as of {}",
                ctx.getTotalRows(), ctx.getRecords().size(), ctx.getAsOf());

        // 2. Record rules
        evaluateRecords(ctx);

        // 3. Batch rules
        ctx.setBatchFindings(batchAnalyzer.analyze(ctx.getRecords(), ctx.getThresholds()));

        // 4. Aggregate
        AnalysisResult result = flagAggregator.aggregate(ctx);

        log.info("Red flag analysis finished: {} red, {} green, {} flags, {} notes",
                result.summary().redFlaggedCount(), result.summary().greenFlaggedCount(),
                result.summary().totalFlags(), result.dataQualityNotes().size());
        return result;
    }

    private void validate(AnalysisPipelineContext ctx, List<RawWorkRow> rows) {
        requireUniqueRowNumbers(rows.stream().map(RawWorkRow::rowNumber).toList());
        for (RawWorkRow row : rows) {
            RecordValidation validation = workRecordFactory.validate(row);
            if (validation.isValid()) {
                ctx.getRecords().add(validation.record());
            } else {
                ctx.getExcludedNotes().add(validation.note());
            }
        }
        if (!ctx.getExcludedNotes().isEmpty()) {
            log.info("{} of {} rows excluded from analysis", ctx.getExcludedNotes().size(), rows.size());
        }
    }

    private void evaluateRecords(AnalysisPipelineContext ctx) {
        RuleContext ruleContext = new RuleContext(
                ctx.getThresholds(), ctx.getAsOf(), ExecutionWorkIndex.build(ctx.getRecords()));

        for (WorkRecord record : ctx.getRecords()) {
            RecordEvaluation evaluation = singleRecordEvaluator.evaluate(record, ruleContext);
            if (!evaluation.flags().isEmpty()) {
                ctx.getRecordFlags().put(record.rowNumber(), evaluation.flags());
            }
            ctx.getRuleNotes().addAll(evaluation.notes());
        }
    }

    private static AnalysisPipelineContext newContext(AuditThresholds thresholds, LocalDate asOf) {
        AnalysisPipelineContext ctx = new AnalysisPipelineContext();
        ctx.setThresholds(Objects.requireNonNull(thresholds, "thresholds"));
        ctx.setAsOf(Objects.requireNonNull(asOf, "asOf"));
        return ctx;
    }

    private static void requireUniqueRows(List<WorkRecord> records) {
        requireUniqueRowNumbers(records.stream().map(WorkRecord::rowNumber).toList());
    }

    private static void requireUniqueRowNumbers(List<Integer> rowNumbers) {
        Set<Integer> seen = new HashSet<>();
        for (Integer rowNumber : rowNumbers) {
            if (!seen.add(rowNumber)) {
                throw new IllegalArgumentException("Duplicate row number: " + rowNumber);
            }
        }
    }
}
