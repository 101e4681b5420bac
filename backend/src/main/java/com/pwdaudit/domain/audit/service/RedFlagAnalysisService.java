package com.pwdaudit.domain.audit.service;

import com.pwdaudit.domain.audit.model.AnalysisResult;
import com.pwdaudit.domain.audit.model.AuditThresholds;
import com.pwdaudit.domain.audit.model.RawWorkRow;
import com.pwdaudit.domain.audit.model.WorkRecord;

import java.time.LocalDate;
import java.util.List;

/**
 * Domain service for red flag analysis of works expenditure ledgers.
 */
public interface RedFlagAnalysisService {

    /**
     * Validate raw rows, then analyze the valid ones. Rows that fail validation are
     * reported as data-quality notes in the result.
     *
     * @param rows       input rows in sheet order
     * @param thresholds thresholds for this run
     * @param asOf       "today" for the delay and survey follow-up rules
     * @return the complete result
     */
    AnalysisResult analyze(List<RawWorkRow> rows, AuditThresholds thresholds, LocalDate asOf);

    /**
     * Analyze records that are already validated.
     */
    AnalysisResult analyzeRecords(List<WorkRecord> records, AuditThresholds thresholds, LocalDate asOf);
}
