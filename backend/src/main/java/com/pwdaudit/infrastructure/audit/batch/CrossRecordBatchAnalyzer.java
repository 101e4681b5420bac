package com.pwdaudit.infrastructure.audit.batch;

import com.pwdaudit.domain.audit.model.AuditThresholds;
import com.pwdaudit.domain.audit.model.WorkRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the rules that compare records with each other: overlapping works, then splitting.
 * Reads the whole record set, writes only flags keyed by row number.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CrossRecordBatchAnalyzer {

    private final OverlappingWorksDetector overlappingWorksDetector;
    private final SplittingWorksDetector splittingWorksDetector;

    public BatchFindings analyze(List<WorkRecord> records, AuditThresholds thresholds) {
        BatchFindings overlaps = overlappingWorksDetector.detect(records, thresholds);
        BatchFindings splits = splittingWorksDetector.detect(records, thresholds);
        BatchFindings findings = overlaps.merge(splits);

        log.info("Batch analysis over {} records: {} overlap flags, {} splitting flags",
                records.size(), overlaps.flagCount(), splits.flagCount());
        return findings;
    }
}
