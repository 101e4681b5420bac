package com.pwdaudit.application.analysis;

import com.pwdaudit.domain.audit.exception.InvalidThresholdException;
import com.pwdaudit.domain.audit.model.AnalysisResult;
import com.pwdaudit.domain.audit.model.AuditThresholds;
import com.pwdaudit.domain.audit.model.RawWorkRow;
import com.pwdaudit.domain.audit.service.RedFlagAnalysisService;
import com.pwdaudit.infrastructure.audit.ingest.ColumnAliasTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisAppService {

    /** Sheet row of the first data row; row 1 is the header. */
    static final int FIRST_DATA_ROW = 2;

    private final RedFlagAnalysisService redFlagAnalysisService;
    private final ColumnAliasTable columnAliasTable;
    private final AuditThresholds defaultThresholds;
    private final Clock clock;

    /**
     * Analyze spreadsheet-shaped rows (header → cell value).
     * Thresholds are resolved before any row is touched.
     */
    public AnalysisResult analyze(List<Map<String, Object>> rows, LocalDate asOf, ThresholdOverrides overrides) {
        AuditThresholds thresholds = resolveThresholds(overrides);
        LocalDate effectiveAsOf = asOf != null ? asOf : LocalDate.now(clock);

        warnUnmappedHeaders(rows);

        List<RawWorkRow> rawRows = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            rawRows.add(columnAliasTable.toRawRow(i + FIRST_DATA_ROW, rows.get(i)));
        }
        return redFlagAnalysisService.analyze(rawRows, thresholds, effectiveAsOf);
    }

    public AuditThresholds defaultThresholds() {
        return defaultThresholds;
    }

    private AuditThresholds resolveThresholds(ThresholdOverrides overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return defaultThresholds;
        }
        try {
            return overrides.applyTo(defaultThresholds);
        } catch (InvalidThresholdException e) {
            log.warn("Rejected threshold override: {}", e.getMessage());
            throw e;
        }
    }

    private void warnUnmappedHeaders(List<Map<String, Object>> rows) {
        Set<String> headers = new LinkedHashSet<>();
        rows.forEach(row -> headers.addAll(row.keySet()));
        List<String> unmapped = columnAliasTable.unmappedHeaders(headers);
        if (!unmapped.isEmpty()) {
            log.warn("Ignoring {} unknown columns: {}", unmapped.size(), unmapped);
        }
    }
}
