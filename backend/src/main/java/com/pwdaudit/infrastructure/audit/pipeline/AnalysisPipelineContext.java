package com.pwdaudit.infrastructure.audit.pipeline;

import com.pwdaudit.domain.audit.model.AuditThresholds;
import com.pwdaudit.domain.audit.model.DataQualityNote;
import com.pwdaudit.domain.audit.model.Flag;
import com.pwdaudit.domain.audit.model.WorkRecord;
import com.pwdaudit.infrastructure.audit.batch.BatchFindings;
import lombok.Data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable context object passed through pipeline stages.
 * Accumulates results from each stage for the next.
 */
@Data
public class AnalysisPipelineContext {

    // --- Input ---
    private AuditThresholds thresholds;
    private LocalDate asOf;
    private int totalRows;

    // --- Validation ---
    private List<WorkRecord> records = new ArrayList<>();
    private List<DataQualityNote> excludedNotes = new ArrayList<>();

    // --- Record rules ---
    private Map<Integer, List<Flag>> recordFlags = new HashMap<>();
    private List<DataQualityNote> ruleNotes = new ArrayList<>();

    // --- Batch rules ---
    private BatchFindings batchFindings = BatchFindings.empty();

    public List<DataQualityNote> allNotes() {
        List<DataQualityNote> notes = new ArrayList<>(excludedNotes);
        notes.addAll(ruleNotes);
        notes.addAll(batchFindings.notes());
        return notes;
    }
}
