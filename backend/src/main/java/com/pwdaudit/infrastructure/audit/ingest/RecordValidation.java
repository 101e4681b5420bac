package com.pwdaudit.infrastructure.audit.ingest;

import com.pwdaudit.domain.audit.model.DataQualityNote;
import com.pwdaudit.domain.audit.model.WorkRecord;

/**
 * Either a valid record or the note explaining why the row was excluded.
 */
public record RecordValidation(
        WorkRecord record,
        DataQualityNote note
) {
    public static RecordValidation valid(WorkRecord record) {
        return new RecordValidation(record, null);
    }

    public static RecordValidation excluded(DataQualityNote note) {
        return new RecordValidation(null, note);
    }

    public boolean isValid() {
        return record != null;
    }
}
