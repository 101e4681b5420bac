package com.pwdaudit.domain.audit.model;

/**
 * Identity of a record as it appears in the result lists.
 */
public record RecordRef(
        int rowNumber,
        String serialNo,
        String budgetItemNo,
        String workName
) {
    public static RecordRef from(WorkRecord record) {
        return new RecordRef(record.rowNumber(), record.serialNo(), record.budgetItemNo(), record.workName());
    }
}
