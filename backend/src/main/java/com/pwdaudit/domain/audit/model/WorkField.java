package com.pwdaudit.domain.audit.model;

/**
 * Canonical input fields of a works ledger row, independent of how the source sheet
 * labels its columns.
 */
public enum WorkField {
    SERIAL_NO(Kind.TEXT, false),
    BUDGET_ITEM_NO(Kind.TEXT, true),
    WORK_NAME(Kind.TEXT, true),
    WORK_NAME_LOCAL(Kind.TEXT, false),
    DISTRICT(Kind.TEXT, false),
    HEAD_OF_ACCOUNT(Kind.TEXT, false),
    EXPENDITURE_HEAD(Kind.TEXT, false),
    AA_COST(Kind.AMOUNT, true),
    CONTRACT_COST(Kind.AMOUNT, false),
    TOTAL_EXPENDITURE(Kind.AMOUNT, true),
    CENTAGE_RECOVERED(Kind.AMOUNT, false),
    UNSPENT_BALANCE(Kind.AMOUNT, false),
    BALANCE_REFUNDED(Kind.BOOLEAN, false),
    AA_DATE(Kind.DATE, false),
    WORK_ORDER_DATE(Kind.DATE, false),
    ORIGINAL_TIME_LIMIT_DAYS(Kind.INTEGER, false),
    PHYSICAL_COMPLETION_DATE(Kind.DATE, false),
    DLP_END_DATE(Kind.DATE, false),
    PHYSICAL_PROGRESS_PERCENT(Kind.DECIMAL, false),
    ROAD_CATEGORY(Kind.TEXT, false),
    ROAD_NUMBER(Kind.TEXT, false),
    CHAINAGE_FROM(Kind.DECIMAL, false),
    CHAINAGE_TO(Kind.DECIMAL, false),
    DEPOSIT_WORK(Kind.BOOLEAN, false),
    WORK_TYPE(Kind.TEXT, false);

    public enum Kind { TEXT, AMOUNT, DECIMAL, INTEGER, DATE, BOOLEAN }

    private final Kind kind;
    private final boolean mandatory;

    WorkField(Kind kind, boolean mandatory) {
        this.kind = kind;
        this.mandatory = mandatory;
    }

    public Kind kind() {
        return kind;
    }

    public boolean mandatory() {
        return mandatory;
    }
}
