package com.pwdaudit.domain.audit.model;

/**
 * The eight audit red flags. Ids are stable and appear in reports, so never renumber them.
 */
public enum FlagType {
    DIVERSION_OF_FUNDS(1, "Diversion of Funds", false),
    WASTEFUL_SURVEY_EXPENDITURE(2, "Wasteful Expenditure on Survey Works", false),
    EXCESS_EXPENDITURE(3, "Excess Expenditure Without Approval", false),
    OVERLAPPING_WORKS(4, "Overlapping of Work", true),
    DELAY_IN_COMPLETION(5, "Delay in Completion of Work", false),
    SPLITTING_OF_WORKS(6, "Splitting of Work", true),
    NON_RECOVERY_OF_CENTAGE(7, "Non-recovery of Centage Charges", false),
    UNSPENT_BALANCE(8, "Unspent Balance Not Returned", false);

    private final int flagId;
    private final String flagName;
    private final boolean crossRecord;

    FlagType(int flagId, String flagName, boolean crossRecord) {
        this.flagId = flagId;
        this.flagName = flagName;
        this.crossRecord = crossRecord;
    }

    public int flagId() {
        return flagId;
    }

    public String flagName() {
        return flagName;
    }

    public boolean crossRecord() {
        return crossRecord;
    }
}
