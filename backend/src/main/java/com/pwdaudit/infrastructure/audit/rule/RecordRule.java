package com.pwdaudit.infrastructure.audit.rule;

import com.pwdaudit.domain.audit.model.FlagType;
import com.pwdaudit.domain.audit.model.WorkRecord;

/**
 * A red flag check that looks at one record at a time.
 */
public interface RecordRule {

    /**
     * The flag this rule raises.
     */
    FlagType flagType();

    /**
     * Evaluate one record.
     *
     * @param record  the record under test
     * @param context thresholds, evaluation date and read-only lookups for the run
     * @return a flag, nothing, or the reason the rule could not be applied
     */
    RuleOutcome evaluate(WorkRecord record, RuleContext context);
}
