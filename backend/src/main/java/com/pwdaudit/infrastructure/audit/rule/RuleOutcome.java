package com.pwdaudit.infrastructure.audit.rule;

import com.pwdaudit.domain.audit.model.Flag;

/**
 * Result of one rule on one record: a flag, a skip reason, or neither (rule passed or
 * does not apply).
 */
public record RuleOutcome(Flag flag, String skipReason) {

    private static final RuleOutcome PASSED = new RuleOutcome(null, null);

    public static RuleOutcome passed() {
        return PASSED;
    }

    public static RuleOutcome flagged(Flag flag) {
        return new RuleOutcome(flag, null);
    }

    public static RuleOutcome skipped(String reason) {
        return new RuleOutcome(null, reason);
    }

    public boolean isFlagged() {
        return flag != null;
    }

    public boolean isSkipped() {
        return skipReason != null;
    }
}
