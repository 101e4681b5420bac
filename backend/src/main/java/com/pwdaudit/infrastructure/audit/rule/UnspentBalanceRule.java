package com.pwdaudit.infrastructure.audit.rule;

import com.pwdaudit.domain.audit.model.Flag;
import com.pwdaudit.domain.audit.model.FlagType;
import com.pwdaudit.domain.audit.model.Severity;
import com.pwdaudit.domain.audit.model.WorkRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rule 8: completed deposit work still holding an unspent balance above the limit with no refund on record.
 */
@Component
public class UnspentBalanceRule implements RecordRule {

    @Override
    public FlagType flagType() {
        return FlagType.UNSPENT_BALANCE;
    }

    @Override
    public RuleOutcome evaluate(WorkRecord record, RuleContext context) {
        if (!record.depositWork() || !record.isComplete()) {
            return RuleOutcome.passed();
        }
        if (record.unspentBalance() == null) {
            return RuleOutcome.skipped("unspent balance not recorded");
        }

        BigDecimal limit = context.thresholds().unspentBalanceLimit();
        if (record.unspentBalance().compareTo(limit) <= 0 || Boolean.TRUE.equals(record.balanceRefunded())) {
            return RuleOutcome.passed();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("unspent_balance", record.unspentBalance());
        details.put("limit", limit);
        details.put("physical_progress_percent", record.physicalProgressPercent());

        return RuleOutcome.flagged(new Flag(
                FlagType.UNSPENT_BALANCE,
                Severity.HIGH,
                String.format("Completed deposit work holds unspent balance of Rs. %s not returned to the depositing agency",
                        record.unspentBalance().toPlainString()),
                details));
    }
}
