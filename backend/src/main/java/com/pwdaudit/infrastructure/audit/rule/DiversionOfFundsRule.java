package com.pwdaudit.infrastructure.audit.rule;

import com.pwdaudit.domain.audit.model.Flag;
import com.pwdaudit.domain.audit.model.FlagType;
import com.pwdaudit.domain.audit.model.Severity;
import com.pwdaudit.domain.audit.model.WorkRecord;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Rule 1: deposit money booked to a head other than the one the work was sanctioned under.
 * Only the two head fields are compared; nothing is inferred from remarks.
 */
@Component
public class DiversionOfFundsRule implements RecordRule {

    @Override
    public FlagType flagType() {
        return FlagType.DIVERSION_OF_FUNDS;
    }

    @Override
    public RuleOutcome evaluate(WorkRecord record, RuleContext context) {
        if (!record.depositWork()) {
            return RuleOutcome.passed();
        }
        if (record.headOfAccount() == null || record.expenditureHead() == null) {
            return RuleOutcome.skipped("head of account or expenditure head not recorded");
        }
        if (headKey(record.headOfAccount()).equals(headKey(record.expenditureHead()))) {
            return RuleOutcome.passed();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("sanctioned_head", record.headOfAccount());
        details.put("expenditure_head", record.expenditureHead());
        details.put("total_expenditure", record.totalExpenditure());

        return RuleOutcome.flagged(new Flag(
                FlagType.DIVERSION_OF_FUNDS,
                Severity.HIGH,
                String.format("Deposit work expenditure booked under '%s' instead of sanctioned head '%s'",
                        record.expenditureHead(), record.headOfAccount()),
                details));
    }

    // "5054-04-337 (01)" and "5054 04 337(01)" are the same head
    private static String headKey(String head) {
        return head.toUpperCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{Nd}]", "");
    }
}
