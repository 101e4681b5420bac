package com.pwdaudit.infrastructure.audit.rule;

import com.pwdaudit.domain.audit.model.AuditThresholds;
import com.pwdaudit.domain.audit.model.Flag;
import com.pwdaudit.domain.audit.model.FlagType;
import com.pwdaudit.domain.audit.model.Severity;
import com.pwdaudit.domain.audit.model.WorkRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Rule 3: expenditure above the administrative approval by more than the allowed margin.
 * Exactly at the margin is still within approval.
 */
@Component
public class ExcessExpenditureRule implements RecordRule {

    @Override
    public FlagType flagType() {
        return FlagType.EXCESS_EXPENDITURE;
    }

    @Override
    public RuleOutcome evaluate(WorkRecord record, RuleContext context) {
        Optional<BigDecimal> excess = record.excessPercent();
        if (excess.isEmpty()) {
            return RuleOutcome.skipped("AA cost is zero or missing, excess percentage undefined");
        }

        AuditThresholds thresholds = context.thresholds();
        BigDecimal percent = excess.get();
        if (percent.compareTo(thresholds.excessPercent()) <= 0) {
            return RuleOutcome.passed();
        }
        Severity severity = percent.compareTo(thresholds.excessHighPercent()) > 0
                ? Severity.HIGH
                : Severity.MEDIUM;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("aa_cost", record.aaCost());
        details.put("total_expenditure", record.totalExpenditure());
        details.put("excess_amount", record.totalExpenditure().subtract(record.aaCost()));
        details.put("excess_percentage", percent.setScale(2, RoundingMode.HALF_UP));

        return RuleOutcome.flagged(new Flag(
                FlagType.EXCESS_EXPENDITURE,
                severity,
                String.format("Expenditure exceeds Administrative Approval by %.2f%%", percent),
                details));
    }
}
