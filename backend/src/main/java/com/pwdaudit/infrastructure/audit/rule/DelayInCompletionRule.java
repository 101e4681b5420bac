package com.pwdaudit.infrastructure.audit.rule;

import com.pwdaudit.domain.audit.model.Flag;
import com.pwdaudit.domain.audit.model.FlagType;
import com.pwdaudit.domain.audit.model.Severity;
import com.pwdaudit.domain.audit.model.WorkRecord;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Rule 5: incomplete work past its stipulated completion date. Escalates to HIGH once the
 * overrun exceeds the escalation multiplier times the original time limit.
 */
@Component
public class DelayInCompletionRule implements RecordRule {

    @Override
    public FlagType flagType() {
        return FlagType.DELAY_IN_COMPLETION;
    }

    @Override
    public RuleOutcome evaluate(WorkRecord record, RuleContext context) {
        Optional<LocalDate> expected = record.expectedCompletionDate();
        if (expected.isEmpty()) {
            return RuleOutcome.skipped("work order date or original time limit not recorded");
        }
        if (record.physicalProgressPercent() == null && record.physicalCompletionDate() == null) {
            return RuleOutcome.skipped("physical progress not recorded");
        }
        if (record.isComplete() || record.physicalProgressPercent() == null) {
            return RuleOutcome.passed();
        }

        LocalDate asOf = context.asOf();
        if (!expected.get().isBefore(asOf)) {
            return RuleOutcome.passed();
        }

        long delayDays = ChronoUnit.DAYS.between(expected.get(), asOf);
        int timeLimit = record.originalTimeLimitDays();
        boolean escalated = delayDays > context.thresholds().delayEscalationMultiplier() * timeLimit;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("work_order_date", record.workOrderDate());
        details.put("time_limit_days", timeLimit);
        details.put("expected_completion", expected.get());
        details.put("as_of", asOf);
        details.put("elapsed_days", record.elapsedDays(asOf).orElseThrow());
        details.put("delay_days", delayDays);
        details.put("physical_progress_percent", record.physicalProgressPercent());

        return RuleOutcome.flagged(new Flag(
                FlagType.DELAY_IN_COMPLETION,
                escalated ? Severity.HIGH : Severity.MEDIUM,
                String.format("Work delayed by %d days, physical progress: %s%%",
                        delayDays, record.physicalProgressPercent()),
                details));
    }
}
