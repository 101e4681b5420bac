package com.pwdaudit.infrastructure.audit.rule;

import com.pwdaudit.domain.audit.model.Flag;
import com.pwdaudit.domain.audit.model.FlagType;
import com.pwdaudit.domain.audit.model.Severity;
import com.pwdaudit.domain.audit.model.WorkRecord;
import com.pwdaudit.domain.audit.model.WorkType;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Rule 2: money spent on a survey that no execution work followed within the follow-up
 * window. A survey whose window is still open is not judged yet.
 */
@Component
public class WastefulSurveyRule implements RecordRule {

    @Override
    public FlagType flagType() {
        return FlagType.WASTEFUL_SURVEY_EXPENDITURE;
    }

    @Override
    public RuleOutcome evaluate(WorkRecord record, RuleContext context) {
        if (record.workTypeOrOther() != WorkType.SURVEY) {
            return RuleOutcome.passed();
        }
        if (record.totalExpenditure() == null || record.totalExpenditure().signum() <= 0) {
            return RuleOutcome.passed();
        }
        Optional<LocalDate> surveyDate = record.referenceDate();
        if (surveyDate.isEmpty()) {
            return RuleOutcome.skipped("survey has neither work order date nor AA date");
        }

        int followUpDays = context.thresholds().surveyFollowUpDays();
        LocalDate windowEnd = surveyDate.get().plusDays(followUpDays);
        if (!context.asOf().isAfter(windowEnd)) {
            return RuleOutcome.passed();
        }
        if (context.executionWorks().findFollowUp(record, surveyDate.get(), windowEnd).isPresent()) {
            return RuleOutcome.passed();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("survey_date", surveyDate.get());
        details.put("follow_up_window_days", followUpDays);
        details.put("follow_up_window_end", windowEnd);
        details.put("survey_expenditure", record.totalExpenditure());

        return RuleOutcome.flagged(new Flag(
                FlagType.WASTEFUL_SURVEY_EXPENDITURE,
                Severity.MEDIUM,
                String.format("Survey expenditure of Rs. %s with no execution work within %d days",
                        record.totalExpenditure().toPlainString(), followUpDays),
                details));
    }
}
