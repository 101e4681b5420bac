package com.pwdaudit.infrastructure.audit.rule;

import com.pwdaudit.domain.audit.model.DataQualityNote;
import com.pwdaudit.domain.audit.model.Flag;
import com.pwdaudit.domain.audit.model.FlagType;
import com.pwdaudit.domain.audit.model.WorkRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs every record-local rule against one record. Rules always run in the same order
 * (diversion, survey, excess, delay, centage, unspent balance) whatever order they
 * were registered in, so flag lists are reproducible.
 */
@Slf4j
@Component
public class SingleRecordEvaluator {

    static final List<FlagType> EVALUATION_ORDER = List.of(
            FlagType.DIVERSION_OF_FUNDS,
            FlagType.WASTEFUL_SURVEY_EXPENDITURE,
            FlagType.EXCESS_EXPENDITURE,
            FlagType.DELAY_IN_COMPLETION,
            FlagType.NON_RECOVERY_OF_CENTAGE,
            FlagType.UNSPENT_BALANCE
    );

    public record RecordEvaluation(List<Flag> flags, List<DataQualityNote> notes) {}

    private final List<RecordRule> rules;

    public SingleRecordEvaluator(List<RecordRule> rules) {
        for (RecordRule rule : rules) {
            if (rule.flagType().crossRecord()) {
                throw new IllegalArgumentException("Not a record-local rule: " + rule.flagType());
            }
        }
        this.rules = rules.stream()
                .sorted(Comparator.comparingInt(rule -> EVALUATION_ORDER.indexOf(rule.flagType())))
                .toList();
        log.info("Record rules in evaluation order: {}", this.rules.stream().map(RecordRule::flagType).toList());
    }

    /**
     * All six rules with their default implementations.
     */
    public static SingleRecordEvaluator withDefaultRules() {
        return new SingleRecordEvaluator(List.of(
                new DiversionOfFundsRule(),
                new WastefulSurveyRule(),
                new ExcessExpenditureRule(),
                new DelayInCompletionRule(),
                new CentageRecoveryRule(),
                new UnspentBalanceRule()));
    }

    public RecordEvaluation evaluate(WorkRecord record, RuleContext context) {
        List<Flag> flags = new ArrayList<>();
        List<DataQualityNote> notes = new ArrayList<>();

        for (RecordRule rule : rules) {
            RuleOutcome outcome = rule.evaluate(record, context);
            if (outcome.isFlagged()) {
                flags.add(outcome.flag());
            } else if (outcome.isSkipped()) {
                log.debug("Row {}: {} skipped ({})", record.rowNumber(), rule.flagType(), outcome.skipReason());
                notes.add(DataQualityNote.ruleSkipped(record.rowNumber(), rule.flagType(),
                        rule.flagType().flagName() + " check skipped: " + outcome.skipReason()));
            }
        }
        return new RecordEvaluation(flags, notes);
    }
}
