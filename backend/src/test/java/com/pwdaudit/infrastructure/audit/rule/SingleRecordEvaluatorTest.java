package com.pwdaudit.infrastructure.audit.rule;

import com.pwdaudit.domain.audit.model.AuditThresholds;
import com.pwdaudit.domain.audit.model.DataQualityNote;
import com.pwdaudit.domain.audit.model.Flag;
import com.pwdaudit.domain.audit.model.FlagType;
import com.pwdaudit.domain.audit.model.WorkRecord;
import com.pwdaudit.infrastructure.audit.rule.SingleRecordEvaluator.RecordEvaluation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.pwdaudit.domain.audit.model.WorkRecordFixtures.lakh;
import static com.pwdaudit.domain.audit.model.WorkRecordFixtures.work;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SingleRecordEvaluatorTest {

    private static final RuleContext CONTEXT = new RuleContext(
            AuditThresholds.defaults(), LocalDate.of(2024, 3, 31), ExecutionWorkIndex.empty());

    private final WorkRecord excessAndShortCentage = work(2)
            .depositWork(true)
            .headOfAccount("4059").expenditureHead("4059")
            .aaCost(lakh("100")).totalExpenditure(lakh("115"))
            .contractCost(lakh("20")).centageRecovered(lakh("0.5"))
            .physicalProgressPercent(50.0)
            .build();

    @Test
    @DisplayName("Flags come out in rule order")
    void flags_in_rule_order() {
        RecordEvaluation evaluation = SingleRecordEvaluator.withDefaultRules().evaluate(excessAndShortCentage, CONTEXT);

        assertThat(evaluation.flags()).extracting(Flag::flagType)
                .containsExactly(FlagType.EXCESS_EXPENDITURE, FlagType.NON_RECOVERY_OF_CENTAGE);
    }

    @Test
    @DisplayName("Registration order does not change evaluation order")
    void registration_order_ignored() {
        SingleRecordEvaluator evaluator = new SingleRecordEvaluator(
                List.of(new CentageRecoveryRule(), new ExcessExpenditureRule()));

        assertThat(evaluator.evaluate(excessAndShortCentage, CONTEXT).flags()).extracting(Flag::flagType)
                .containsExactly(FlagType.EXCESS_EXPENDITURE, FlagType.NON_RECOVERY_OF_CENTAGE);
    }

    @Test
    @DisplayName("Skipped rules become data-quality notes")
    void skipped_rule_note() {
        RecordEvaluation evaluation = SingleRecordEvaluator.withDefaultRules().evaluate(excessAndShortCentage, CONTEXT);

        assertThat(evaluation.notes()).singleElement().satisfies(note -> {
            assertThat(note.type()).isEqualTo(DataQualityNote.Type.RULE_SKIPPED);
            assertThat(note.flagType()).isEqualTo(FlagType.DELAY_IN_COMPLETION);
            assertThat(note.rowNumber()).isEqualTo(2);
            assertThat(note.message()).startsWith("Delay in Completion of Work check skipped: ");
        });
    }

    @Test
    void clean_record_has_no_flags() {
        RecordEvaluation evaluation = SingleRecordEvaluator.withDefaultRules().evaluate(work(3).build(), CONTEXT);
        assertThat(evaluation.flags()).isEmpty();
    }

    @Test
    void cross_record_rule_rejected() {
        RecordRule overlap = new RecordRule() {
            @Override
            public FlagType flagType() {
                return FlagType.OVERLAPPING_WORKS;
            }

            @Override
            public RuleOutcome evaluate(WorkRecord record, RuleContext context) {
                return RuleOutcome.passed();
            }
        };

        assertThatThrownBy(() -> new SingleRecordEvaluator(List.of(overlap)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
