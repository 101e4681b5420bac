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

/**
 * Rule 7: centage on a deposit work recovered short of the centage rate on the contract cost.
 */
@Component
public class CentageRecoveryRule implements RecordRule {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    @Override
    public FlagType flagType() {
        return FlagType.NON_RECOVERY_OF_CENTAGE;
    }

    @Override
    public RuleOutcome evaluate(WorkRecord record, RuleContext context) {
        if (!record.depositWork()) {
            return RuleOutcome.passed();
        }
        if (record.contractCost() == null || record.centageRecovered() == null) {
            return RuleOutcome.skipped("contract cost or centage recovered not recorded");
        }

        AuditThresholds thresholds = context.thresholds();
        BigDecimal expected = record.contractCost().multiply(thresholds.centageRate());
        if (record.centageRecovered().compareTo(expected.subtract(thresholds.centageTolerance())) >= 0) {
            return RuleOutcome.passed();
        }

        BigDecimal shortfall = expected.subtract(record.centageRecovered()).setScale(2, RoundingMode.HALF_UP);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("contract_cost", record.contractCost());
        details.put("centage_rate_percent", thresholds.centageRate().multiply(HUNDRED).stripTrailingZeros());
        details.put("expected_centage", expected.setScale(2, RoundingMode.HALF_UP));
        details.put("centage_recovered", record.centageRecovered());
        details.put("shortfall", shortfall);

        return RuleOutcome.flagged(new Flag(
                FlagType.NON_RECOVERY_OF_CENTAGE,
                Severity.MEDIUM,
                String.format("Centage recovered Rs. %s against Rs. %s due, short by Rs. %s",
                        record.centageRecovered().toPlainString(),
                        expected.setScale(2, RoundingMode.HALF_UP).toPlainString(),
                        shortfall.toPlainString()),
                details));
    }
}
