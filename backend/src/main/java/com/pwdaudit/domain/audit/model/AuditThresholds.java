package com.pwdaudit.domain.audit.model;

import com.pwdaudit.domain.audit.exception.InvalidThresholdException;
import lombok.Builder;

import java.math.BigDecimal;

/**
 * Immutable rule thresholds for one analysis run. Amounts are rupees.
 * The constructor rejects values that cannot be right, so a bad configuration
 * fails before the first record is evaluated.
 *
 * @param excessPercent              excess over AA above which rule 3 fires (MEDIUM)
 * @param excessHighPercent          excess over AA above which rule 3 is HIGH
 * @param unspentBalanceLimit        unspent deposit balance above which rule 8 fires
 * @param centageRate                share of contract cost expected back as centage
 * @param centageTolerance           rounding slack for the centage comparison, in rupees
 * @param delayEscalationMultiplier  overdue beyond this many time limits makes a delay HIGH
 * @param surveyFollowUpDays         window after a survey in which execution work must start
 * @param defaultDlpDays             defect liability period assumed when the row carries no DLP end
 * @param splittingMinGroupSize      smallest group of works that counts as a split
 * @param splittingCostCeiling       e-tendering threshold each split work stays under
 * @param nameSimilarityCutoff       0..1 score at which two work names are treated as the same work
 * @param splittingWindowDays        maximum spread between the earliest and latest dates of one split group
 * @param splittingChainageGapKm     chainage gap still treated as adjacent
 */
@Builder(toBuilder = true)
public record AuditThresholds(
        BigDecimal excessPercent,
        BigDecimal excessHighPercent,
        BigDecimal unspentBalanceLimit,
        BigDecimal centageRate,
        BigDecimal centageTolerance,
        double delayEscalationMultiplier,
        int surveyFollowUpDays,
        int defaultDlpDays,
        int splittingMinGroupSize,
        BigDecimal splittingCostCeiling,
        double nameSimilarityCutoff,
        int splittingWindowDays,
        double splittingChainageGapKm
) {
    public AuditThresholds {
        requireNonNegative("excess-percent", excessPercent);
        requireNonNegative("excess-high-percent", excessHighPercent);
        if (excessHighPercent.compareTo(excessPercent) < 0) {
            throw new InvalidThresholdException("excess-high-percent", "must not be below excess-percent");
        }
        requireNonNegative("unspent-balance-limit", unspentBalanceLimit);
        requireNonNegative("centage-rate", centageRate);
        if (centageRate.compareTo(BigDecimal.ONE) > 0) {
            throw new InvalidThresholdException("centage-rate", "must be a fraction between 0 and 1");
        }
        requireNonNegative("centage-tolerance", centageTolerance);
        if (!Double.isFinite(delayEscalationMultiplier) || delayEscalationMultiplier < 1.0) {
            throw new InvalidThresholdException("delay-escalation-multiplier", "must be at least 1");
        }
        requireNonNegative("survey-follow-up-days", surveyFollowUpDays);
        requireNonNegative("default-dlp-days", defaultDlpDays);
        if (splittingMinGroupSize < 2) {
            throw new InvalidThresholdException("splitting.min-group-size", "must be at least 2");
        }
        requireNonNegative("splitting.cost-ceiling", splittingCostCeiling);
        if (splittingCostCeiling.signum() == 0) {
            throw new InvalidThresholdException("splitting.cost-ceiling", "must be positive");
        }
        if (!Double.isFinite(nameSimilarityCutoff) || nameSimilarityCutoff <= 0.0 || nameSimilarityCutoff > 1.0) {
            throw new InvalidThresholdException("splitting.name-similarity-cutoff", "must be in (0, 1]");
        }
        requireNonNegative("splitting.time-window-days", splittingWindowDays);
        if (!Double.isFinite(splittingChainageGapKm) || splittingChainageGapKm < 0.0) {
            throw new InvalidThresholdException("splitting.chainage-gap-km", "must not be negative");
        }
    }

    public static AuditThresholds defaults() {
        return new AuditThresholds(
                BigDecimal.valueOf(10),
                BigDecimal.valueOf(25),
                BigDecimal.valueOf(100_000),
                new BigDecimal("0.05"),
                new BigDecimal("0.01"),
                2.0,
                365,
                1095,
                3,
                BigDecimal.valueOf(1_000_000),
                0.6,
                365,
                0.5
        );
    }

    private static void requireNonNegative(String name, BigDecimal value) {
        if (value == null) {
            throw new InvalidThresholdException(name, "is required");
        }
        if (value.signum() < 0) {
            throw new InvalidThresholdException(name, "must not be negative (was " + value.toPlainString() + ")");
        }
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new InvalidThresholdException(name, "must not be negative (was " + value + ")");
        }
    }
}
