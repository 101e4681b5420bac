package com.pwdaudit.application.analysis;

import com.pwdaudit.domain.audit.model.AuditThresholds;

import java.math.BigDecimal;

/**
 * Per-request threshold changes. Null fields keep the configured value.
 */
public record ThresholdOverrides(
        BigDecimal excessPercent,
        BigDecimal excessHighPercent,
        BigDecimal unspentBalanceLimit,
        BigDecimal centageRate,
        BigDecimal centageTolerance,
        Double delayEscalationMultiplier,
        Integer surveyFollowUpDays,
        Integer defaultDlpDays,
        Integer splittingMinGroupSize,
        BigDecimal splittingCostCeiling,
        Double nameSimilarityCutoff,
        Integer splittingWindowDays,
        Double splittingChainageGapKm
) {

    /**
     * @throws com.pwdaudit.domain.audit.exception.InvalidThresholdException if the merged values are invalid
     */
    public AuditThresholds applyTo(AuditThresholds base) {
        AuditThresholds.AuditThresholdsBuilder builder = base.toBuilder();
        if (excessPercent != null) builder.excessPercent(excessPercent);
        if (excessHighPercent != null) builder.excessHighPercent(excessHighPercent);
        if (unspentBalanceLimit != null) builder.unspentBalanceLimit(unspentBalanceLimit);
        if (centageRate != null) builder.centageRate(centageRate);
        if (centageTolerance != null) builder.centageTolerance(centageTolerance);
        if (delayEscalationMultiplier != null) builder.delayEscalationMultiplier(delayEscalationMultiplier);
        if (surveyFollowUpDays != null) builder.surveyFollowUpDays(surveyFollowUpDays);
        if (defaultDlpDays != null) builder.defaultDlpDays(defaultDlpDays);
        if (splittingMinGroupSize != null) builder.splittingMinGroupSize(splittingMinGroupSize);
        if (splittingCostCeiling != null) builder.splittingCostCeiling(splittingCostCeiling);
        if (nameSimilarityCutoff != null) builder.nameSimilarityCutoff(nameSimilarityCutoff);
        if (splittingWindowDays != null) builder.splittingWindowDays(splittingWindowDays);
        if (splittingChainageGapKm != null) builder.splittingChainageGapKm(splittingChainageGapKm);
        return builder.build();
    }

    public boolean isEmpty() {
        return excessPercent == null && excessHighPercent == null && unspentBalanceLimit == null
                && centageRate == null && centageTolerance == null && delayEscalationMultiplier == null
                && surveyFollowUpDays == null && defaultDlpDays == null && splittingMinGroupSize == null
                && splittingCostCeiling == null && nameSimilarityCutoff == null && splittingWindowDays == null
                && splittingChainageGapKm == null;
    }
}
