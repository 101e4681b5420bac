package com.pwdaudit.infrastructure.audit.config;

import com.pwdaudit.domain.audit.model.AuditThresholds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;

@Slf4j
@Configuration
public class AuditThresholdsConfig {

    @Value("${audit.thresholds.excess-percent:10}")
    private BigDecimal excessPercent;

    @Value("${audit.thresholds.excess-high-percent:25}")
    private BigDecimal excessHighPercent;

    @Value("${audit.thresholds.unspent-balance-limit:100000}")
    private BigDecimal unspentBalanceLimit;

    @Value("${audit.thresholds.centage-rate:0.05}")
    private BigDecimal centageRate;

    @Value("${audit.thresholds.centage-tolerance:0.01}")
    private BigDecimal centageTolerance;

    @Value("${audit.thresholds.delay-escalation-multiplier:2}")
    private double delayEscalationMultiplier;

    @Value("${audit.thresholds.survey-follow-up-days:365}")
    private int surveyFollowUpDays;

    @Value("${audit.thresholds.default-dlp-days:1095}")
    private int defaultDlpDays;

    @Value("${audit.thresholds.splitting.min-group-size:3}")
    private int splittingMinGroupSize;

    @Value("${audit.thresholds.splitting.cost-ceiling:1000000}")
    private BigDecimal splittingCostCeiling;

    @Value("${audit.thresholds.splitting.name-similarity-cutoff:0.6}")
    private double nameSimilarityCutoff;

    @Value("${audit.thresholds.splitting.time-window-days:365}")
    private int splittingWindowDays;

    @Value("${audit.thresholds.splitting.chainage-gap-km:0.5}")
    private double splittingChainageGapKm;

    /**
     * Invalid values fail startup with {@code InvalidThresholdException}.
     */
    @Bean
    public AuditThresholds auditThresholds() {
        AuditThresholds thresholds = AuditThresholds.builder()
                .excessPercent(excessPercent)
                .excessHighPercent(excessHighPercent)
                .unspentBalanceLimit(unspentBalanceLimit)
                .centageRate(centageRate)
                .centageTolerance(centageTolerance)
                .delayEscalationMultiplier(delayEscalationMultiplier)
                .surveyFollowUpDays(surveyFollowUpDays)
                .defaultDlpDays(defaultDlpDays)
                .splittingMinGroupSize(splittingMinGroupSize)
                .splittingCostCeiling(splittingCostCeiling)
                .nameSimilarityCutoff(nameSimilarityCutoff)
                .splittingWindowDays(splittingWindowDays)
                .splittingChainageGapKm(splittingChainageGapKm)
                .build();
        log.info("Audit thresholds: {}", thresholds);
        return thresholds;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
