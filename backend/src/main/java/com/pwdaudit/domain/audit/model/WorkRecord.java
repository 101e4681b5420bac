package com.pwdaudit.domain.audit.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Validated, read-only view of one works ledger row. Amounts are rupees, chainage is km.
 * Instances are built by the row factory, which guarantees the mandatory fields are
 * present, amounts are non-negative, progress is within 0-100 and chainageFrom &lt;= chainageTo.
 */
@Builder(toBuilder = true)
public record WorkRecord(
        int rowNumber,
        String serialNo,
        String budgetItemNo,
        String workName,
        String workNameLocal,
        String district,
        String headOfAccount,
        String expenditureHead,
        BigDecimal aaCost,
        BigDecimal contractCost,
        BigDecimal totalExpenditure,
        BigDecimal centageRecovered,
        BigDecimal unspentBalance,
        Boolean balanceRefunded,
        LocalDate aaDate,
        LocalDate workOrderDate,
        Integer originalTimeLimitDays,
        LocalDate physicalCompletionDate,
        LocalDate dlpEndDate,
        Double physicalProgressPercent,
        RoadCategory roadCategory,
        String roadNumber,
        Double chainageFrom,
        Double chainageTo,
        boolean depositWork,
        WorkType workType
) {
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * (totalExpenditure - aaCost) / aaCost * 100 at 16 significant digits, so threshold
     * comparisons see the exact excess. Empty when AA cost is zero.
     */
    public Optional<BigDecimal> excessPercent() {
        if (aaCost == null || totalExpenditure == null || aaCost.signum() == 0) {
            return Optional.empty();
        }
        return Optional.of(totalExpenditure.subtract(aaCost)
                .multiply(HUNDRED)
                .divide(aaCost, MathContext.DECIMAL64));
    }

    public boolean isComplete() {
        return physicalProgressPercent != null && physicalProgressPercent >= 100.0;
    }

    /**
     * Days from work order to physical completion, or to {@code asOf} while the work is open.
     */
    public OptionalLong elapsedDays(LocalDate asOf) {
        if (workOrderDate == null) {
            return OptionalLong.empty();
        }
        LocalDate end = physicalCompletionDate != null ? physicalCompletionDate : asOf;
        return OptionalLong.of(ChronoUnit.DAYS.between(workOrderDate, end));
    }

    public Optional<LocalDate> expectedCompletionDate() {
        if (workOrderDate == null || originalTimeLimitDays == null || originalTimeLimitDays <= 0) {
            return Optional.empty();
        }
        return Optional.of(workOrderDate.plusDays(originalTimeLimitDays));
    }

    /**
     * Work-order date, falling back to the AA date. Used to place a work in time
     * when comparing it with other works.
     */
    public Optional<LocalDate> referenceDate() {
        return Optional.ofNullable(workOrderDate != null ? workOrderDate : aaDate);
    }

    /**
     * Both chainage ends known and not the 0-0 placeholder the ledgers use for "not recorded".
     */
    public boolean hasChainage() {
        return chainageFrom != null && chainageTo != null
                && !(chainageFrom == 0.0 && chainageTo == 0.0);
    }

    public RoadCategory roadCategoryOrOther() {
        return roadCategory != null ? roadCategory : RoadCategory.OTHER;
    }

    public WorkType workTypeOrOther() {
        return workType != null ? workType : WorkType.OTHER;
    }
}
