package com.pwdaudit.infrastructure.audit.ingest;

import com.pwdaudit.domain.audit.model.DataQualityNote;
import com.pwdaudit.domain.audit.model.RawWorkRow;
import com.pwdaudit.domain.audit.model.RoadCategory;
import com.pwdaudit.domain.audit.model.WorkField;
import com.pwdaudit.domain.audit.model.WorkRecord;
import com.pwdaudit.domain.audit.model.WorkType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Validated construction of {@link WorkRecord}s. A row with a missing mandatory field,
 * a value that does not coerce, a negative amount, progress outside 0-100 or reversed
 * chainage is excluded with a single note listing every problem found.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkRecordFactory {

    private final RoadNumberExtractor roadNumberExtractor;

    public RecordValidation validate(RawWorkRow row) {
        List<String> problems = new ArrayList<>();
        Map<WorkField, Object> parsed = new EnumMap<>(WorkField.class);

        for (WorkField field : WorkField.values()) {
            Object value;
            try {
                value = coerce(field, row.get(field));
            } catch (IllegalArgumentException e) {
                problems.add(field + " " + e.getMessage());
                continue;
            }
            if (value == null) {
                if (field.mandatory()) problems.add(field + " is missing");
                continue;
            }
            parsed.put(field, value);
        }

        checkRanges(parsed, problems);

        if (!problems.isEmpty()) {
            log.debug("Row {} excluded: {}", row.rowNumber(), problems);
            return RecordValidation.excluded(
                    DataQualityNote.excluded(row.rowNumber(), "Excluded from analysis: " + String.join("; ", problems)));
        }
        return RecordValidation.valid(build(row.rowNumber(), parsed));
    }

    private Object coerce(WorkField field, Object raw) {
        return switch (field.kind()) {
            case TEXT -> ValueParser.text(raw);
            case AMOUNT -> ValueParser.decimal(raw);
            case DECIMAL -> {
                BigDecimal value = ValueParser.decimal(raw);
                yield value == null ? null : value.doubleValue();
            }
            case INTEGER -> ValueParser.integer(raw);
            case DATE -> ValueParser.date(raw);
            case BOOLEAN -> ValueParser.bool(raw);
        };
    }

    private void checkRanges(Map<WorkField, Object> parsed, List<String> problems) {
        parsed.forEach((field, value) -> {
            if (field.kind() == WorkField.Kind.AMOUNT && ((BigDecimal) value).signum() < 0) {
                problems.add(field + " must not be negative");
            }
        });

        Double progress = (Double) parsed.get(WorkField.PHYSICAL_PROGRESS_PERCENT);
        if (progress != null && (progress < 0.0 || progress > 100.0)) {
            problems.add("PHYSICAL_PROGRESS_PERCENT must be within 0-100");
        }

        Integer timeLimit = (Integer) parsed.get(WorkField.ORIGINAL_TIME_LIMIT_DAYS);
        if (timeLimit != null && timeLimit < 0) {
            problems.add("ORIGINAL_TIME_LIMIT_DAYS must not be negative");
        }

        Double from = (Double) parsed.get(WorkField.CHAINAGE_FROM);
        Double to = (Double) parsed.get(WorkField.CHAINAGE_TO);
        if ((from != null && from < 0.0) || (to != null && to < 0.0)) {
            problems.add("chainage must not be negative");
        }
        if (from != null && to != null && from > to) {
            problems.add("CHAINAGE_FROM " + from + " is after CHAINAGE_TO " + to);
        }
    }

    private WorkRecord build(int rowNumber, Map<WorkField, Object> v) {
        String workName = (String) v.get(WorkField.WORK_NAME);
        String givenRoadNumber = (String) v.get(WorkField.ROAD_NUMBER);
        String roadNumber = givenRoadNumber != null
                ? roadNumberExtractor.normalize(givenRoadNumber)
                : roadNumberExtractor.extract(workName).orElse(null);
        String roadCategoryText = (String) v.get(WorkField.ROAD_CATEGORY);
        Boolean deposit = (Boolean) v.get(WorkField.DEPOSIT_WORK);

        return WorkRecord.builder()
                .rowNumber(rowNumber)
                .serialNo((String) v.get(WorkField.SERIAL_NO))
                .budgetItemNo((String) v.get(WorkField.BUDGET_ITEM_NO))
                .workName(workName)
                .workNameLocal((String) v.get(WorkField.WORK_NAME_LOCAL))
                .district((String) v.get(WorkField.DISTRICT))
                .headOfAccount((String) v.get(WorkField.HEAD_OF_ACCOUNT))
                .expenditureHead((String) v.get(WorkField.EXPENDITURE_HEAD))
                .aaCost((BigDecimal) v.get(WorkField.AA_COST))
                .contractCost((BigDecimal) v.get(WorkField.CONTRACT_COST))
                .totalExpenditure((BigDecimal) v.get(WorkField.TOTAL_EXPENDITURE))
                .centageRecovered((BigDecimal) v.get(WorkField.CENTAGE_RECOVERED))
                .unspentBalance((BigDecimal) v.get(WorkField.UNSPENT_BALANCE))
                .balanceRefunded((Boolean) v.get(WorkField.BALANCE_REFUNDED))
                .aaDate((LocalDate) v.get(WorkField.AA_DATE))
                .workOrderDate((LocalDate) v.get(WorkField.WORK_ORDER_DATE))
                .originalTimeLimitDays((Integer) v.get(WorkField.ORIGINAL_TIME_LIMIT_DAYS))
                .physicalCompletionDate((LocalDate) v.get(WorkField.PHYSICAL_COMPLETION_DATE))
                .dlpEndDate((LocalDate) v.get(WorkField.DLP_END_DATE))
                .physicalProgressPercent((Double) v.get(WorkField.PHYSICAL_PROGRESS_PERCENT))
                .roadCategory(roadCategoryText != null ? RoadCategory.fromText(roadCategoryText) : inferCategory(roadNumber))
                .roadNumber(roadNumber)
                .chainageFrom((Double) v.get(WorkField.CHAINAGE_FROM))
                .chainageTo((Double) v.get(WorkField.CHAINAGE_TO))
                .depositWork(Boolean.TRUE.equals(deposit))
                .workType(WorkType.fromText((String) v.get(WorkField.WORK_TYPE)))
                .build();
    }

    // "MDR45" -> MDR when the sheet has no road category column
    private RoadCategory inferCategory(String roadNumber) {
        if (roadNumber == null) {
            return RoadCategory.OTHER;
        }
        return RoadCategory.fromText(roadNumber.replaceAll("\\d.*$", ""));
    }
}
