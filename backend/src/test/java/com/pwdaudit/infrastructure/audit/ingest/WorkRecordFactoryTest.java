package com.pwdaudit.infrastructure.audit.ingest;

import com.pwdaudit.domain.audit.model.DataQualityNote;
import com.pwdaudit.domain.audit.model.RawWorkRow;
import com.pwdaudit.domain.audit.model.RoadCategory;
import com.pwdaudit.domain.audit.model.WorkField;
import com.pwdaudit.domain.audit.model.WorkRecord;
import com.pwdaudit.domain.audit.model.WorkType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WorkRecordFactoryTest {

    private WorkRecordFactory factory;

    @BeforeEach
    void setUp() {
        factory = new WorkRecordFactory(new RoadNumberExtractor());
    }

    private Map<WorkField, Object> validRow() {
        Map<WorkField, Object> values = new EnumMap<>(WorkField.class);
        values.put(WorkField.BUDGET_ITEM_NO, "BI-101");
        values.put(WorkField.WORK_NAME, "Improvement to SH-12 km 10 to 12");
        values.put(WorkField.AA_COST, "1000000");
        values.put(WorkField.TOTAL_EXPENDITURE, 900000);
        return values;
    }

    @Nested
    @DisplayName("Valid rows")
    class ValidRows {
        @Test
        void builds_record_with_coerced_values() {
            Map<WorkField, Object> values = validRow();
            values.put(WorkField.WORK_ORDER_DATE, "15-04-2022");
            values.put(WorkField.ORIGINAL_TIME_LIMIT_DAYS, "365");
            values.put(WorkField.PHYSICAL_PROGRESS_PERCENT, "75.5");
            values.put(WorkField.DEPOSIT_WORK, "Yes");
            values.put(WorkField.WORK_TYPE, "Improvement");

            RecordValidation validation = factory.validate(new RawWorkRow(4, values));

            assertThat(validation.isValid()).isTrue();
            WorkRecord record = validation.record();
            assertThat(record.rowNumber()).isEqualTo(4);
            assertThat(record.aaCost()).isEqualByComparingTo("1000000");
            assertThat(record.workOrderDate()).isEqualTo(LocalDate.of(2022, 4, 15));
            assertThat(record.originalTimeLimitDays()).isEqualTo(365);
            assertThat(record.physicalProgressPercent()).isEqualTo(75.5);
            assertThat(record.depositWork()).isTrue();
            assertThat(record.workType()).isEqualTo(WorkType.IMPROVEMENT);
        }

        @Test
        @DisplayName("Road number is taken from the work name when there is no column")
        void road_number_from_work_name() {
            WorkRecord record = factory.validate(new RawWorkRow(2, validRow())).record();

            assertThat(record.roadNumber()).isEqualTo("SH12");
            assertThat(record.roadCategory()).isEqualTo(RoadCategory.SH);
        }

        @Test
        void road_column_wins_over_work_name() {
            Map<WorkField, Object> values = validRow();
            values.put(WorkField.ROAD_NUMBER, "MDR-45");

            WorkRecord record = factory.validate(new RawWorkRow(2, values)).record();

            assertThat(record.roadNumber()).isEqualTo("MDR45");
            assertThat(record.roadCategory()).isEqualTo(RoadCategory.MDR);
        }

        @Test
        void missing_deposit_flag_means_not_deposit() {
            WorkRecord record = factory.validate(new RawWorkRow(2, validRow())).record();
            assertThat(record.depositWork()).isFalse();
            assertThat(record.workType()).isEqualTo(WorkType.OTHER);
        }
    }

    @Nested
    @DisplayName("Excluded rows")
    class ExcludedRows {
        @Test
        void missing_mandatory_field() {
            Map<WorkField, Object> values = validRow();
            values.remove(WorkField.AA_COST);

            RecordValidation validation = factory.validate(new RawWorkRow(7, values));

            assertThat(validation.isValid()).isFalse();
            assertThat(validation.note().type()).isEqualTo(DataQualityNote.Type.EXCLUDED_RECORD);
            assertThat(validation.note().rowNumber()).isEqualTo(7);
            assertThat(validation.note().message()).contains("AA_COST is missing");
        }

        @Test
        void negative_amount() {
            Map<WorkField, Object> values = validRow();
            values.put(WorkField.TOTAL_EXPENDITURE, "-5");

            assertThat(factory.validate(new RawWorkRow(2, values)).note().message())
                    .contains("TOTAL_EXPENDITURE must not be negative");
        }

        @Test
        void progress_out_of_range() {
            Map<WorkField, Object> values = validRow();
            values.put(WorkField.PHYSICAL_PROGRESS_PERCENT, 140);

            assertThat(factory.validate(new RawWorkRow(2, values)).isValid()).isFalse();
        }

        @Test
        void reversed_chainage() {
            Map<WorkField, Object> values = validRow();
            values.put(WorkField.CHAINAGE_FROM, 12);
            values.put(WorkField.CHAINAGE_TO, 10);

            assertThat(factory.validate(new RawWorkRow(2, values)).note().message())
                    .contains("CHAINAGE_FROM");
        }

        @Test
        @DisplayName("Every problem is listed in one note")
        void all_problems_in_one_note() {
            Map<WorkField, Object> values = validRow();
            values.remove(WorkField.WORK_NAME);
            values.put(WorkField.WORK_ORDER_DATE, "someday");

            String message = factory.validate(new RawWorkRow(2, values)).note().message();

            assertThat(message).startsWith("Excluded from analysis: ");
            assertThat(message).contains("WORK_NAME is missing").contains("WORK_ORDER_DATE");
        }
    }
}
