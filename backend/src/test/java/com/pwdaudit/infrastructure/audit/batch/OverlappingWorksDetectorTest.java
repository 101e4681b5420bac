package com.pwdaudit.infrastructure.audit.batch;

import com.pwdaudit.domain.audit.model.AuditThresholds;
import com.pwdaudit.domain.audit.model.DataQualityNote;
import com.pwdaudit.domain.audit.model.Flag;
import com.pwdaudit.domain.audit.model.FlagType;
import com.pwdaudit.domain.audit.model.Severity;
import com.pwdaudit.domain.audit.model.WorkRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.pwdaudit.domain.audit.model.WorkRecordFixtures.roadWork;
import static com.pwdaudit.domain.audit.model.WorkRecordFixtures.work;
import static org.assertj.core.api.Assertions.assertThat;

class OverlappingWorksDetectorTest {

    private final AuditThresholds thresholds = AuditThresholds.defaults();
    private OverlappingWorksDetector detector;

    @BeforeEach
    void setUp() {
        detector = new OverlappingWorksDetector();
    }

    private static WorkRecord ordered(int row, String road, double from, double to, LocalDate workOrder) {
        return roadWork(row, road, from, to).workOrderDate(workOrder).originalTimeLimitDays(365).build();
    }

    @Nested
    @DisplayName("Pairs")
    class PairTests {
        @Test
        @DisplayName("Overlapping chainage flags both works, each pointing at the other")
        void overlap_flags_both_sides() {
            WorkRecord a = ordered(2, "SH12", 10, 20, LocalDate.of(2022, 1, 1));
            WorkRecord b = ordered(3, "SH12", 15, 25, LocalDate.of(2023, 1, 1));

            BatchFindings findings = detector.detect(List.of(a, b), thresholds);

            assertThat(findings.flagsFor(2)).singleElement().satisfies(flag -> {
                assertThat(flag.flagType()).isEqualTo(FlagType.OVERLAPPING_WORKS);
                assertThat(flag.severity()).isEqualTo(Severity.HIGH);
                assertThat(flag.details()).containsEntry("peer_row_number", 3)
                        .containsEntry("peer_budget_item_no", "BI-3");
                assertThat((BigDecimal) flag.details().get("overlap_km")).isEqualByComparingTo("5");
            });
            assertThat(findings.flagsFor(3)).singleElement()
                    .satisfies(flag -> assertThat(flag.details()).containsEntry("peer_row_number", 2));
        }

        @Test
        void touching_ends_do_not_overlap() {
            WorkRecord a = ordered(2, "SH12", 10, 15, LocalDate.of(2022, 1, 1));
            WorkRecord b = ordered(3, "SH12", 15, 20, LocalDate.of(2022, 2, 1));

            assertThat(detector.detect(List.of(a, b), thresholds).flagCount()).isZero();
        }

        @Test
        void different_roads_do_not_overlap() {
            WorkRecord a = ordered(2, "SH12", 10, 20, LocalDate.of(2022, 1, 1));
            WorkRecord b = ordered(3, "SH14", 10, 20, LocalDate.of(2022, 1, 1));

            assertThat(detector.detect(List.of(a, b), thresholds).flagCount()).isZero();
        }

        @Test
        @DisplayName("A work whose defect liability ended before the next started is not an overlap")
        void expired_dlp_not_overlap() {
            WorkRecord old = roadWork(2, "MDR45", 0.5, 8).workOrderDate(LocalDate.of(2015, 1, 1))
                    .dlpEndDate(LocalDate.of(2018, 12, 31)).build();
            WorkRecord fresh = ordered(3, "MDR45", 2, 6, LocalDate.of(2022, 1, 1));

            assertThat(detector.detect(List.of(old, fresh), thresholds).flagCount()).isZero();
        }

        @Test
        @DisplayName("Flags on one record are ordered by peer row")
        void peers_in_row_order() {
            WorkRecord wide = ordered(5, "NH4", 0.1, 30, LocalDate.of(2022, 1, 1));
            WorkRecord first = ordered(4, "NH4", 20, 25, LocalDate.of(2022, 3, 1));
            WorkRecord second = ordered(2, "NH4", 5, 10, LocalDate.of(2022, 2, 1));

            BatchFindings findings = detector.detect(List.of(wide, first, second), thresholds);

            assertThat(findings.flagsFor(5)).extracting(flag -> flag.details().get("peer_row_number"))
                    .containsExactly(2, 4);
        }
    }

    @Test
    @DisplayName("Every flag has a mirror flag on its peer")
    void symmetric() {
        List<WorkRecord> records = List.of(
                ordered(2, "SH12", 0.5, 4, LocalDate.of(2022, 1, 1)),
                ordered(3, "SH12", 3, 9, LocalDate.of(2022, 5, 1)),
                ordered(4, "SH12", 8, 12, LocalDate.of(2023, 1, 1)),
                ordered(5, "SH12", 1, 11, LocalDate.of(2023, 6, 1)),
                ordered(6, "MDR3", 1, 11, LocalDate.of(2023, 6, 1)));

        BatchFindings findings = detector.detect(records, thresholds);

        assertThat(findings.flagCount()).isPositive();
        for (Map.Entry<Integer, List<Flag>> entry : findings.flagsByRow().entrySet()) {
            for (Flag flag : entry.getValue()) {
                int peer = (Integer) flag.details().get("peer_row_number");
                assertThat(findings.flagsFor(peer))
                        .anyMatch(back -> back.details().get("peer_row_number").equals(entry.getKey()));
            }
        }
        assertThat(findings.flagsFor(6)).isEmpty();
    }

    @Test
    @DisplayName("Works without chainage are noted, not flagged")
    void missing_chainage_noted() {
        WorkRecord noChainage = work(2).workOrderDate(LocalDate.of(2022, 1, 1)).build();

        BatchFindings findings = detector.detect(List.of(noChainage), thresholds);

        assertThat(findings.flagCount()).isZero();
        assertThat(findings.notes()).singleElement().satisfies(note -> {
            assertThat(note.type()).isEqualTo(DataQualityNote.Type.RULE_SKIPPED);
            assertThat(note.flagType()).isEqualTo(FlagType.OVERLAPPING_WORKS);
        });
    }

    @Nested
    @DisplayName("Active window")
    class ActiveUntilTests {
        private final LocalDate start = LocalDate.of(2022, 1, 1);

        @Test
        void recorded_dlp_end_wins() {
            WorkRecord record = work(2).dlpEndDate(LocalDate.of(2024, 6, 30)).build();
            assertThat(OverlappingWorksDetector.activeUntil(record, start, thresholds))
                    .isEqualTo(LocalDate.of(2024, 6, 30));
        }

        @Test
        void completion_plus_default_dlp() {
            WorkRecord record = work(2).physicalCompletionDate(LocalDate.of(2023, 1, 1)).build();
            assertThat(OverlappingWorksDetector.activeUntil(record, start, thresholds))
                    .isEqualTo(LocalDate.of(2023, 1, 1).plusDays(1095));
        }

        @Test
        void stipulated_completion_when_not_complete() {
            WorkRecord record = work(2).workOrderDate(start).originalTimeLimitDays(180).build();
            assertThat(OverlappingWorksDetector.activeUntil(record, start, thresholds))
                    .isEqualTo(start.plusDays(180 + 1095));
        }
    }
}
