package com.pwdaudit.application.analysis;

import com.pwdaudit.domain.audit.exception.InvalidThresholdException;
import com.pwdaudit.domain.audit.model.AuditThresholds;
import com.pwdaudit.domain.audit.model.RawWorkRow;
import com.pwdaudit.domain.audit.model.WorkField;
import com.pwdaudit.domain.audit.service.RedFlagAnalysisService;
import com.pwdaudit.infrastructure.audit.ingest.ColumnAliasTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class AnalysisAppServiceTest {

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    @Mock
    private RedFlagAnalysisService redFlagAnalysisService;

    @Captor
    private ArgumentCaptor<List<RawWorkRow>> rowsCaptor;

    @Captor
    private ArgumentCaptor<AuditThresholds> thresholdsCaptor;

    private final AuditThresholds defaults = AuditThresholds.defaults();

    private AnalysisAppService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-31T06:30:00Z"), IST);
        service = new AnalysisAppService(redFlagAnalysisService, new ColumnAliasTable(),
                defaults, clock);
    }

    private static List<Map<String, Object>> sheet() {
        return List.of(
                Map.of("Budget Item No.", "BI-1", "Name of the work", "Road A",
                        "AA Cost (Lakh)", 10, "Total Expenditure (Lakhs)", 12),
                Map.of("Budget Item No.", "BI-2", "Name of the work", "Road B",
                        "AA Cost", 500000, "Total Expenditure", 400000, "Remarks", "ok"));
    }

    @Test
    @DisplayName("Rows are numbered from the first data row and lakh columns converted")
    void maps_rows() {
        service.analyze(sheet(), LocalDate.of(2024, 1, 1), null);

        verify(redFlagAnalysisService).analyze(rowsCaptor.capture(), any(), eq(LocalDate.of(2024, 1, 1)));
        List<RawWorkRow> rows = rowsCaptor.getValue();
        assertThat(rows).extracting(RawWorkRow::rowNumber).containsExactly(2, 3);
        assertThat((BigDecimal) rows.get(0).get(WorkField.AA_COST)).isEqualByComparingTo("1000000");
        assertThat(rows.get(1).get(WorkField.AA_COST)).isEqualTo(500000);
    }

    @Test
    @DisplayName("Missing asOf falls back to today from the clock")
    void as_of_from_clock() {
        service.analyze(sheet(), null, null);

        verify(redFlagAnalysisService).analyze(any(), any(), eq(LocalDate.of(2024, 3, 31)));
    }

    @Test
    void default_thresholds_without_overrides() {
        service.analyze(sheet(), null, null);

        verify(redFlagAnalysisService).analyze(any(), thresholdsCaptor.capture(), any());
        assertThat(thresholdsCaptor.getValue()).isEqualTo(AuditThresholds.defaults());
    }

    @Test
    void overrides_applied() {
        ThresholdOverrides overrides = new ThresholdOverrides(BigDecimal.valueOf(5), null, null, null, null,
                null, null, null, 4, null, null, null, null);

        service.analyze(sheet(), null, overrides);

        verify(redFlagAnalysisService).analyze(any(), thresholdsCaptor.capture(), any());
        AuditThresholds used = thresholdsCaptor.getValue();
        assertThat(used.excessPercent()).isEqualByComparingTo("5");
        assertThat(used.splittingMinGroupSize()).isEqualTo(4);
        assertThat(used.excessHighPercent()).isEqualByComparingTo("25");
    }

    @Test
    @DisplayName("Invalid override is rejected before any row is analyzed")
    void invalid_override_rejected() {
        ThresholdOverrides overrides = new ThresholdOverrides(null, null, null, new BigDecimal("2"), null,
                null, null, null, null, null, null, null, null);

        assertThatThrownBy(() -> service.analyze(sheet(), null, overrides))
                .isInstanceOf(InvalidThresholdException.class);
        verifyNoInteractions(redFlagAnalysisService);
    }

    @Test
    void empty_overrides_keep_defaults() {
        ThresholdOverrides overrides = new ThresholdOverrides(null, null, null, null, null,
                null, null, null, null, null, null, null, null);

        assertThat(overrides.isEmpty()).isTrue();
        service.analyze(sheet(), null, overrides);

        verify(redFlagAnalysisService).analyze(any(), thresholdsCaptor.capture(), any());
        assertThat(thresholdsCaptor.getValue()).isSameAs(defaults);
    }
}
