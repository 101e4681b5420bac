package com.pwdaudit.interfaces.api.dto;

import com.pwdaudit.application.analysis.ThresholdOverrides;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record AnalysisRequest(
        @NotEmpty(message = "At least one row is required")
        @Size(max = 50000, message = "At most 50000 rows can be analyzed per request")
        List<@NotNull(message = "Rows must not be null") Map<String, Object>> rows,

        LocalDate asOf,

        ThresholdOverrides thresholds
) {}
