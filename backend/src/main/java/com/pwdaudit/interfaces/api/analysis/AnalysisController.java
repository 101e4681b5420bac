package com.pwdaudit.interfaces.api.analysis;

import com.pwdaudit.application.analysis.AnalysisAppService;
import com.pwdaudit.domain.audit.model.AnalysisResult;
import com.pwdaudit.domain.audit.model.AuditThresholds;
import com.pwdaudit.interfaces.api.dto.AnalysisRequest;
import com.pwdaudit.interfaces.api.dto.AnalysisResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AnalysisController {

    private final AnalysisAppService analysisAppService;

    @PostMapping("/analysis")
    public ResponseEntity<AnalysisResponse> analyze(@Valid @RequestBody AnalysisRequest request) {
        AnalysisResult result = analysisAppService.analyze(
                request.rows(),
                request.asOf(),
                request.thresholds());

        return ResponseEntity.ok(AnalysisResponse.from(result));
    }

    @GetMapping("/analysis/thresholds")
    public ResponseEntity<AuditThresholds> getThresholds() {
        return ResponseEntity.ok(analysisAppService.defaultThresholds());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }
}
