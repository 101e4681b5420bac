package com.pwdaudit;

import com.pwdaudit.domain.audit.model.AuditThresholds;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class PwdAuditApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private AuditThresholds auditThresholds;

    @Test
    void thresholds_loaded_from_configuration() {
        assertThat(auditThresholds).isEqualTo(AuditThresholds.defaults());
    }

    @Test
    @DisplayName("Spreadsheet rows go through the whole analysis")
    void end_to_end() throws Exception {
        mockMvc.perform(post("/api/v1/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "asOf": "2024-03-31",
                                  "rows": [
                                    {"Sr. No.": 1, "Budget Item No.": "BI-1",
                                     "Name of the work": "Improvement to MDR 45",
                                     "Administrative Approval Cost (Lakh)": 100,
                                     "Total Expenditure (Lakhs)": 115},
                                    {"Sr. No.": 2, "Budget Item No.": "BI-2",
                                     "Name of the work": "Deposit work, rest house",
                                     "AA Cost (Lakh)": 50, "Total Expenditure (Lakhs)": 40,
                                     "Contract Cost (Lakh)": 20, "Centage Recovered (Lakh)": 0.5,
                                     "Deposit Work": "Yes"},
                                    {"Sr. No.": 3, "Name of the work": "No budget item",
                                     "AA Cost": 100, "Total Expenditure": 90}
                                  ]
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.totalRows").value(3))
                .andExpect(jsonPath("$.summary.excludedRows").value(1))
                .andExpect(jsonPath("$.redFlagged[0].record.rowNumber").value(2))
                .andExpect(jsonPath("$.redFlagged[0].flags[0].flagId").value(3))
                .andExpect(jsonPath("$.redFlagged[0].highestSeverity").value("MEDIUM"))
                .andExpect(jsonPath("$.redFlagged[1].record.rowNumber").value(3))
                .andExpect(jsonPath("$.redFlagged[1].flags[0].flagId").value(7));
    }
}
