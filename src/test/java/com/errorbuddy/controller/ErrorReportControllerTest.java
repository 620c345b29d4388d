package com.errorbuddy.controller;

import com.errorbuddy.model.ErrorReport;
import com.errorbuddy.model.FailureKind;
import com.errorbuddy.model.ReportResult;
import com.errorbuddy.model.ReportStats;
import com.errorbuddy.model.Severity;
import com.errorbuddy.service.diagnostics.ReporterDiagnostics;
import com.errorbuddy.service.report.ErrorReportingPipeline;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ErrorReportController.class)
class ErrorReportControllerTest {

    private static final String REPORT_JSON =
            "{\"message\":\"Fatal: null pointer\",\"code\":\"500\",\"file\":\"a.php\",\"line\":10,"
                    + "\"critical\":true,\"bypassDuplicateCheck\":true,\"extra\":{\"order\":\"A-17\"}}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ErrorReportingPipeline pipeline;

    @MockBean
    private ReporterDiagnostics diagnostics;

    @Test
    void shouldAcceptDeliveredReport() throws Exception {
        when(pipeline.submit(any())).thenReturn(ReportResult.delivered("cafebabe", "1a2b3c4d", Severity.HIGH));

        mockMvc.perform(post("/api/error-reports")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REPORT_JSON))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.state").value("DELIVERED"))
                .andExpect(jsonPath("$.referenceId").value("1a2b3c4d"))
                .andExpect(jsonPath("$.severity").value("high"));

        ArgumentCaptor<ErrorReport> captor = ArgumentCaptor.forClass(ErrorReport.class);
        verify(pipeline).submit(captor.capture());
        assertThat(captor.getValue().getLine()).isEqualTo(10);
        assertThat(captor.getValue().isCritical()).isFalse();
        assertThat(captor.getValue().isBypassDuplicateCheck()).isFalse();
        assertThat(captor.getValue().getExtra()).containsEntry("order", "A-17");
    }

    @Test
    void shouldReturnOkForSkippedDuplicate() throws Exception {
        when(pipeline.submit(any())).thenReturn(ReportResult.skipped("cafebabe"));

        mockMvc.perform(post("/api/error-reports")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REPORT_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reason").value("duplicate"));
    }

    @Test
    void shouldMapRejectionsAndFailures() throws Exception {
        when(pipeline.submit(any()))
                .thenReturn(ReportResult.rejected(FailureKind.VALIDATION, List.of("Required field 'line' is missing")))
                .thenReturn(ReportResult.rejected(FailureKind.RATE_LIMITED, List.of("Rate limit exceeded")))
                .thenReturn(ReportResult.failed(FailureKind.DELIVERY, "SMTP 421"));

        mockMvc.perform(post("/api/error-reports").contentType(MediaType.APPLICATION_JSON).content(REPORT_JSON))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errors[0]").value("Required field 'line' is missing"));
        mockMvc.perform(post("/api/error-reports").contentType(MediaType.APPLICATION_JSON).content(REPORT_JSON))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.reason").value("rate_limited"));
        mockMvc.perform(post("/api/error-reports").contentType(MediaType.APPLICATION_JSON).content(REPORT_JSON))
                .andExpect(status().isBadGateway());
    }

    @Test
    void shouldExposeStats() throws Exception {
        when(pipeline.getStats()).thenReturn(ReportStats.builder()
                .trackedErrors(4)
                .rateLimitRemaining(1)
                .windowExpires(600L)
                .build());

        mockMvc.perform(get("/api/error-reports/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.trackedErrors").value(4))
                .andExpect(jsonPath("$.rateLimitRemaining").value(1))
                .andExpect(jsonPath("$.windowExpires").value(600));
    }

    @Test
    void shouldExposeDiagnostics() throws Exception {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("storage", 2L);
        when(diagnostics.snapshot()).thenReturn(counts);

        mockMvc.perform(get("/api/error-reports/diagnostics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.storage").value(2));
    }

    @Test
    void shouldResetDiagnosticsAndReturnPreviousCounts() throws Exception {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("delivery", 3L);
        when(diagnostics.snapshot()).thenReturn(counts);

        mockMvc.perform(delete("/api/error-reports/diagnostics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.delivery").value(3));

        verify(diagnostics).reset();
    }

    @Test
    void shouldClearTrackedErrorsAndResetWindow() throws Exception {
        when(pipeline.clearTrackedErrors()).thenReturn(true);
        when(pipeline.resetRateLimit()).thenReturn(false);

        mockMvc.perform(delete("/api/error-reports/tracked"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
        mockMvc.perform(delete("/api/error-reports/rate-limit"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.success").value(false));
    }
}
