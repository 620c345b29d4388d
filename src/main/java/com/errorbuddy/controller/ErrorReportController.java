package com.errorbuddy.controller;

import com.errorbuddy.model.ErrorReport;
import com.errorbuddy.model.ErrorReportRequest;
import com.errorbuddy.model.FailureKind;
import com.errorbuddy.model.ReportResult;
import com.errorbuddy.model.ReportStats;
import com.errorbuddy.service.diagnostics.ReporterDiagnostics;
import com.errorbuddy.service.report.ErrorReportingPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ingest and admin endpoints for the error reporter.
 */
@Slf4j
@RestController
@RequestMapping("/api/error-reports")
@RequiredArgsConstructor
public class ErrorReportController {

    private final ErrorReportingPipeline pipeline;
    private final ReporterDiagnostics diagnostics;

    @PostMapping
    public ResponseEntity<ReportResult> submit(@RequestBody ErrorReportRequest request) {
        ReportResult result = pipeline.submit(toReport(request));
        return ResponseEntity.status(statusOf(result)).body(result);
    }

    @GetMapping("/stats")
    public ResponseEntity<ReportStats> getStats() {
        return ResponseEntity.ok(pipeline.getStats());
    }

    @GetMapping("/diagnostics")
    public ResponseEntity<Map<String, Long>> getDiagnostics() {
        return ResponseEntity.ok(diagnostics.snapshot());
    }

    @DeleteMapping("/diagnostics")
    public ResponseEntity<Map<String, Long>> resetDiagnostics() {
        Map<String, Long> previous = diagnostics.snapshot();
        diagnostics.reset();
        log.info("Diagnostic counters reset, previous={}", previous);
        return ResponseEntity.ok(previous);
    }

    @DeleteMapping("/tracked")
    public ResponseEntity<Map<String, Object>> clearTracked() {
        boolean cleared = pipeline.clearTrackedErrors();
        log.info("Clear tracked errors requested, success={}", cleared);
        return adminResponse(cleared);
    }

    @DeleteMapping("/rate-limit")
    public ResponseEntity<Map<String, Object>> resetRateLimit() {
        boolean reset = pipeline.resetRateLimit();
        log.info("Rate limit reset requested, success={}", reset);
        return adminResponse(reset);
    }

    private static ErrorReport toReport(ErrorReportRequest request) {
        return ErrorReport.builder()
                .message(request.getMessage())
                .code(request.getCode())
                .file(request.getFile())
                .line(request.getLine())
                .stackTrace(request.getStackTrace())
                .timestamp(request.getTimestamp())
                .extra(request.getExtra() != null ? new LinkedHashMap<>(request.getExtra()) : new LinkedHashMap<>())
                .build();
    }

    static HttpStatus statusOf(ReportResult result) {
        switch (result.getState()) {
            case DELIVERED:
                return HttpStatus.ACCEPTED;
            case SKIPPED:
                return HttpStatus.OK;
            case REJECTED:
                return result.getReason() == FailureKind.RATE_LIMITED
                        ? HttpStatus.TOO_MANY_REQUESTS
                        : HttpStatus.UNPROCESSABLE_ENTITY;
            default:
                return HttpStatus.BAD_GATEWAY;
        }
    }

    private static ResponseEntity<Map<String, Object>> adminResponse(boolean success) {
        Map<String, Object> body = Map.of("success", success);
        return success
                ? ResponseEntity.ok(body)
                : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
