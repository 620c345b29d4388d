package com.errorbuddy.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Outcome of one pipeline run.
 */
@Data
@Builder
public class ReportResult {
    private ReportState state;
    private FailureKind reason;
    private List<String> errors;
    private String signature;
    private String referenceId;
    private Severity severity;

    /**
     * Delivered and skipped reports both count as handled from the caller's view.
     */
    public boolean isSuccessful() {
        return state == ReportState.DELIVERED || state == ReportState.SKIPPED;
    }

    public static ReportResult delivered(String signature, String referenceId, Severity severity) {
        return ReportResult.builder()
                .state(ReportState.DELIVERED)
                .errors(List.of())
                .signature(signature)
                .referenceId(referenceId)
                .severity(severity)
                .build();
    }

    public static ReportResult skipped(String signature) {
        return ReportResult.builder()
                .state(ReportState.SKIPPED)
                .reason(FailureKind.DUPLICATE_SKIPPED)
                .errors(List.of())
                .signature(signature)
                .build();
    }

    public static ReportResult rejected(FailureKind reason, List<String> errors) {
        return ReportResult.builder()
                .state(ReportState.REJECTED)
                .reason(reason)
                .errors(List.copyOf(errors))
                .build();
    }

    public static ReportResult failed(FailureKind reason, String detail) {
        return ReportResult.builder()
                .state(ReportState.FAILED)
                .reason(reason)
                .errors(List.of(detail != null ? detail : "unknown failure"))
                .build();
    }
}
