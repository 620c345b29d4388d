package com.errorbuddy.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One incident as handed over by the caller.
 * <p>
 * Flows through the pipeline and is enriched in place (severity, reference id,
 * relative path). Never persisted; only its signature outlives the attempt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorReport {
    private String message;
    private String code;
    private String file;
    private Integer line;
    private String stackTrace;
    private Instant timestamp;

    @Builder.Default
    private Map<String, Object> extra = new LinkedHashMap<>();

    // Overrides: critical bypasses dedup and rate limiting, the flag below bypasses dedup only
    private boolean critical;
    private boolean bypassDuplicateCheck;

    // Enrichment
    private Severity severity;
    private String referenceId;
    private String relativeFilePath;

    /**
     * Looks up a field by its wire name, as used in the required field list.
     */
    public Object fieldValue(String name) {
        if (name == null) {
            return null;
        }
        switch (name) {
            case "message":
                return message;
            case "code":
                return code;
            case "file":
                return file;
            case "line":
                return line;
            case "stack_trace":
            case "stackTrace":
                return stackTrace;
            case "timestamp":
                return timestamp;
            default:
                return extra != null ? extra.get(name) : null;
        }
    }
}
