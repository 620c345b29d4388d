package com.errorbuddy.model;

import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Report body accepted over HTTP. Overrides and enrichment fields are not
 * part of it; remote callers cannot bypass dedup or rate limiting.
 */
@Data
public class ErrorReportRequest {
    private String message;
    private String code;
    private String file;
    private Integer line;
    private String stackTrace;
    private Instant timestamp;
    private Map<String, Object> extra = new LinkedHashMap<>();
}
