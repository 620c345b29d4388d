package com.errorbuddy.model;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Everything a delivery sink needs to render and send one report.
 */
@Data
@Builder
public class ReportPayload {
    private String errorMessage;
    private String errorCode;
    private String relativeFilePath;
    private int errorLine;
    private Severity severity;
    private String referenceId;
    private Map<String, String> environment;
    private String logTail;
    private String stackTrace;
    private String siteName;
    private String siteUrl;
    private String timestamp;
    private Map<String, Object> extra;
}
