package com.errorbuddy.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of everything that can stop or degrade a report.
 * Only {@link #VALIDATION} is fatal; the rest degrade to a safe default.
 */
public enum FailureKind {
    VALIDATION("validation"),
    DUPLICATE_SKIPPED("duplicate"),
    RATE_LIMITED("rate_limited"),
    STORAGE("storage"),
    DELIVERY("delivery"),
    PROBE("probe"),
    LOG_READ("log_read"),
    INTERNAL("internal");

    private final String code;

    FailureKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
