package com.errorbuddy.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
