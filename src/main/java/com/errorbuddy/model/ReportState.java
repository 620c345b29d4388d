package com.errorbuddy.model;

/**
 * Pipeline states. The last four are terminal.
 */
public enum ReportState {
    RECEIVED,
    VALIDATED,
    DEDUP_CHECKED,
    RATE_CHECKED,
    ENRICHED,
    DELIVERED,
    SKIPPED,
    REJECTED,
    FAILED;

    public boolean isTerminal() {
        return this == DELIVERED || this == SKIPPED || this == REJECTED || this == FAILED;
    }
}
