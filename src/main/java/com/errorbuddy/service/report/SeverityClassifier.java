package com.errorbuddy.service.report;

import com.errorbuddy.model.Severity;

import java.util.Locale;

/**
 * Coarse triage bucket from the error code and message.
 */
public final class SeverityClassifier {

    private SeverityClassifier() {
    }

    public static Severity classify(String code, String message) {
        Integer numericCode = parseCode(code);
        if (numericCode != null) {
            if (numericCode >= 500) {
                return Severity.HIGH;
            }
            if (numericCode >= 400) {
                return Severity.MEDIUM;
            }
        }

        String text = message != null ? message.toLowerCase(Locale.ROOT) : "";
        if (text.contains("fatal") || text.contains("critical")) {
            return Severity.HIGH;
        }
        if (text.contains("warning")) {
            return Severity.MEDIUM;
        }
        if (text.contains("notice")) {
            return Severity.LOW;
        }
        return Severity.MEDIUM;
    }

    private static Integer parseCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(code.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
