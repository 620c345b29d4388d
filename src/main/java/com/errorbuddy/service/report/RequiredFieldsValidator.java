package com.errorbuddy.service.report;

import com.errorbuddy.model.ErrorReport;

import java.util.ArrayList;
import java.util.List;

/**
 * Rejects reports with a missing or empty required field.
 * A line number must also be positive.
 */
public class RequiredFieldsValidator implements ReportValidator {

    private final List<String> requiredFields;

    public RequiredFieldsValidator(List<String> requiredFields) {
        this.requiredFields = List.copyOf(requiredFields);
    }

    @Override
    public List<String> validate(ErrorReport report) {
        List<String> errors = new ArrayList<>();
        for (String field : requiredFields) {
            if (isEmpty(report.fieldValue(field))) {
                errors.add(String.format("Required field '%s' is missing", field));
            }
        }
        return errors;
    }

    public List<String> getRequiredFields() {
        return requiredFields;
    }

    private static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence) {
            return value.toString().isBlank();
        }
        if (value instanceof Number) {
            // line numbers start at 1
            return ((Number) value).longValue() <= 0;
        }
        return false;
    }
}
