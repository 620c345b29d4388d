package com.errorbuddy.service.report;

import com.errorbuddy.model.ErrorReport;

import java.util.List;

/**
 * Gate in front of the pipeline. The only stage allowed to reject a report outright.
 */
public interface ReportValidator {

    /**
     * @return one message per problem, empty when the report is acceptable
     */
    List<String> validate(ErrorReport report);
}
