package com.errorbuddy.support;

import com.errorbuddy.model.ErrorReport;

/**
 * Report fixtures shared across tests.
 */
public final class Reports {

    private Reports() {
    }

    public static ErrorReport.ErrorReportBuilder valid() {
        return ErrorReport.builder()
                .message("Fatal: null pointer")
                .code("500")
                .file("a.php")
                .line(10);
    }

    public static ErrorReport distinct(int index) {
        return valid()
                .message("Failure number " + index)
                .line(100 + index)
                .build();
    }
}
