package com.errorbuddy.service.report;

import com.errorbuddy.model.ErrorReport;
import com.errorbuddy.support.Reports;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RequiredFieldsValidatorTest {

    private final RequiredFieldsValidator validator =
            new RequiredFieldsValidator(List.of("message", "code", "file", "line"));

    @Test
    void shouldAcceptCompleteReport() {
        assertThat(validator.validate(Reports.valid().build())).isEmpty();
    }

    @Test
    void shouldReportEachMissingField() {
        ErrorReport report = ErrorReport.builder().message("boom").code("  ").build();

        assertThat(validator.validate(report)).containsExactly(
                "Required field 'code' is missing",
                "Required field 'file' is missing",
                "Required field 'line' is missing");
    }

    @Test
    void shouldRejectNonPositiveLine() {
        assertThat(validator.validate(Reports.valid().line(0).build()))
                .containsExactly("Required field 'line' is missing");
    }

    @Test
    void shouldCheckExtraFieldsByName() {
        RequiredFieldsValidator withTenant = new RequiredFieldsValidator(List.of("message", "tenant"));

        assertThat(withTenant.validate(Reports.valid().build()))
                .containsExactly("Required field 'tenant' is missing");
        assertThat(withTenant.validate(Reports.valid().extra(Map.of("tenant", "acme")).build()))
                .isEmpty();
    }
}
