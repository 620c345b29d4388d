package com.errorbuddy.service.diagnostics;

import com.errorbuddy.model.FailureKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReporterDiagnosticsTest {

    private final ReporterDiagnostics diagnostics = new ReporterDiagnostics();

    @Test
    void shouldCountPerKindInDeclarationOrder() {
        diagnostics.record(FailureKind.LOG_READ, "tail failed");
        diagnostics.record(FailureKind.STORAGE, "store down", new IllegalStateException("refused"));
        diagnostics.record(FailureKind.STORAGE, "store down again");

        assertThat(diagnostics.count(FailureKind.STORAGE)).isEqualTo(2);
        assertThat(diagnostics.count(FailureKind.PROBE)).isZero();
        assertThat(diagnostics.snapshot().keySet()).containsExactly("storage", "log_read");
    }

    @Test
    void shouldClearCountersOnReset() {
        diagnostics.record(FailureKind.DELIVERY, "sink declined");

        diagnostics.reset();

        assertThat(diagnostics.snapshot()).isEmpty();
    }
}
