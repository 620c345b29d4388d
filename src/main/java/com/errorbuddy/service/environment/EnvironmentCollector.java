package com.errorbuddy.service.environment;

import com.errorbuddy.model.FailureKind;
import com.errorbuddy.service.diagnostics.ReporterDiagnostics;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs every probe and assembles the environment snapshot in probe order.
 * A failing probe leaves a placeholder for its own fact only.
 */
@Slf4j
public class EnvironmentCollector {

    private final List<EnvironmentProbe> probes;
    private final ReporterDiagnostics diagnostics;

    public EnvironmentCollector(List<EnvironmentProbe> probes, ReporterDiagnostics diagnostics) {
        this.probes = List.copyOf(probes);
        this.diagnostics = diagnostics;
    }

    public Map<String, String> collect() {
        Map<String, String> environment = new LinkedHashMap<>();
        for (EnvironmentProbe probe : probes) {
            String name = probe.name();
            try {
                environment.put(name, render(probe.collect()));
            } catch (Exception | LinkageError e) {
                diagnostics.record(FailureKind.PROBE, "Environment probe '" + name + "' failed", e);
                environment.put(name, placeholder(e));
            }
        }
        log.debug("Collected {} environment facts", environment.size());
        return environment;
    }

    public List<String> getProbeNames() {
        return probes.stream().map(EnvironmentProbe::name).collect(Collectors.toList());
    }

    static String placeholder(Throwable e) {
        return "unavailable (" + e.getClass().getSimpleName() + ": " + e.getMessage() + ")";
    }

    private static String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Collection<?>) {
            return ((Collection<?>) value).stream()
                    .map(String::valueOf)
                    .collect(Collectors.joining(", "));
        }
        return String.valueOf(value);
    }
}
