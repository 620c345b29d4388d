package com.errorbuddy.service.diagnostics;

import com.errorbuddy.model.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Local channel for self-degradation events.
 * <p>
 * Everything the pipeline swallows on the caller's behalf (store outages,
 * failed probes, unreadable logs, sink failures) ends up here, on a logger
 * that is kept apart from the email path.
 */
@Component
public class ReporterDiagnostics {

    public static final String LOGGER_NAME = "errorbuddy.diagnostics";

    private static final Logger diagnostics = LoggerFactory.getLogger(LOGGER_NAME);

    private final Map<FailureKind, AtomicLong> counters = new ConcurrentHashMap<>();

    public void record(FailureKind kind, String message) {
        counter(kind).incrementAndGet();
        diagnostics.warn("[{}] {}", kind.code(), message);
    }

    public void record(FailureKind kind, String message, Throwable cause) {
        counter(kind).incrementAndGet();
        diagnostics.warn("[{}] {}: {}", kind.code(), message, cause.toString());
        diagnostics.debug("[{}] stack trace", kind.code(), cause);
    }

    public long count(FailureKind kind) {
        AtomicLong counter = counters.get(kind);
        return counter != null ? counter.get() : 0L;
    }

    /**
     * Counts per failure code, in declaration order of {@link FailureKind}.
     */
    public Map<String, Long> snapshot() {
        Map<FailureKind, Long> ordered = new EnumMap<>(FailureKind.class);
        counters.forEach((kind, value) -> ordered.put(kind, value.get()));

        Map<String, Long> result = new LinkedHashMap<>();
        ordered.forEach((kind, value) -> result.put(kind.code(), value));
        return result;
    }

    public void reset() {
        counters.clear();
    }

    private AtomicLong counter(FailureKind kind) {
        return counters.computeIfAbsent(kind, k -> new AtomicLong());
    }
}
