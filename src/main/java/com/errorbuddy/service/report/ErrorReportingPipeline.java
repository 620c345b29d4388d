package com.errorbuddy.service.report;

import com.errorbuddy.config.ReporterProperties;
import com.errorbuddy.integration.delivery.DeliverySink;
import com.errorbuddy.model.ErrorReport;
import com.errorbuddy.model.FailureKind;
import com.errorbuddy.model.ReportPayload;
import com.errorbuddy.model.ReportResult;
import com.errorbuddy.model.ReportState;
import com.errorbuddy.model.ReportStats;
import com.errorbuddy.service.dedup.DuplicateFilter;
import com.errorbuddy.service.dedup.SignatureGenerator;
import com.errorbuddy.service.diagnostics.ReporterDiagnostics;
import com.errorbuddy.service.environment.EnvironmentCollector;
import com.errorbuddy.service.logtail.LogTailReader;
import com.errorbuddy.service.ratelimit.RateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for reporting an error.
 * <p>
 * Runs validate, dedup, rate limit, enrich and deliver in that order. Only
 * validation can reject a report on its own; every other stage degrades to a
 * safe default and records the degradation on {@link ReporterDiagnostics}.
 * Nothing thrown by a collaborator escapes to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ErrorReportingPipeline {

    static final String CONTEXT_KEY = "extra_context";
    static final String REQUEST_URI_KEY = "request_uri";
    static final String USER_AGENT_KEY = "user_agent";

    private final ReportValidator validator;
    private final ReportSanitizer sanitizer;
    private final SignatureGenerator signatureGenerator;
    private final DuplicateFilter duplicateFilter;
    private final RateLimiter rateLimiter;
    private final EnvironmentCollector environmentCollector;
    private final LogTailReader logTailReader;
    private final DeliverySink deliverySink;
    private final ReporterProperties properties;
    private final ReporterDiagnostics diagnostics;
    private final Clock clock;

    public ReportResult submit(ErrorReport report) {
        if (report == null) {
            return ReportResult.rejected(FailureKind.VALIDATION, List.of("Report is required"));
        }
        try {
            return run(new ReportContext(report, signatureGenerator, environmentCollector, logTailReader));
        } catch (RuntimeException e) {
            diagnostics.record(FailureKind.INTERNAL, "Error reporting pipeline failed", e);
            return ReportResult.failed(FailureKind.INTERNAL, e.getMessage());
        }
    }

    /**
     * @return true when the report was delivered or intentionally skipped as a duplicate
     */
    public boolean report(ErrorReport report) {
        return submit(report).isSuccessful();
    }

    /**
     * Builds a report from an exception and submits it.
     *
     * @param context optional caller context, kept under {@code extra_context};
     *                its {@code critical} and {@code bypassDuplicateCheck} keys set the overrides
     */
    public boolean reportFromException(Throwable throwable, Map<String, Object> context) {
        if (throwable == null) {
            return false;
        }
        try {
            return report(fromException(throwable, context));
        } catch (RuntimeException e) {
            diagnostics.record(FailureKind.INTERNAL, "Could not build report from exception", e);
            return false;
        }
    }

    public boolean clearTrackedErrors() {
        return duplicateFilter.clearAll();
    }

    public boolean resetRateLimit() {
        return rateLimiter.reset();
    }

    public ReportStats getStats() {
        return ReportStats.builder()
                .trackedErrors(duplicateFilter.getCount())
                .rateLimitRemaining(rateLimiter.getRemaining())
                .windowExpires(rateLimiter.getWindowExpires())
                .build();
    }

    private ReportResult run(ReportContext context) {
        ErrorReport report = sanitizer.sanitize(context.report());

        // 1. Validate
        List<String> errors = validator.validate(report);
        if (!errors.isEmpty()) {
            context.transition(ReportState.REJECTED);
            log.info("Rejected error report: {}", errors);
            return ReportResult.rejected(FailureKind.VALIDATION, errors);
        }
        context.transition(ReportState.VALIDATED);

        // 2. Dedup
        String signature = context.signature();
        boolean dedupBypassed = report.isCritical() || report.isBypassDuplicateCheck();
        if (!dedupBypassed && duplicateFilter.isDuplicate(signature)) {
            context.transition(ReportState.SKIPPED);
            log.info("Skipped duplicate error report {}", signature);
            return ReportResult.skipped(signature);
        }
        context.transition(ReportState.DEDUP_CHECKED);

        // 3. Rate limit
        if (!rateLimiter.canSend()) {
            if (!report.isCritical()) {
                context.transition(ReportState.REJECTED);
                log.info("Rate limit reached, rejected error report {}", signature);
                return ReportResult.builder()
                        .state(ReportState.REJECTED)
                        .reason(FailureKind.RATE_LIMITED)
                        .errors(List.of("Rate limit exceeded"))
                        .signature(signature)
                        .build();
            }
            log.warn("Rate limit reached, resetting window for critical report {}", signature);
            rateLimiter.reset();
        }
        context.transition(ReportState.RATE_CHECKED);

        // 4. Enrich
        ReportPayload payload = enrich(context);
        context.transition(ReportState.ENRICHED);

        // 5. Deliver
        String failure = deliver(payload);
        if (failure != null) {
            context.transition(ReportState.FAILED);
            return ReportResult.builder()
                    .state(ReportState.FAILED)
                    .reason(FailureKind.DELIVERY)
                    .errors(List.of(failure))
                    .signature(signature)
                    .referenceId(report.getReferenceId())
                    .severity(report.getSeverity())
                    .build();
        }

        // 6. Record
        duplicateFilter.markReported(signature);
        rateLimiter.increment();
        context.transition(ReportState.DELIVERED);
        log.info("Delivered error report {} (ref {}, severity {})",
                signature, report.getReferenceId(), report.getSeverity().label());
        return ReportResult.delivered(signature, report.getReferenceId(), report.getSeverity());
    }

    private ReportPayload enrich(ReportContext context) {
        ErrorReport report = context.report();
        if (report.getTimestamp() == null) {
            report.setTimestamp(clock.instant());
        }
        report.setSeverity(SeverityClassifier.classify(report.getCode(), report.getMessage()));
        report.setRelativeFilePath(relativePath(report.getFile()));
        report.setReferenceId(referenceId(report));

        return ReportPayload.builder()
                .errorMessage(report.getMessage())
                .errorCode(report.getCode())
                .relativeFilePath(report.getRelativeFilePath())
                .errorLine(report.getLine() != null ? report.getLine() : 0)
                .severity(report.getSeverity())
                .referenceId(report.getReferenceId())
                .environment(context.environment())
                .logTail(context.logTail().asText())
                .stackTrace(report.getStackTrace())
                .siteName(properties.getSiteName())
                .siteUrl(properties.getSiteUrl())
                .timestamp(DateTimeFormatter.ISO_INSTANT.format(report.getTimestamp()))
                .extra(report.getExtra())
                .build();
    }

    /**
     * @return null on success, otherwise a failure detail for the caller
     */
    private String deliver(ReportPayload payload) {
        try {
            if (deliverySink.send(payload)) {
                return null;
            }
            diagnostics.record(FailureKind.DELIVERY, "Delivery sink " + deliverySink.getSinkType() + " declined the report");
            return "Delivery sink " + deliverySink.getSinkType() + " did not accept the report";
        } catch (RuntimeException e) {
            log.error("Delivery sink {} failed: {}", deliverySink.getSinkType(), e.getMessage());
            diagnostics.record(FailureKind.DELIVERY, "Delivery sink " + deliverySink.getSinkType() + " threw", e);
            return "Delivery failed: " + e.getMessage();
        }
    }

    String relativePath(String file) {
        String basePath = properties.getBasePath();
        if (file == null || basePath == null || basePath.isBlank()) {
            return file;
        }
        if (!file.startsWith(basePath)) {
            return file;
        }
        String relative = file.substring(basePath.length());
        if (!relative.isEmpty() && !isSeparator(relative.charAt(0)) && !isSeparator(basePath.charAt(basePath.length() - 1))) {
            // Sibling directory sharing the prefix, e.g. /var/www2 under /var/www
            return file;
        }
        while (relative.startsWith("/") || relative.startsWith("\\")) {
            relative = relative.substring(1);
        }
        return relative;
    }

    private static boolean isSeparator(char c) {
        return c == '/' || c == '\\';
    }

    private String referenceId(ErrorReport report) {
        String seed = properties.getSiteId() + "|" + report.getFile() + "|" + report.getLine()
                + "|" + report.getTimestamp().getEpochSecond();
        return DigestUtils.md5DigestAsHex(seed.getBytes(StandardCharsets.UTF_8)).substring(0, 8);
    }

    ErrorReport fromException(Throwable throwable, Map<String, Object> context) {
        StackTraceElement[] frames = throwable.getStackTrace();
        StackTraceElement top = frames != null && frames.length > 0 ? frames[0] : null;

        String message = throwable.getMessage() != null && !throwable.getMessage().isBlank()
                ? throwable.getMessage()
                : throwable.getClass().getName();
        String file = top != null && top.getFileName() != null ? top.getFileName() : "unknown";
        // Native and synthetic frames carry no line number
        int line = top != null && top.getLineNumber() > 0 ? top.getLineNumber() : 1;

        Map<String, Object> extra = new LinkedHashMap<>();
        addRequestContext(extra);
        boolean critical = false;
        boolean bypassDuplicateCheck = false;
        if (context != null && !context.isEmpty()) {
            extra.put(CONTEXT_KEY, new LinkedHashMap<>(context));
            critical = isTrue(context.get("critical"));
            bypassDuplicateCheck = isTrue(context.get("bypassDuplicateCheck"));
        }

        return ErrorReport.builder()
                .message(message)
                .code(throwable.getClass().getSimpleName())
                .file(file)
                .line(line)
                .stackTrace(truncate(printStackTrace(throwable)))
                .timestamp(clock.instant())
                .extra(extra)
                .critical(critical)
                .bypassDuplicateCheck(bypassDuplicateCheck)
                .build();
    }

    /**
     * Adds the URI and user agent of the HTTP request bound to this thread, if any.
     */
    private static void addRequestContext(Map<String, Object> extra) {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (!(attributes instanceof ServletRequestAttributes)) {
            return;
        }
        HttpServletRequest request = ((ServletRequestAttributes) attributes).getRequest();
        String uri = request.getRequestURI();
        if (request.getQueryString() != null) {
            uri = uri + "?" + request.getQueryString();
        }
        String userAgent = request.getHeader(HttpHeaders.USER_AGENT);
        extra.put(REQUEST_URI_KEY, uri != null ? uri : "");
        extra.put(USER_AGENT_KEY, userAgent != null ? userAgent : "");
    }

    private String truncate(String stackTrace) {
        int max = properties.getStackTraceMaxChars();
        if (max <= 0 || stackTrace.length() <= max) {
            return stackTrace;
        }
        return stackTrace.substring(0, max)
                + "\n... (truncated, " + (stackTrace.length() - max) + " more characters)";
    }

    private static String printStackTrace(Throwable throwable) {
        StringWriter writer = new StringWriter();
        throwable.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    private static boolean isTrue(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }
}
