package com.errorbuddy.service.report;

import com.errorbuddy.model.ErrorReport;
import com.errorbuddy.model.LogTail;
import com.errorbuddy.model.ReportState;
import com.errorbuddy.service.dedup.SignatureGenerator;
import com.errorbuddy.service.environment.EnvironmentCollector;
import com.errorbuddy.service.logtail.LogTailReader;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * State of a single pipeline run.
 * <p>
 * Memoizes the signature, environment snapshot and log tail so each is
 * computed at most once per run. Not shared between runs.
 */
@Slf4j
class ReportContext {

    private final ErrorReport report;
    private final SignatureGenerator signatureGenerator;
    private final EnvironmentCollector environmentCollector;
    private final LogTailReader logTailReader;

    private ReportState state = ReportState.RECEIVED;
    private String signature;
    private Map<String, String> environment;
    private LogTail logTail;

    ReportContext(ErrorReport report,
                  SignatureGenerator signatureGenerator,
                  EnvironmentCollector environmentCollector,
                  LogTailReader logTailReader) {
        this.report = report;
        this.signatureGenerator = signatureGenerator;
        this.environmentCollector = environmentCollector;
        this.logTailReader = logTailReader;
    }

    ErrorReport report() {
        return report;
    }

    void transition(ReportState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Report already finished as " + state);
        }
        log.debug("Report {} -> {}", state, next);
        state = next;
    }

    String signature() {
        if (signature == null) {
            signature = signatureGenerator.signatureOf(report);
        }
        return signature;
    }

    Map<String, String> environment() {
        if (environment == null) {
            environment = environmentCollector.collect();
        }
        return environment;
    }

    LogTail logTail() {
        if (logTail == null) {
            logTail = logTailReader.readDebugLog();
        }
        return logTail;
    }
}
