package com.errorbuddy.integration.delivery;

import com.errorbuddy.model.ReportPayload;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes reports to the application log. Used when mail is not configured.
 */
@Slf4j
public class LoggingDeliverySink implements DeliverySink {

    @Override
    public boolean send(ReportPayload payload) {
        log.error("Error report [{}] {} ({}) at {}:{} severity={}",
                payload.getReferenceId(),
                payload.getErrorMessage(),
                payload.getErrorCode(),
                payload.getRelativeFilePath(),
                payload.getErrorLine(),
                payload.getSeverity() != null ? payload.getSeverity().label() : "unknown");
        log.debug("Environment: {}", payload.getEnvironment());
        return true;
    }

    @Override
    public String getSinkType() {
        return "log";
    }
}
