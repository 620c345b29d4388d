package com.errorbuddy.integration.delivery;

import com.errorbuddy.model.ReportPayload;

/**
 * Outbound channel for enriched error reports.
 */
public interface DeliverySink {

    /**
     * Sends one report. No retry is attempted by callers.
     *
     * @return true if the report was handed off
     * @throws DeliveryException if the transport failed
     */
    boolean send(ReportPayload payload);

    String getSinkType();
}
