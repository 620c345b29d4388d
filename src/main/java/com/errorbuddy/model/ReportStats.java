package com.errorbuddy.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ReportStats {
    private int trackedErrors;
    private int rateLimitRemaining;
    // Epoch seconds, 0 when no window is open
    private long windowExpires;
}
