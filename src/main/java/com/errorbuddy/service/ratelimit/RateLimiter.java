package com.errorbuddy.service.ratelimit;

import com.errorbuddy.config.ReporterProperties;
import com.errorbuddy.model.FailureKind;
import com.errorbuddy.service.diagnostics.ReporterDiagnostics;
import com.errorbuddy.store.RateCounterStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;

/**
 * Fixed-window cap on outbound reports per tenant.
 * <p>
 * The counter lives in the store with a TTL equal to the window, set by the
 * first increment and kept by later ones, so an idle window resets itself.
 * Bursts of up to twice the cap across a window boundary are accepted.
 */
@Slf4j
@Service
public class RateLimiter {

    private static final String KEY_PREFIX = "error_rate_";

    private final RateCounterStore store;
    private final ReporterProperties properties;
    private final ReporterDiagnostics diagnostics;
    private final Clock clock;
    private final String rateKey;

    public RateLimiter(RateCounterStore store,
                       ReporterProperties properties,
                       ReporterDiagnostics diagnostics,
                       Clock clock) {
        this.store = store;
        this.properties = properties;
        this.diagnostics = diagnostics;
        this.clock = clock;
        this.rateKey = KEY_PREFIX + DigestUtils.md5DigestAsHex(
                String.valueOf(properties.getSiteId()).getBytes(StandardCharsets.UTF_8)).substring(0, 12);
    }

    public boolean canSend() {
        if (!properties.getRateLimit().isEnabled()) {
            return true;
        }
        try {
            return store.get(rateKey) < maxReports();
        } catch (RuntimeException e) {
            diagnostics.record(FailureKind.STORAGE, "Rate limit check failed", e);
            return true;
        }
    }

    public void increment() {
        try {
            long now = clock.instant().getEpochSecond();
            int current = store.get(rateKey);
            long expiresAt = store.getExpiry(rateKey);

            Duration ttl = current > 0 && expiresAt > now
                    ? Duration.ofSeconds(expiresAt - now)
                    : window();
            store.set(rateKey, current + 1, ttl);
        } catch (RuntimeException e) {
            diagnostics.record(FailureKind.STORAGE, "Rate limit increment failed", e);
        }
    }

    public boolean reset() {
        try {
            store.delete(rateKey);
            log.info("Rate limit window reset for key {}", rateKey);
            return true;
        } catch (RuntimeException e) {
            diagnostics.record(FailureKind.STORAGE, "Rate limit reset failed", e);
            return false;
        }
    }

    public int getRemaining() {
        try {
            return Math.max(0, maxReports() - store.get(rateKey));
        } catch (RuntimeException e) {
            diagnostics.record(FailureKind.STORAGE, "Rate limit lookup failed", e);
            return maxReports();
        }
    }

    /**
     * @return window expiry as epoch seconds, 0 when no window is open
     */
    public long getWindowExpires() {
        try {
            return store.getExpiry(rateKey);
        } catch (RuntimeException e) {
            diagnostics.record(FailureKind.STORAGE, "Rate window lookup failed", e);
            return 0L;
        }
    }

    public String getRateKey() {
        return rateKey;
    }

    private int maxReports() {
        return Math.max(0, properties.getRateLimit().getMaxReportsPerWindow());
    }

    private Duration window() {
        return Duration.ofSeconds(Math.max(1, properties.getRateLimit().getWindowSeconds()));
    }
}
