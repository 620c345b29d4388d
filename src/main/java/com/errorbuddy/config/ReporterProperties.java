package com.errorbuddy.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import jakarta.annotation.PostConstruct;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Data
@ConfigurationProperties(prefix = "error-reporter")
public class ReporterProperties {

    // Tenant identity, hashed into the rate limit key and the reference id
    private String siteId = "default";
    private String siteName = "ErrorBuddy";
    private String siteUrl = "http://localhost";

    // Stripped from reported file paths
    private String basePath;
    private String appVersion;

    private List<String> requiredFields = new ArrayList<>(List.of("message", "code", "file", "line"));

    private int stackTraceMaxChars = 10_000;

    private Dedup dedup = new Dedup();
    private RateLimit rateLimit = new RateLimit();
    private LogTail logTail = new LogTail();
    private Mail mail = new Mail();

    @Data
    public static class Dedup {
        private int maxTrackedEntries = 1000;
        private long trackDurationSeconds = 604_800L;  // 7 days
        private boolean includeVersionTag = true;
        // Empty keeps tracked signatures in memory only
        private String storeFile;
    }

    @Data
    public static class RateLimit {
        private boolean enabled = true;
        private long windowSeconds = 600L;
        private int maxReportsPerWindow = 5;
    }

    @Data
    public static class LogTail {
        private boolean enabled = true;
        private String path;
        private int lines = 100;
        private int chunkBytes = 8192;
        private long maxBytes = 5_242_880L;  // 5 MiB
    }

    @Data
    public static class Mail {
        private boolean enabled = false;
        private String recipient;
        private String from = "errors@errorbuddy.local";
        private String fromName = "ErrorBuddy Reporter";
        private String subjectPrefix = "[Error Report]";
    }

    @PostConstruct
    public void init() {
        log.info("=== ErrorReporter Properties Loaded ===");
        log.info("Site: {} ({})", siteName, siteUrl);
        log.info("Required fields: {}", requiredFields);
        log.info("Dedup: max {} entries, ttl {}s", dedup.getMaxTrackedEntries(), dedup.getTrackDurationSeconds());
        log.info("Rate limit: enabled={}, {} per {}s",
                rateLimit.isEnabled(), rateLimit.getMaxReportsPerWindow(), rateLimit.getWindowSeconds());
        log.info("Log tail: enabled={}, path={}", logTail.isEnabled(), logTail.getPath());
        log.info("Mail: enabled={}, recipient={}", mail.isEnabled(), mail.getRecipient());
        log.info("=======================================");
    }
}
