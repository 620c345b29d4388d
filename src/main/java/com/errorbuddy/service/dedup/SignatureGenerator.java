package com.errorbuddy.service.dedup;

import com.errorbuddy.config.ReporterProperties;
import com.errorbuddy.model.ErrorReport;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Fingerprints a report from its identity fields (message, file, line, code).
 * <p>
 * The application version is mixed in when configured, so a bug fixed in a
 * release is reported again instead of staying suppressed. CRC32 is enough
 * here: a collision only suppresses one more email.
 */
@Component
@RequiredArgsConstructor
public class SignatureGenerator {

    private static final String SEPARATOR = "|";

    private final ReporterProperties properties;

    public String signatureOf(ErrorReport report) {
        StringBuilder identity = new StringBuilder()
                .append(nullToEmpty(report.getMessage())).append(SEPARATOR)
                .append(nullToEmpty(report.getFile())).append(SEPARATOR)
                .append(report.getLine() != null ? report.getLine() : "").append(SEPARATOR)
                .append(nullToEmpty(report.getCode()));

        String versionTag = versionTag();
        if (versionTag != null) {
            identity.append(SEPARATOR).append(versionTag);
        }

        CRC32 crc = new CRC32();
        crc.update(identity.toString().getBytes(StandardCharsets.UTF_8));
        return String.format("%08x", crc.getValue());
    }

    private String versionTag() {
        String version = properties.getAppVersion();
        if (!properties.getDedup().isIncludeVersionTag() || version == null || version.isBlank()) {
            return null;
        }
        return version.trim();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
