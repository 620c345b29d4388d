package com.errorbuddy.service.report;

import com.errorbuddy.model.ErrorReport;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Cleans caller supplied text before it reaches validation, the signature or
 * the email body.
 * <p>
 * Single-line fields lose markup, control characters and redundant whitespace.
 * Stack traces keep their line structure.
 */
@Component
public class ReportSanitizer {

    private static final Pattern TAGS = Pattern.compile("<[^>]*>");
    private static final Pattern CONTROL = Pattern.compile("[\\p{Cntrl}&&[^\\n\\t]]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public ErrorReport sanitize(ErrorReport report) {
        report.setMessage(singleLine(report.getMessage()));
        report.setCode(singleLine(report.getCode()));
        report.setFile(singleLine(report.getFile()));
        report.setStackTrace(multiLine(report.getStackTrace()));

        if (report.getExtra() != null) {
            Map<String, Object> cleaned = new LinkedHashMap<>();
            report.getExtra().forEach((key, value) ->
                    cleaned.put(key, value instanceof String ? singleLine((String) value) : value));
            report.setExtra(cleaned);
        } else {
            report.setExtra(new LinkedHashMap<>());
        }
        return report;
    }

    static String singleLine(String value) {
        if (value == null) {
            return null;
        }
        String text = TAGS.matcher(value).replaceAll("");
        text = CONTROL.matcher(text).replaceAll("");
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    static String multiLine(String value) {
        if (value == null) {
            return null;
        }
        String text = value.replace("\r\n", "\n");
        text = TAGS.matcher(text).replaceAll("");
        return CONTROL.matcher(text).replaceAll("");
    }
}
