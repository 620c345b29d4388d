package com.errorbuddy.integration.delivery;

import com.errorbuddy.config.ReporterProperties;
import com.errorbuddy.model.ReportPayload;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;

import java.io.UnsupportedEncodingException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Sends each report as a plain text email to the configured recipient.
 */
@Slf4j
public class MailDeliverySink implements DeliverySink {

    private static final String RULE = "----------------------------------------";

    private final JavaMailSender mailSender;
    private final ReporterProperties properties;

    /**
     * @param mailSender may be null when no mail server is configured
     */
    public MailDeliverySink(JavaMailSender mailSender, ReporterProperties properties) {
        this.mailSender = mailSender;
        this.properties = properties;
    }

    @Override
    public boolean send(ReportPayload payload) {
        ReporterProperties.Mail mail = properties.getMail();
        if (mailSender == null || mail.getRecipient() == null || mail.getRecipient().isBlank()) {
            log.warn("No recipient configured or mail sender not available");
            return false;
        }

        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, false, StandardCharsets.UTF_8.name());

            helper.setFrom(mail.getFrom(), mail.getFromName());
            helper.setTo(mail.getRecipient());
            helper.setSubject(buildSubject(payload));
            helper.setText(buildBody(payload), false);

            mailSender.send(message);
            log.info("Error report {} mailed to {}", payload.getReferenceId(), mail.getRecipient());
            return true;
        } catch (MessagingException | UnsupportedEncodingException | MailException e) {
            throw new DeliveryException("Failed to send error report email", e);
        }
    }

    @Override
    public String getSinkType() {
        return "mail";
    }

    String buildSubject(ReportPayload payload) {
        return String.format("%s[%s]: %s",
                properties.getMail().getSubjectPrefix(),
                siteHost(payload.getSiteUrl()),
                payload.getErrorMessage());
    }

    String buildBody(ReportPayload payload) {
        StringBuilder body = new StringBuilder();
        body.append("An error was reported on ").append(payload.getSiteName())
                .append(" (").append(payload.getSiteUrl()).append(")\n\n");

        body.append("Reference: ").append(payload.getReferenceId()).append('\n');
        body.append("Severity:  ").append(payload.getSeverity() != null ? payload.getSeverity().label() : "").append('\n');
        body.append("Time:      ").append(payload.getTimestamp()).append('\n');
        body.append("Message:   ").append(payload.getErrorMessage()).append('\n');
        body.append("Code:      ").append(payload.getErrorCode()).append('\n');
        body.append("Location:  ").append(payload.getRelativeFilePath())
                .append(':').append(payload.getErrorLine()).append('\n');

        appendMap(body, "Additional information", payload.getExtra());
        appendMap(body, "Environment", payload.getEnvironment());

        if (payload.getStackTrace() != null && !payload.getStackTrace().isBlank()) {
            body.append('\n').append("Stack trace").append('\n').append(RULE).append('\n')
                    .append(payload.getStackTrace()).append('\n');
        }
        if (payload.getLogTail() != null && !payload.getLogTail().isEmpty()) {
            body.append('\n').append("Recent log entries").append('\n').append(RULE).append('\n')
                    .append(payload.getLogTail()).append('\n');
        }
        return body.toString();
    }

    private static void appendMap(StringBuilder body, String title, Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return;
        }
        body.append('\n').append(title).append('\n').append(RULE).append('\n');
        values.forEach((key, value) -> body.append(key).append(": ").append(value).append('\n'));
    }

    static String siteHost(String siteUrl) {
        if (siteUrl == null || siteUrl.isBlank()) {
            return "unknown";
        }
        try {
            String host = URI.create(siteUrl.trim()).getHost();
            return host != null ? host : siteUrl.trim();
        } catch (IllegalArgumentException e) {
            return siteUrl.trim();
        }
    }
}
