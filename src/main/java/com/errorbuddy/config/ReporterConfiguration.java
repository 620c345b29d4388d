package com.errorbuddy.config;

import com.errorbuddy.integration.delivery.DeliverySink;
import com.errorbuddy.integration.delivery.LoggingDeliverySink;
import com.errorbuddy.integration.delivery.MailDeliverySink;
import com.errorbuddy.service.diagnostics.ReporterDiagnostics;
import com.errorbuddy.service.environment.EnvironmentCollector;
import com.errorbuddy.service.environment.EnvironmentProbe;
import com.errorbuddy.service.environment.JvmEnvironmentProbes;
import com.errorbuddy.service.report.ReportValidator;
import com.errorbuddy.service.report.RequiredFieldsValidator;
import com.errorbuddy.store.DedupStore;
import com.errorbuddy.store.InMemoryDedupStore;
import com.errorbuddy.store.InMemoryRateCounterStore;
import com.errorbuddy.store.JsonFileDedupStore;
import com.errorbuddy.store.RateCounterStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.mail.javamail.JavaMailSender;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class ReporterConfiguration {

    private final ReporterProperties properties;

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public DedupStore dedupStore(ObjectMapper objectMapper) {
        String storeFile = properties.getDedup().getStoreFile();
        if (storeFile == null || storeFile.isBlank()) {
            log.info("Tracking error signatures in memory");
            return new InMemoryDedupStore();
        }
        Path path = Path.of(storeFile).toAbsolutePath().normalize();
        log.info("Tracking error signatures in {}", path);
        return new JsonFileDedupStore(path, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public RateCounterStore rateCounterStore(Clock clock) {
        return new InMemoryRateCounterStore(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReportValidator reportValidator() {
        return new RequiredFieldsValidator(properties.getRequiredFields());
    }

    @Bean
    @ConditionalOnProperty(name = "error-reporter.mail.enabled", havingValue = "true")
    public DeliverySink mailDeliverySink(ObjectProvider<JavaMailSender> mailSender) {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            log.warn("Mail delivery enabled but no JavaMailSender is configured (spring.mail.host)");
        }
        return new MailDeliverySink(sender, properties);
    }

    @Bean
    @ConditionalOnProperty(name = "error-reporter.mail.enabled", havingValue = "false", matchIfMissing = true)
    public DeliverySink loggingDeliverySink() {
        log.info("Mail delivery disabled, error reports go to the application log");
        return new LoggingDeliverySink();
    }

    @Bean
    public EnvironmentCollector environmentCollector(Environment environment,
                                                     ObjectProvider<EnvironmentProbe> extraProbes,
                                                     DedupStore dedupStore,
                                                     RateCounterStore rateCounterStore,
                                                     DeliverySink deliverySink,
                                                     ReporterDiagnostics diagnostics) {
        List<String> integrations = List.of(
                "dedup-store:" + dedupStore.getStoreType(),
                "rate-store:" + rateCounterStore.getStoreType(),
                "delivery:" + deliverySink.getSinkType());

        List<EnvironmentProbe> probes = new ArrayList<>(
                JvmEnvironmentProbes.defaults(properties, environment, integrations));
        probes.addAll(extraProbes.orderedStream().collect(Collectors.toList()));

        log.info("Environment probes: {}", probes.stream().map(EnvironmentProbe::name).collect(Collectors.toList()));
        return new EnvironmentCollector(probes, diagnostics);
    }
}
