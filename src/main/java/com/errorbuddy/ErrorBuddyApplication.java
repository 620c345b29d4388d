package com.errorbuddy;

import com.errorbuddy.config.ReporterProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * ErrorBuddy - error report pipeline with duplicate suppression and rate limiting
 */
@SpringBootApplication
@EnableConfigurationProperties(ReporterProperties.class)
public class ErrorBuddyApplication {

    public static void main(String[] args) {
        SpringApplication.run(ErrorBuddyApplication.class, args);
    }
}
