package com.poc.chmigrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Shared infrastructure beans: task-history repositories, JSON mapping and the
 * webhook HTTP client.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.poc.chmigrator.model")
public class DatabaseConfiguration {

    /**
     * ObjectMapper for config snapshots and REST payloads.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
            .findAndRegisterModules() // Register Java 8 time module, etc.
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Bean
    public RestTemplate webhookRestTemplate(RestTemplateBuilder builder, NotificationProperties notification) {
        Duration timeout = Duration.ofSeconds(notification.getTimeoutSeconds());
        return builder
            .setConnectTimeout(timeout)
            .setReadTimeout(timeout)
            .build();
    }
}
