package com.example.shortvideo_backend.config;

import com.example.shortvideo_backend.service.observer.WebhookProgressObserver;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(WebhookProperties.class)
public class WebhookConfig {
    private static final int MAX_IN_MEMORY = 256 * 1024;

    @Bean
    @ConditionalOnProperty(prefix = "webhook", name = "enabled", havingValue = "true")
    WebhookProgressObserver webhookProgressObserver(WebhookProperties props, ObjectMapper objectMapper) {
        var client = ReactorWebClients.builder("webhook", Duration.ofSeconds(props.getTimeoutSeconds()), MAX_IN_MEMORY)
                .defaultHeader("User-Agent", "shortvideo-backend/1.0")
                .build();
        return new WebhookProgressObserver(client, props, objectMapper);
    }
}
