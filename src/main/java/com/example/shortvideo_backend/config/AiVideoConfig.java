package com.example.shortvideo_backend.config;

import com.example.shortvideo_backend.engine.HttpAiVideoEngine;
import com.example.shortvideo_backend.engine.Interfaces.AiVideoEngine;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Random;

@Configuration
@EnableConfigurationProperties(AiVideoProperties.class)
public class AiVideoConfig {
    private static final int MAX_IN_MEMORY = 512 * 1024 * 1024;

    @Bean("aiVideoWebClient")
    WebClient aiVideoWebClient(AiVideoProperties props) {
        return ReactorWebClients.builder("ai-video", Duration.ofSeconds(props.getTimeoutSeconds()), MAX_IN_MEMORY)
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", ReactorWebClients.bearer(props.getApiKey()))
                .build();
    }

    @Bean
    AiVideoEngine aiVideoEngine(@Qualifier("aiVideoWebClient") WebClient client, AiVideoProperties props, Random random) {
        return new HttpAiVideoEngine(client, props, random);
    }
}
