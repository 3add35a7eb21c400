package com.example.shortvideo_backend.config;

import com.example.shortvideo_backend.engine.Interfaces.StockFootageEngine;
import com.example.shortvideo_backend.engine.PexelsStockFootageEngine;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Random;

@Configuration
@EnableConfigurationProperties(PexelsProperties.class)
public class PexelsConfig {
    private static final int SEARCH_MAX_IN_MEMORY = 16 * 1024 * 1024;
    private static final int DOWNLOAD_MAX_IN_MEMORY = 512 * 1024 * 1024;

    @Bean("pexelsWebClient")
    WebClient pexelsWebClient(PexelsProperties props) {
        return ReactorWebClients.builder("pexels", Duration.ofSeconds(props.getSearchTimeoutSeconds()), SEARCH_MAX_IN_MEMORY)
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", props.getApiKey() == null ? "" : props.getApiKey().trim())
                .defaultHeader("Accept", "application/json")
                .build();
    }

    @Bean("downloadWebClient")
    WebClient downloadWebClient(PipelineProperties pipelineProperties) {
        return ReactorWebClients.builder("download", pipelineProperties.getDownloadTimeout(), DOWNLOAD_MAX_IN_MEMORY)
                .build();
    }

    @Bean
    StockFootageEngine stockFootageEngine(@Qualifier("pexelsWebClient") WebClient api,
                                          @Qualifier("downloadWebClient") WebClient download,
                                          PexelsProperties props,
                                          Random random) {
        return new PexelsStockFootageEngine(api, download, props, random);
    }
}
