package com.example.shortvideo_backend.config;

import com.example.shortvideo_backend.engine.Interfaces.CaptionEngine;
import com.example.shortvideo_backend.engine.Interfaces.SpeechEngine;
import com.example.shortvideo_backend.engine.OpenAICaptionEngine;
import com.example.shortvideo_backend.engine.OpenAISpeechEngine;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;


@Configuration
@EnableConfigurationProperties(OpenAIAudioProperties.class)
public class OpenAIAudioConfig {
    private static final int MAX_IN_MEMORY = 64 * 1024 * 1024;

    @Bean("speechWebClient")
    WebClient speechWebClient(OpenAIAudioProperties props) {
        return ReactorWebClients.builder("speech", Duration.ofSeconds(props.getTimeoutSeconds()), MAX_IN_MEMORY)
                .baseUrl(props.getSpeech().getBaseUrl())
                .defaultHeader("Authorization", ReactorWebClients.bearer(props.getSpeech().getApiKey()))
                .build();
    }

    @Bean("transcriptionWebClient")
    WebClient transcriptionWebClient(OpenAIAudioProperties props) {
        return ReactorWebClients.builder("transcription", Duration.ofSeconds(props.getTimeoutSeconds()), MAX_IN_MEMORY)
                .baseUrl(props.getTranscription().getBaseUrl())
                .defaultHeader("Authorization", ReactorWebClients.bearer(props.getTranscription().getApiKey()))
                .defaultHeader("Accept", "application/json")
                .build();
    }

    @Bean
    SpeechEngine speechEngine(@Qualifier("speechWebClient") WebClient client, OpenAIAudioProperties props) {
        return new OpenAISpeechEngine(client, props);
    }

    @Bean
    CaptionEngine captionEngine(@Qualifier("transcriptionWebClient") WebClient client, OpenAIAudioProperties props) {
        return new OpenAICaptionEngine(client, props);
    }
}
