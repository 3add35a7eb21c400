package com.example.shortvideo_backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

@Configuration
class TimeConfig {
    @Bean
    public Clock systemClock() {
        return Clock.systemUTC();
    }

    /** Source of the hybrid AI/stock decision and of music selection. */
    @Bean
    public Random pipelineRandom() {
        return new SecureRandom();
    }
}
