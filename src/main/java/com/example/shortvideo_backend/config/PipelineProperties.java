package com.example.shortvideo_backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    @NotNull
    private Duration downloadTimeout = Duration.ofSeconds(30);
    @Min(1)
    private int retentionHours = 24;
    @Valid
    private Retry retry = new Retry();

    public Duration getDownloadTimeout() {
        return downloadTimeout;
    }

    public void setDownloadTimeout(Duration downloadTimeout) {
        this.downloadTimeout = downloadTimeout;
    }

    public int getRetentionHours() {
        return retentionHours;
    }

    public void setRetentionHours(int retentionHours) {
        this.retentionHours = retentionHours;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    /**
     * Retry policy for downloads and AI generation. The delay before retry {@code n} (0-based) is
     * {@code baseDelay * 2^n}.
     */
    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration baseDelay = Duration.ofSeconds(1);

        public Retry() {
        }

        public Retry(int maxAttempts, Duration baseDelay) {
            this.maxAttempts = maxAttempts;
            this.baseDelay = baseDelay;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }
    }
}
