package com.example.shortvideo_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Self-hosted video diffusion server. Generation is synchronous from the caller's point of view:
 * the adapter polls the server job until it finishes or {@code timeoutSeconds} elapses.
 */
@ConfigurationProperties(prefix = "ai-video")
public class AiVideoProperties {

    private String baseUrl = "http://localhost:8000";
    private String apiKey = "";
    private int fps = 30;
    private long pollIntervalMillis = 2000;
    private long timeoutSeconds = 600;
    private String negativePrompt = "blurry, low quality, distorted, watermark, text";

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public int getFps() { return fps; }
    public void setFps(int fps) { this.fps = fps; }

    public long getPollIntervalMillis() { return pollIntervalMillis; }
    public void setPollIntervalMillis(long pollIntervalMillis) { this.pollIntervalMillis = pollIntervalMillis; }

    public long getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(long timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

    public String getNegativePrompt() { return negativePrompt; }
    public void setNegativePrompt(String negativePrompt) { this.negativePrompt = negativePrompt; }
}
