package com.example.shortvideo_backend.config;


import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * OpenAI-compatible audio endpoints. Speech usually points at a self-hosted Kokoro server and
 * transcription at a Whisper server; both speak the OpenAI wire format.
 */
@ConfigurationProperties(prefix = "openai.audio")
public class OpenAIAudioProperties {

    private Endpoint speech = new Endpoint("http://localhost:8880", "kokoro");
    private Endpoint transcription = new Endpoint("https://api.openai.com", "whisper-1");
    private String speechFormat = "wav";
    private double speechSpeed = 1.0;
    private String language = "en";
    private long timeoutSeconds = 120;

    public OpenAIAudioProperties() {
    }

    public Endpoint getSpeech() {
        return speech;
    }

    public void setSpeech(Endpoint speech) {
        this.speech = speech;
    }

    public Endpoint getTranscription() {
        return transcription;
    }

    public void setTranscription(Endpoint transcription) {
        this.transcription = transcription;
    }

    public String getSpeechFormat() {
        return speechFormat;
    }

    public void setSpeechFormat(String speechFormat) {
        this.speechFormat = speechFormat;
    }

    public double getSpeechSpeed() {
        return speechSpeed;
    }

    public void setSpeechSpeed(double speechSpeed) {
        this.speechSpeed = speechSpeed;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public static class Endpoint {
        private String baseUrl;
        private String apiKey = "";
        private String model;

        public Endpoint() {
        }

        public Endpoint(String baseUrl, String model) {
            this.baseUrl = baseUrl;
            this.model = model;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }
    }
}
