package com.example.shortvideo_backend.util;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProgressEventType {
    PROGRESS_UPDATE("progress_update", "video.progress"),
    VIDEO_COMPLETED("video_completed", "video.completed"),
    VIDEO_FAILED("video_failed", "video.failed");

    private final String value;
    private final String webhookEvent;

    ProgressEventType(String value, String webhookEvent) {
        this.value = value;
        this.webhookEvent = webhookEvent;
    }

    @JsonValue
    public String wireValue() {
        return value;
    }

    public String webhookEvent() {
        return webhookEvent;
    }
}
