package com.example.shortvideo_backend.dto;

/**
 * A stock clip chosen by a footage search, not yet downloaded.
 */
public record ClipRef(String id, String url, int width, int height, double durationSeconds) {
}
