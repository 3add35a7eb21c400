package com.example.shortvideo_backend.dto;

/**
 * One timed caption word, offsets relative to the start of the scene audio.
 */
public record CaptionToken(String text, long startMs, long endMs) {
    public CaptionToken {
        if (startMs < 0 || endMs < startMs) {
            throw new IllegalArgumentException("Invalid caption range: startMs=" + startMs + ", endMs=" + endMs);
        }
        text = text == null ? "" : text;
    }
}
