package com.example.shortvideo_backend.dto;

import com.example.shortvideo_backend.util.AiImageStyle;
import com.example.shortvideo_backend.util.AiQuality;

/**
 * AI/stock mixing options of a job. Fields left {@code null} are filled by {@link #withDefaults()}.
 */
public record HybridOptions(Boolean enabled,
                            Double aiGenerationRatio,
                            AiQuality quality,
                            AiImageStyle style,
                            Boolean fallbackToTraditional) {

    public static final double DEFAULT_RATIO = 0.3;

    public static HybridOptions defaults() {
        return new HybridOptions(false, DEFAULT_RATIO, AiQuality.BALANCED, AiImageStyle.PHOTOGRAPHIC, true);
    }

    public HybridOptions withDefaults() {
        return new HybridOptions(
                enabled != null ? enabled : Boolean.FALSE,
                aiGenerationRatio != null ? aiGenerationRatio : DEFAULT_RATIO,
                quality != null ? quality : AiQuality.BALANCED,
                style != null ? style : AiImageStyle.PHOTOGRAPHIC,
                fallbackToTraditional != null ? fallbackToTraditional : Boolean.TRUE
        );
    }

    public boolean isEnabled() {
        return Boolean.TRUE.equals(enabled);
    }

    public boolean shouldFallBack() {
        return fallbackToTraditional == null || fallbackToTraditional;
    }
}
