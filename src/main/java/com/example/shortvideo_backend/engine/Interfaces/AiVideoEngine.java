package com.example.shortvideo_backend.engine.Interfaces;

import com.example.shortvideo_backend.util.AiImageStyle;
import com.example.shortvideo_backend.util.AiQuality;
import com.example.shortvideo_backend.util.Orientation;

public interface AiVideoEngine {
    record Style(AiImageStyle imageStyle, AiQuality quality, Orientation orientation) {}
    record GeneratedClip(byte[] video, Long seed, long latencyMs) {}

    GeneratedClip generate(String prompt, double durationSeconds, Style style) throws Exception;
}
