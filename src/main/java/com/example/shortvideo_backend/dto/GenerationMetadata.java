package com.example.shortvideo_backend.dto;

import com.example.shortvideo_backend.util.AiQuality;

public record GenerationMetadata(String prompt, Long seed, long latencyMs, AiQuality quality) {
}
