package com.example.shortvideo_backend.dto;

import com.example.shortvideo_backend.util.VideoStatus;

import java.time.Instant;

public record JobProgress(VideoStatus status,
                          int percent,
                          String currentStep,
                          Long estimatedSecondsRemaining,
                          Instant startedAt,
                          Instant updatedAt,
                          String error) {
}
