package com.example.shortvideo_backend.dto;

import com.example.shortvideo_backend.util.VideoStatus;

import java.time.Instant;
import java.util.UUID;

public record JobMetadata(UUID id,
                          VideoStatus status,
                          JobProgress progress,
                          int sceneCount,
                          Double totalDurationSeconds,
                          Instant createdAt,
                          Instant completedAt) {
}
