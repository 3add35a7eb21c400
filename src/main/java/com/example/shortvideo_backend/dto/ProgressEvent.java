package com.example.shortvideo_backend.dto;

import com.example.shortvideo_backend.util.ProgressEventType;

import java.time.Instant;
import java.util.UUID;

public record ProgressEvent(UUID jobId, ProgressEventType type, JobMetadata metadata, Instant timestamp) {
}
