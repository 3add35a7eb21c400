package com.example.shortvideo_backend.dto;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record VideoJob(UUID id,
                       List<SceneRequest> scenes,
                       RenderOptions options,
                       long queuePosition,
                       Instant submittedAt) {
    public VideoJob {
        scenes = List.copyOf(scenes);
    }
}
