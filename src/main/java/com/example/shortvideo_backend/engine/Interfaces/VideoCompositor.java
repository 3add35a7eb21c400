package com.example.shortvideo_backend.engine.Interfaces;

import com.example.shortvideo_backend.dto.MusicTrack;
import com.example.shortvideo_backend.dto.RenderOptions;
import com.example.shortvideo_backend.dto.ResolvedScene;
import com.example.shortvideo_backend.util.Orientation;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

public interface VideoCompositor {
    /**
     * Composes the final video and returns its location.
     *
     * @param music {@code null} renders without background music
     */
    Path render(List<ResolvedScene> scenes, MusicTrack music, RenderOptions options, UUID jobId,
                Orientation orientation) throws Exception;
}
