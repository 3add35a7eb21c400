package com.example.shortvideo_backend.dto;

import com.example.shortvideo_backend.util.Provenance;

import java.nio.file.Path;
import java.util.List;

/**
 * A scene with every asset the compositor needs.
 *
 * @param visualDurationSeconds audio duration, plus the end padding on the last scene of a job
 * @param stockClipId           id of the stock clip, {@code null} for AI generated visuals
 * @param generation            present only for AI generated visuals
 */
public record ResolvedScene(int index,
                            Path audioPath,
                            double audioDurationSeconds,
                            double visualDurationSeconds,
                            List<CaptionToken> captions,
                            Path clipPath,
                            String stockClipId,
                            Provenance provenance,
                            GenerationMetadata generation) {
    public ResolvedScene {
        if (audioDurationSeconds < 0) {
            throw new IllegalArgumentException("audioDurationSeconds must be >= 0");
        }
        captions = captions == null ? List.of() : List.copyOf(captions);
    }
}
