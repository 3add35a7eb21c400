package com.example.shortvideo_backend.dto;

import com.example.shortvideo_backend.util.CaptionPosition;
import com.example.shortvideo_backend.util.MusicMood;
import com.example.shortvideo_backend.util.MusicVolume;
import com.example.shortvideo_backend.util.Orientation;

import java.util.List;
import java.util.Objects;

/**
 * Per-job rendering options. Everything except {@code music} is optional on input; the scheduler
 * stores the result of {@link #withDefaults()} on the job so downstream code never sees nulls.
 */
public record RenderOptions(Orientation orientation,
                            Long paddingBackMs,
                            CaptionPosition captionPosition,
                            String captionBackgroundColor,
                            String voice,
                            MusicMood music,
                            MusicVolume musicVolume,
                            List<String> musicKeywords,
                            HybridOptions hybrid) {

    public static final String DEFAULT_VOICE = "af_heart";
    public static final String DEFAULT_CAPTION_BACKGROUND = "blue";

    public RenderOptions {
        musicKeywords = musicKeywords == null
                ? List.of()
                : musicKeywords.stream().filter(Objects::nonNull).toList();
    }

    public static RenderOptions defaults() {
        return new RenderOptions(null, null, null, null, null, null, null, null, null).withDefaults();
    }

    public RenderOptions withDefaults() {
        return new RenderOptions(
                orientation != null ? orientation : Orientation.PORTRAIT,
                paddingBackMs != null ? paddingBackMs : 0L,
                captionPosition != null ? captionPosition : CaptionPosition.BOTTOM,
                captionBackgroundColor != null && !captionBackgroundColor.isBlank() ? captionBackgroundColor : DEFAULT_CAPTION_BACKGROUND,
                voice != null && !voice.isBlank() ? voice : DEFAULT_VOICE,
                music,
                musicVolume != null ? musicVolume : MusicVolume.HIGH,
                musicKeywords,
                hybrid != null ? hybrid.withDefaults() : HybridOptions.defaults()
        );
    }

    public RenderOptions withHybrid(HybridOptions hybrid) {
        return new RenderOptions(orientation, paddingBackMs, captionPosition, captionBackgroundColor, voice,
                music, musicVolume, musicKeywords, hybrid);
    }

    public RenderOptions withPaddingBackMs(long paddingBackMs) {
        return new RenderOptions(orientation, paddingBackMs, captionPosition, captionBackgroundColor, voice,
                music, musicVolume, musicKeywords, hybrid);
    }

    public RenderOptions withMusic(MusicMood music, List<String> musicKeywords) {
        return new RenderOptions(orientation, paddingBackMs, captionPosition, captionBackgroundColor, voice,
                music, musicVolume, musicKeywords, hybrid);
    }
}
