package com.example.shortvideo_backend.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a video job. The accepted transitions are encoded in {@link #canTransitionTo(VideoStatus)};
 * the per-scene stages repeat once for every scene of the job.
 */
public enum VideoStatus {
    QUEUED,
    PROCESSING,
    GENERATING_AUDIO,
    CREATING_CAPTIONS,
    DOWNLOADING_VIDEO,
    GENERATING_AI_VIDEO,
    RENDERING,
    READY,
    FAILED;

    public boolean isTerminal() {
        return this == READY || this == FAILED;
    }

    /**
     * Returns whether a job in this state may move to {@code next}. Staying in the same
     * non-terminal state is allowed so a stage can report progress more than once.
     */
    public boolean canTransitionTo(VideoStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == FAILED || next == this) {
            return true;
        }
        return switch (this) {
            case QUEUED -> next == PROCESSING;
            case PROCESSING -> next == GENERATING_AUDIO;
            case GENERATING_AUDIO -> next == CREATING_CAPTIONS;
            case CREATING_CAPTIONS -> next == DOWNLOADING_VIDEO || next == GENERATING_AI_VIDEO;
            case GENERATING_AI_VIDEO -> next == DOWNLOADING_VIDEO || next == GENERATING_AUDIO || next == RENDERING;
            case DOWNLOADING_VIDEO -> next == GENERATING_AUDIO || next == RENDERING;
            case RENDERING -> next == READY;
            default -> false;
        };
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static VideoStatus fromWire(String value) {
        return VideoStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
