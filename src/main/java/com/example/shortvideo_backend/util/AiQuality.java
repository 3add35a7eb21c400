package com.example.shortvideo_backend.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AiQuality {
    FAST(20, 16, true),
    BALANCED(25, 16, false),
    HIGH(30, 12, false);

    private final int inferenceSteps;
    private final int crf;
    private final boolean teaCache;

    AiQuality(int inferenceSteps, int crf, boolean teaCache) {
        this.inferenceSteps = inferenceSteps;
        this.crf = crf;
        this.teaCache = teaCache;
    }

    public int inferenceSteps() {
        return inferenceSteps;
    }

    /** x264 CRF the generator encodes with. */
    public int crf() {
        return crf;
    }

    /** Whether the generator may trade quality for speed with step caching. */
    public boolean teaCache() {
        return teaCache;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AiQuality fromWire(String value) {
        return AiQuality.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
