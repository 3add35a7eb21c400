package com.example.shortvideo_backend.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CaptionPosition {
    TOP(8),
    CENTER(5),
    BOTTOM(2);

    /** ASS numpad alignment code. */
    private final int assAlignment;

    CaptionPosition(int assAlignment) {
        this.assAlignment = assAlignment;
    }

    public int assAlignment() {
        return assAlignment;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CaptionPosition fromWire(String value) {
        return CaptionPosition.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
