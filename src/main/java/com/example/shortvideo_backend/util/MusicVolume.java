package com.example.shortvideo_backend.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MusicVolume {
    MUTED(0.0),
    LOW(0.2),
    MEDIUM(0.45),
    HIGH(0.7);

    private final double gain;

    MusicVolume(double gain) {
        this.gain = gain;
    }

    public double gain() {
        return gain;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MusicVolume fromWire(String value) {
        return MusicVolume.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
