package com.example.shortvideo_backend.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum AiImageStyle {
    PHOTOGRAPHIC("photographic"),
    DIGITAL_ART("digital-art"),
    COMIC_BOOK("comic-book"),
    FANTASY_ART("fantasy-art"),
    ANALOG_FILM("analog-film"),
    NEON_PUNK("neon-punk"),
    ISOMETRIC("isometric"),
    LOW_POLY("low-poly"),
    ORIGAMI("origami"),
    LINE_ART("line-art"),
    CRAFT_CLAY("craft-clay"),
    CINEMATIC("cinematic"),
    THREE_D_MODEL("3d-model"),
    PIXEL_ART("pixel-art");

    private final String value;

    AiImageStyle(String value) {
        this.value = value;
    }

    @JsonValue
    public String wireValue() {
        return value;
    }

    /** Human readable form used inside generation prompts. */
    public String promptFragment() {
        return value.replace('-', ' ');
    }

    @JsonCreator
    public static AiImageStyle fromWire(String raw) {
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(raw.trim()) || s.name().equalsIgnoreCase(raw.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown image style: " + raw));
    }
}
