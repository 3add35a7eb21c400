package com.example.shortvideo_backend.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Background music moods. The wire value doubles as the directory name of the mood inside the
 * music library, with {@code /} replaced by {@code _}.
 */
public enum MusicMood {
    SAD("sad"),
    MELANCHOLIC("melancholic"),
    HAPPY("happy"),
    EUPHORIC("euphoric/high"),
    EXCITED("excited"),
    CHILL("chill"),
    UNEASY("uneasy"),
    ANGRY("angry"),
    DARK("dark"),
    HOPEFUL("hopeful"),
    CONTEMPLATIVE("contemplative"),
    FUNNY("funny/quirky");

    private final String value;

    MusicMood(String value) {
        this.value = value;
    }

    @JsonValue
    public String wireValue() {
        return value;
    }

    public String directoryName() {
        return value.replace('/', '_');
    }

    @JsonCreator
    public static MusicMood fromWire(String raw) {
        return find(raw).orElseThrow(() -> new IllegalArgumentException("Unknown music mood: " + raw));
    }

    public static Optional<MusicMood> fromDirectoryName(String dir) {
        if (dir == null) {
            return Optional.empty();
        }
        String normalized = dir.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(m -> m.directoryName().equals(normalized))
                .findFirst();
    }

    private static Optional<MusicMood> find(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(m -> m.value.equals(normalized) || m.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
