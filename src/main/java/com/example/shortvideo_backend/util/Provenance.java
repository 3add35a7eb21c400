package com.example.shortvideo_backend.util;

/**
 * Where the visual clip of a resolved scene came from.
 */
public enum Provenance {
    STOCK,
    AI_GENERATED
}
