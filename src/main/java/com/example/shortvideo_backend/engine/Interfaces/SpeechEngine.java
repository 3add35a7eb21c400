package com.example.shortvideo_backend.engine.Interfaces;

public interface SpeechEngine {
    record Speech(byte[] audio, double durationSeconds, String format) {}

    Speech synthesize(String text, String voice) throws Exception;
}
