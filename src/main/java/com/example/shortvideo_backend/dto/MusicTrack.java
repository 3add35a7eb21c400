package com.example.shortvideo_backend.dto;

import com.example.shortvideo_backend.util.MusicMood;

import java.nio.file.Path;

public record MusicTrack(String name, Path file, MusicMood mood) {
}
