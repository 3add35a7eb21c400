package com.example.shortvideo_backend.service;

import com.example.shortvideo_backend.dto.MusicTrack;
import com.example.shortvideo_backend.exception.StorageException;
import com.example.shortvideo_backend.service.Interfaces.StorageService;
import com.example.shortvideo_backend.util.MusicMood;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Background music found on disk as {@code <musicDir>/<mood>/<track>.mp3}. Files placed directly in
 * the music directory have no mood and are only picked by keyword or as a last resort.
 */
@Service
public class MusicLibrary {
    private static final Logger LOGGER = LoggerFactory.getLogger(MusicLibrary.class);
    private static final Set<String> AUDIO_EXTENSIONS = Set.of("mp3", "wav", "m4a", "aac", "ogg");

    private final StorageService storageService;
    private final Random random;

    public MusicLibrary(StorageService storageService, Random random) {
        this.storageService = storageService;
        this.random = random;
    }

    public List<MusicTrack> listTracks() {
        Path root = storageService.rootMusic();
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        List<MusicTrack> tracks = new ArrayList<>();
        try (Stream<Path> entries = Files.list(root)) {
            for (Path entry : entries.sorted().toList()) {
                if (Files.isDirectory(entry)) {
                    Optional<MusicMood> mood = MusicMood.fromDirectoryName(entry.getFileName().toString());
                    if (mood.isEmpty()) {
                        LOGGER.debug("Skipping music dir without known mood: {}", entry);
                        continue;
                    }
                    tracks.addAll(audioFiles(entry, mood.get()));
                } else if (isAudio(entry)) {
                    tracks.add(new MusicTrack(baseName(entry), entry, null));
                }
            }
        } catch (IOException e) {
            throw new StorageException("Cannot list music library " + root, e);
        }
        return tracks;
    }

    public Set<MusicMood> availableMoods() {
        Set<MusicMood> moods = EnumSet.noneOf(MusicMood.class);
        listTracks().stream().map(MusicTrack::mood).filter(m -> m != null).forEach(moods::add);
        return moods;
    }

    /**
     * Picks a random track: among the tracks of {@code mood} when one is requested, otherwise among
     * the tracks whose name contains one of {@code keywords}; any track when nothing matches.
     */
    public Optional<MusicTrack> select(MusicMood mood, List<String> keywords) {
        List<MusicTrack> all = listTracks();
        if (all.isEmpty()) {
            LOGGER.info("Music library empty at {}, rendering without music", storageService.rootMusic());
            return Optional.empty();
        }
        List<MusicTrack> candidates;
        if (mood != null) {
            candidates = all.stream().filter(t -> t.mood() == mood).toList();
        } else {
            candidates = byKeyword(all, keywords);
        }
        if (candidates.isEmpty()) {
            LOGGER.debug("No music matches mood={} keywords={}, choosing from all {} tracks", mood, keywords, all.size());
            candidates = all;
        }
        return Optional.of(candidates.get(random.nextInt(candidates.size())));
    }

    private static List<MusicTrack> byKeyword(List<MusicTrack> all, List<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            return List.of();
        }
        List<String> needles = keywords.stream()
                .map(MusicLibrary::normalize)
                .filter(k -> !k.isEmpty())
                .toList();
        return all.stream()
                .filter(t -> {
                    String hay = normalize(t.name());
                    return needles.stream().anyMatch(hay::contains);
                })
                .toList();
    }

    private static List<MusicTrack> audioFiles(Path dir, MusicMood mood) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(MusicLibrary::isAudio)
                    .sorted(Comparator.naturalOrder())
                    .map(p -> new MusicTrack(baseName(p), p, mood))
                    .toList();
        }
    }

    private static boolean isAudio(Path p) {
        if (!Files.isRegularFile(p)) return false;
        String name = p.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && AUDIO_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static String baseName(Path p) {
        String name = p.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String normalize(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "");
    }
}
