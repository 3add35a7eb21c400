package com.example.shortvideo_backend.service;

import com.example.shortvideo_backend.exception.StorageException;
import com.example.shortvideo_backend.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Stream;


public class LocalStorageService implements StorageService {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalStorageService.class);
    private static final String VIDEO_EXTENSION = ".mp4";

    private final Path baseDir;
    private final Path tempDir;
    private final Path videosDir;
    private final Path musicDir;

    public LocalStorageService(Path baseDir, String tempPrefix, String videosPrefix, String musicDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.tempDir = this.baseDir.resolve(tempPrefix).normalize();
        this.videosDir = this.baseDir.resolve(videosPrefix).normalize();
        this.musicDir = this.baseDir.resolve(musicDir).normalize();

        try {
            Files.createDirectories(tempDir);
            Files.createDirectories(videosDir);
            Files.createDirectories(this.musicDir);
            LOGGER.info("LocalStorageService ready. base={}, temp={}, videos={}, music={}",
                    this.baseDir, this.tempDir, this.videosDir, this.musicDir);
        } catch (IOException e){
            throw new StorageException("Cannot create storage directories", e);
        }
    }

    @Override
    public Path createJobTempDir(UUID jobId) {
        Path dir = safeResolve(tempDir, jobId.toString());
        try {
            Files.createDirectories(dir);
            return dir;
        } catch (IOException e) {
            throw new StorageException("Cannot create temp dir for job " + jobId, e);
        }
    }

    @Override
    public Path resolveTemp(String objectKey){
        return safeResolve(tempDir, objectKey);
    }

    @Override
    public Path resolveVideo(UUID jobId) {
        return safeResolve(videosDir, jobId + VIDEO_EXTENSION);
    }

    @Override
    public boolean existsVideo(UUID jobId) {
        return Files.exists(resolveVideo(jobId));
    }

    @Override
    public boolean deleteVideo(UUID jobId) {
        Path p = resolveVideo(jobId);
        try {
            return Files.deleteIfExists(p);
        } catch (IOException e) {
            throw new StorageException("Delete failed: " + p, e);
        }
    }

    @Override
    public void deleteTempTree(Path dir) {
        Path root = dir.toAbsolutePath().normalize();
        if (!root.startsWith(tempDir) || root.equals(tempDir)) {
            throw new StorageException("Refusing to delete outside temp root: " + dir);
        }
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            throw new StorageException("Delete failed: " + root, e);
        }
    }

    private Path safeResolve(Path root, String objectKey) {
        if(objectKey == null || objectKey.isBlank()){
            throw new StorageException("objectKey is blank");
        }
        // Force forward slashes; strip leading slashes
        String normalizedKey = objectKey.replace('\\', '/').replaceAll("^/+", "");
        Path p = root.resolve(normalizedKey).normalize();
        if (!p.startsWith(root)) {
            throw new StorageException("Invalid objectKey (path traversal?): " + objectKey);
        }
        return p;
    }

    @Override public Path rootTemp() { return tempDir; }
    @Override public Path rootVideos() { return videosDir; }
    @Override public Path rootMusic() { return musicDir; }

}
