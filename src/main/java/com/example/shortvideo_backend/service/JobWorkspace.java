package com.example.shortvideo_backend.service;

import com.example.shortvideo_backend.exception.StorageException;
import com.example.shortvideo_backend.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Private temp directory of one job. Files are named {@code <jobId>-<sceneIndex>-<uuid>.<ext>} so
 * concurrent jobs and repeated scenes never collide.
 */
public class JobWorkspace {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobWorkspace.class);

    private final UUID jobId;
    private final Path dir;
    private final StorageService storageService;
    private final List<Path> files = Collections.synchronizedList(new ArrayList<>());

    public JobWorkspace(UUID jobId, StorageService storageService) {
        this.jobId = jobId;
        this.storageService = storageService;
        this.dir = storageService.createJobTempDir(jobId);
    }

    public UUID jobId() {
        return jobId;
    }

    public Path dir() {
        return dir;
    }

    public Path newFile(int sceneIndex, String extension) {
        String ext = extension.startsWith(".") ? extension.substring(1) : extension;
        Path p = dir.resolve(jobId + "-" + sceneIndex + "-" + UUID.randomUUID() + "." + ext);
        files.add(p);
        return p;
    }

    public Path write(int sceneIndex, String extension, byte[] bytes) {
        Path p = newFile(sceneIndex, extension);
        try {
            Files.write(p, bytes);
            return p;
        } catch (IOException e) {
            throw new StorageException("Write failed: " + p, e);
        }
    }

    public List<Path> files() {
        synchronized (files) {
            return List.copyOf(files);
        }
    }

    /**
     * Removes the directory with every file in it.
     *
     * @return {@code false} when something could not be removed; the failure is logged.
     */
    public boolean cleanup() {
        try {
            storageService.deleteTempTree(dir);
            files.clear();
            LOGGER.debug("Workspace cleaned jobId={} dir={}", jobId, dir);
            return true;
        } catch (StorageException e) {
            LOGGER.warn("Workspace cleanup failed jobId={} dir={}", jobId, dir, e);
            return false;
        }
    }
}
