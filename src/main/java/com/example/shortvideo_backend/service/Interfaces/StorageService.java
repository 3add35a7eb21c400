package com.example.shortvideo_backend.service.Interfaces;


import java.nio.file.Path;
import java.util.UUID;

public interface StorageService {
    /** Creates (if needed) and returns the private temp directory of a job. */
    Path createJobTempDir(UUID jobId);

    Path resolveTemp(String objectKey);

    /** Final location of a job's rendered video, whether or not it exists yet. */
    Path resolveVideo(UUID jobId);

    boolean existsVideo(UUID jobId);

    boolean deleteVideo(UUID jobId);

    /** Deletes a directory under the temp root with everything below it. */
    void deleteTempTree(Path dir);

    Path rootTemp();
    Path rootVideos();
    Path rootMusic();
}
