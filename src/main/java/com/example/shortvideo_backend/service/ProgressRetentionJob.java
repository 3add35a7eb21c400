package com.example.shortvideo_backend.service;

import com.example.shortvideo_backend.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Drops finished jobs older than {@code pipeline.retention-hours}. Output files are left on disk.
 */
@Service
public class ProgressRetentionJob {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProgressRetentionJob.class);

    private final ProgressTracker progressTracker;
    private final PipelineProperties properties;
    private final Clock clock;

    public ProgressRetentionJob(ProgressTracker progressTracker, PipelineProperties properties, Clock clock) {
        this.progressTracker = progressTracker;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${pipeline.retention-sweep-millis:3600000}",
            initialDelayString = "${pipeline.retention-sweep-millis:3600000}")
    public void sweep() {
        purge();
    }

    public int purge() {
        Instant cutoff = clock.instant().minus(Duration.ofHours(Math.max(1, properties.getRetentionHours())));
        int removed = progressTracker.purgeFinishedBefore(cutoff);
        LOGGER.debug("Retention sweep cutoff={} removed={}", cutoff, removed);
        return removed;
    }
}
