package com.example.shortvideo_backend.service;

import com.example.shortvideo_backend.dto.MusicTrack;
import com.example.shortvideo_backend.dto.RenderOptions;
import com.example.shortvideo_backend.dto.ResolvedScene;
import com.example.shortvideo_backend.dto.SceneRequest;
import com.example.shortvideo_backend.dto.VideoJob;
import com.example.shortvideo_backend.engine.Interfaces.VideoCompositor;
import com.example.shortvideo_backend.exception.CollaboratorException;
import com.example.shortvideo_backend.service.Interfaces.StorageService;
import com.example.shortvideo_backend.util.VideoStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Runs one job end to end: scenes strictly in order, music, composition, cleanup.
 * Progress plan: 5% processing, scenes share 10..80%, 85% rendering, 100% ready.
 */
@Service
public class JobPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobPipeline.class);

    static final int PROCESSING_PERCENT = 5;
    static final int SCENES_START_PERCENT = 10;
    static final int SCENES_SPAN_PERCENT = 70;
    static final int RENDERING_PERCENT = 85;

    private final SceneProcessor sceneProcessor;
    private final ProgressTracker progressTracker;
    private final MusicLibrary musicLibrary;
    private final VideoCompositor videoCompositor;
    private final StorageService storageService;

    public JobPipeline(SceneProcessor sceneProcessor,
                       ProgressTracker progressTracker,
                       MusicLibrary musicLibrary,
                       VideoCompositor videoCompositor,
                       StorageService storageService) {
        this.sceneProcessor = sceneProcessor;
        this.progressTracker = progressTracker;
        this.musicLibrary = musicLibrary;
        this.videoCompositor = videoCompositor;
        this.storageService = storageService;
    }

    /**
     * @return path of the rendered video.
     */
    public Path run(VideoJob job) {
        RenderOptions options = job.options();
        List<SceneRequest> scenes = job.scenes();
        int n = scenes.size();
        LOGGER.info("JOB START jobId={} scenes={} orientation={} hybrid={}", job.id(), n, options.orientation(),
                options.hybrid() != null && options.hybrid().isEnabled());
        progressTracker.updateProgress(job.id(), VideoStatus.PROCESSING, PROCESSING_PERCENT, "Processing scenes");

        JobWorkspace workspace = new JobWorkspace(job.id(), storageService);
        Set<String> excludedClipIds = new LinkedHashSet<>();
        List<ResolvedScene> resolved = new ArrayList<>(n);
        Path output;
        double totalDuration = 0d;
        try {
            for (int i = 0; i < n; i++) {
                SceneContext ctx = new SceneContext(job.id(), i, n, excludedClipIds, workspace);
                ResolvedScene scene = sceneProcessor.resolve(scenes.get(i), options, ctx, stageListener(job.id(), i, n));
                resolved.add(scene);
                totalDuration += scene.audioDurationSeconds();
                if (scene.stockClipId() != null) {
                    excludedClipIds.add(scene.stockClipId());
                }
            }
            if (options.paddingBackMs() != null && options.paddingBackMs() > 0) {
                totalDuration += options.paddingBackMs() / 1000.0;
            }

            MusicTrack music = musicLibrary.select(options.music(), options.musicKeywords()).orElse(null);
            LOGGER.debug("JOB MUSIC jobId={} track={}", job.id(), music == null ? "<none>" : music.name());

            progressTracker.updateProgress(job.id(), VideoStatus.RENDERING, RENDERING_PERCENT, "Rendering video");
            output = compose(job, resolved, music, options);
        } finally {
            workspace.cleanup();
        }

        progressTracker.markCompleted(job.id(), totalDuration);
        LOGGER.info("JOB COMPLETE jobId={} durationSec={} output={}", job.id(), totalDuration, output);
        return output;
    }

    private Path compose(VideoJob job, List<ResolvedScene> resolved, MusicTrack music, RenderOptions options) {
        Path output;
        try {
            output = videoCompositor.render(resolved, music, options, job.id(), options.orientation());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException("render", "render interrupted", e);
        } catch (CollaboratorException e) {
            throw e;
        } catch (Exception e) {
            throw new CollaboratorException("render", "render failed: " + RetryExecutor.describe(e), e);
        }
        if (output == null) {
            output = storageService.resolveVideo(job.id());
        }
        if (!Files.exists(output)) {
            throw new CollaboratorException("render", "render produced no file at " + output, null);
        }
        return output;
    }

    /**
     * Percent for each stage of scene {@code index}: audio at the start of the scene's slice, captions
     * a third in, the visual two thirds in.
     */
    SceneStageListener stageListener(UUID jobId, int index, int count) {
        double span = SCENES_SPAN_PERCENT / (double) count;
        double base = SCENES_START_PERCENT + index * span;
        String label = "Scene %d/%d".formatted(index + 1, count);
        return stage -> {
            int percent = switch (stage) {
                case GENERATING_AUDIO -> (int) Math.floor(base);
                case CREATING_CAPTIONS -> (int) Math.floor(base + span / 3);
                case GENERATING_AI_VIDEO, DOWNLOADING_VIDEO -> (int) Math.floor(base + 2 * span / 3);
                default -> (int) Math.floor(base);
            };
            progressTracker.updateProgress(jobId, stage, percent, label + ": " + describe(stage));
        };
    }

    private static String describe(VideoStatus stage) {
        return switch (stage) {
            case GENERATING_AUDIO -> "generating audio";
            case CREATING_CAPTIONS -> "creating captions";
            case GENERATING_AI_VIDEO -> "generating AI video";
            case DOWNLOADING_VIDEO -> "downloading video";
            default -> stage.wireValue();
        };
    }
}
