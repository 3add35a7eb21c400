package com.example.shortvideo_backend.service;

import com.example.shortvideo_backend.dto.ProgressEvent;
import com.example.shortvideo_backend.dto.RenderOptions;
import com.example.shortvideo_backend.dto.ResolvedScene;
import com.example.shortvideo_backend.dto.SceneRequest;
import com.example.shortvideo_backend.dto.VideoJob;
import com.example.shortvideo_backend.engine.Interfaces.VideoCompositor;
import com.example.shortvideo_backend.exception.CollaboratorException;
import com.example.shortvideo_backend.exception.GenerationException;
import com.example.shortvideo_backend.repository.VideoJobRecordRepository;
import com.example.shortvideo_backend.util.Provenance;
import com.example.shortvideo_backend.util.VideoStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobPipelineTest {

    @Mock private SceneProcessor sceneProcessor;
    @Mock private MusicLibrary musicLibrary;
    @Mock private VideoCompositor videoCompositor;
    @Mock private VideoJobRecordRepository repository;

    @TempDir
    Path base;

    private LocalStorageService storage;
    private ProgressTracker tracker;
    private JobPipeline pipeline;
    private final List<ProgressEvent> events = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void setUp() {
        storage = new LocalStorageService(base, "tmp", "videos", "music");
        tracker = new ProgressTracker(repository, List.of(events::add),
                new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));
        pipeline = new JobPipeline(sceneProcessor, tracker, musicLibrary, videoCompositor, storage);
    }

    @Test
    void runsScenesInOrderAndCompletes() throws Exception {
        VideoJob job = job(2, RenderOptions.defaults().withPaddingBackMs(500));
        List<Set<String>> excludedSeen = new ArrayList<>();
        when(sceneProcessor.resolve(any(), any(), any(), any())).thenAnswer(inv -> {
            SceneContext ctx = inv.getArgument(2);
            SceneStageListener listener = inv.getArgument(3);
            excludedSeen.add(Set.copyOf(ctx.excludedClipIds()));
            listener.onStage(VideoStatus.GENERATING_AUDIO);
            listener.onStage(VideoStatus.CREATING_CAPTIONS);
            listener.onStage(VideoStatus.DOWNLOADING_VIDEO);
            Path audio = ctx.workspace().write(ctx.sceneIndex(), "wav", new byte[]{1});
            Path clip = ctx.workspace().write(ctx.sceneIndex(), "mp4", new byte[]{2});
            return new ResolvedScene(ctx.sceneIndex(), audio, 2.0 + ctx.sceneIndex(), 2.0 + ctx.sceneIndex(),
                    List.of(), clip, "clip-" + ctx.sceneIndex(), Provenance.STOCK, null);
        });
        when(musicLibrary.select(any(), anyList())).thenReturn(Optional.empty());
        when(videoCompositor.render(anyList(), isNull(), any(), eq(job.id()), any())).thenAnswer(inv -> {
            Path out = storage.resolveVideo(job.id());
            Files.writeString(out, "video");
            return out;
        });

        Path output = pipeline.run(job);

        assertThat(output).isEqualTo(storage.resolveVideo(job.id())).exists();
        assertThat(excludedSeen).containsExactly(Set.of(), Set.of("clip-0"));
        var meta = tracker.getMetadata(job.id()).orElseThrow();
        assertThat(meta.status()).isEqualTo(VideoStatus.READY);
        assertThat(meta.totalDurationSeconds()).isEqualTo(5.5);
        assertThat(storage.rootTemp().resolve(job.id().toString())).doesNotExist();
        assertThat(events).extracting(e -> e.metadata().progress().percent()).isSorted();
        assertThat(events).extracting(e -> e.metadata().status())
                .containsSubsequence(VideoStatus.PROCESSING, VideoStatus.GENERATING_AUDIO,
                        VideoStatus.RENDERING, VideoStatus.READY);
    }

    @Test
    void sceneFailureCleansUpAndSkipsRendering() throws Exception {
        VideoJob job = job(2, RenderOptions.defaults());
        when(sceneProcessor.resolve(any(), any(), any(), any())).thenAnswer(inv -> {
            SceneContext ctx = inv.getArgument(2);
            ctx.workspace().write(ctx.sceneIndex(), "wav", new byte[]{1});
            throw new GenerationException("No stock clip found for scene 0");
        });

        assertThatThrownBy(() -> pipeline.run(job)).isInstanceOf(GenerationException.class);

        assertThat(storage.rootTemp().resolve(job.id().toString())).doesNotExist();
        verify(videoCompositor, never()).render(anyList(), any(), any(), any(), any());
        assertThat(tracker.getMetadata(job.id()).orElseThrow().status()).isNotEqualTo(VideoStatus.READY);
    }

    @Test
    void renderFailureIsWrapped() throws Exception {
        VideoJob job = job(1, RenderOptions.defaults());
        when(sceneProcessor.resolve(any(), any(), any(), any())).thenAnswer(inv -> {
            SceneContext ctx = inv.getArgument(2);
            SceneStageListener listener = inv.getArgument(3);
            listener.onStage(VideoStatus.GENERATING_AUDIO);
            listener.onStage(VideoStatus.CREATING_CAPTIONS);
            listener.onStage(VideoStatus.DOWNLOADING_VIDEO);
            return new ResolvedScene(0, base.resolve("a.wav"), 1.0, 1.0, List.of(), base.resolve("c.mp4"),
                    "c", Provenance.STOCK, null);
        });
        when(musicLibrary.select(any(), anyList())).thenReturn(Optional.empty());
        when(videoCompositor.render(anyList(), any(), any(), any(), any())).thenThrow(new IOException("ffmpeg exited 1"));

        assertThatThrownBy(() -> pipeline.run(job))
                .isInstanceOf(CollaboratorException.class)
                .hasMessage("render failed: ffmpeg exited 1");
    }

    @Test
    void stagePercentsSplitTheSceneSlice() {
        UUID id = UUID.randomUUID();
        tracker.initialize(id, 2);
        tracker.updateProgress(id, VideoStatus.PROCESSING, JobPipeline.PROCESSING_PERCENT, null);

        pipeline.stageListener(id, 0, 2).onStage(VideoStatus.GENERATING_AUDIO);
        assertThat(tracker.getProgress(id).orElseThrow().percent()).isEqualTo(10);
        pipeline.stageListener(id, 0, 2).onStage(VideoStatus.CREATING_CAPTIONS);
        assertThat(tracker.getProgress(id).orElseThrow().percent()).isEqualTo(21);
        pipeline.stageListener(id, 0, 2).onStage(VideoStatus.DOWNLOADING_VIDEO);
        assertThat(tracker.getProgress(id).orElseThrow().percent()).isEqualTo(33);
        pipeline.stageListener(id, 1, 2).onStage(VideoStatus.GENERATING_AUDIO);
        assertThat(tracker.getProgress(id).orElseThrow().percent()).isEqualTo(45);
        assertThat(tracker.getProgress(id).orElseThrow().currentStep()).isEqualTo("Scene 2/2: generating audio");
    }

    private VideoJob job(int scenes, RenderOptions options) {
        UUID id = UUID.randomUUID();
        List<SceneRequest> list = new ArrayList<>();
        for (int i = 0; i < scenes; i++) {
            list.add(SceneRequest.of("Scene " + i, "term" + i));
        }
        tracker.initialize(id, scenes);
        return new VideoJob(id, list, options, 1, Instant.now());
    }
}
