package com.example.shortvideo_backend.service;

import com.example.shortvideo_backend.config.WorkerExecutorProperties;
import com.example.shortvideo_backend.dto.HybridOptions;
import com.example.shortvideo_backend.dto.JobProgress;
import com.example.shortvideo_backend.dto.RenderOptions;
import com.example.shortvideo_backend.dto.SceneRequest;
import com.example.shortvideo_backend.dto.VideoJob;
import com.example.shortvideo_backend.exception.CollaboratorException;
import com.example.shortvideo_backend.exception.GenerationException;
import com.example.shortvideo_backend.exception.QueueFullException;
import com.example.shortvideo_backend.exception.ValidationException;
import com.example.shortvideo_backend.repository.VideoJobRecordRepository;
import com.example.shortvideo_backend.util.VideoStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobSchedulerTest {

    @Mock private JobPipeline jobPipeline;
    @Mock private VideoJobRecordRepository repository;

    @TempDir
    Path base;

    private LocalStorageService storage;
    private ProgressTracker tracker;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        storage = new LocalStorageService(base, "tmp", "videos", "music");
        tracker = new ProgressTracker(repository, List.of(), new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void submitRejectsInvalidInput() {
        JobScheduler scheduler = scheduler(1, 10);

        assertThatThrownBy(() -> scheduler.submit(List.of(), null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> scheduler.submit(List.of(SceneRequest.of("  ", "ocean")), null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("narration");
        assertThatThrownBy(() -> scheduler.submit(List.of(SceneRequest.of("Hello")), null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("search term");
        assertThatThrownBy(() -> scheduler.submit(scenes(1), RenderOptions.defaults().withPaddingBackMs(-1)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> scheduler.submit(scenes(1),
                RenderOptions.defaults().withHybrid(new HybridOptions(true, 1.5, null, null, null))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("aiGenerationRatio");
        assertThat(tracker.getAllMetadata()).isEmpty();
    }

    @Test
    void promptAloneIsEnoughForAScene() {
        JobScheduler scheduler = scheduler(1, 10);

        UUID id = scheduler.submit(List.of(new SceneRequest("Hi", List.of(), null, "ocean waves", null)), null);

        assertThat(scheduler.status(id)).map(JobProgress::status).contains(VideoStatus.QUEUED);
    }

    @Test
    void submitQueuesJobWithDefaults() {
        JobScheduler scheduler = scheduler(1, 10);

        UUID id = scheduler.submit(scenes(2), null);

        JobProgress progress = scheduler.status(id).orElseThrow();
        assertThat(progress.status()).isEqualTo(VideoStatus.QUEUED);
        assertThat(progress.percent()).isZero();
        assertThat(scheduler.metadata(id).orElseThrow().sceneCount()).isEqualTo(2);
        assertThat(scheduler.queueSize()).isEqualTo(1);
    }

    @Test
    void fullQueueRejectsSubmission() {
        JobScheduler scheduler = scheduler(1, 1);
        scheduler.submit(scenes(1), null);

        assertThatThrownBy(() -> scheduler.submit(scenes(1), null)).isInstanceOf(QueueFullException.class);
        assertThat(scheduler.list()).hasSize(1);
    }

    @Test
    void jobsRunInSubmissionOrder() throws Exception {
        JobScheduler scheduler = scheduler(1, 10);
        List<UUID> order = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch done = new CountDownLatch(3);
        when(jobPipeline.run(any())).thenAnswer(inv -> {
            VideoJob job = inv.getArgument(0);
            order.add(job.id());
            done.countDown();
            return storage.resolveVideo(job.id());
        });
        UUID a = scheduler.submit(scenes(1), null);
        UUID b = scheduler.submit(scenes(1), null);
        UUID c = scheduler.submit(scenes(1), null);

        scheduler.start();

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(order).containsExactly(a, b, c);
    }

    @Test
    void cancelledJobNeverRuns() {
        JobScheduler scheduler = scheduler(1, 10);
        UUID id = scheduler.submit(scenes(1), null);

        assertThat(scheduler.cancel(id)).isTrue();
        assertThat(scheduler.cancel(id)).isFalse();
        scheduler.start();

        verify(jobPipeline, after(300).never()).run(any());
        JobProgress progress = scheduler.status(id).orElseThrow();
        assertThat(progress.status()).isEqualTo(VideoStatus.FAILED);
        assertThat(progress.error()).isEqualTo(JobScheduler.CANCELLED_REASON);
        assertThat(scheduler.queueSize()).isZero();
    }

    @Test
    void cancelUnknownJobReturnsFalse() {
        assertThat(scheduler(1, 10).cancel(UUID.randomUUID())).isFalse();
    }

    @Test
    void pipelineFailureMarksJobFailed() throws Exception {
        JobScheduler scheduler = scheduler(1, 10);
        when(jobPipeline.run(any())).thenThrow(new GenerationException("No stock clip found for scene 0 terms=[ocean]"));
        UUID id = scheduler.submit(scenes(1), null);

        scheduler.start();

        JobProgress progress = awaitTerminal(id);
        assertThat(progress.status()).isEqualTo(VideoStatus.FAILED);
        assertThat(progress.error()).isEqualTo("No stock clip found for scene 0 terms=[ocean]");
    }

    @Test
    void workerSurvivesErrorThrownByPipeline() throws Exception {
        JobScheduler scheduler = scheduler(1, 10);
        when(jobPipeline.run(any()))
                .thenThrow(new StackOverflowError())
                .thenAnswer(inv -> completeJob(inv.getArgument(0)));
        UUID first = scheduler.submit(scenes(1), null);
        UUID second = scheduler.submit(scenes(1), null);

        scheduler.start();

        JobProgress failed = awaitTerminal(first);
        assertThat(failed.status()).isEqualTo(VideoStatus.FAILED);
        assertThat(failed.error()).isEqualTo("Unexpected error (StackOverflowError)");
        assertThat(awaitTerminal(second).status()).isEqualTo(VideoStatus.READY);
        assertThat(scheduler.queueSize()).isZero();
    }

    @Test
    void statusOfUnknownJobIsEmpty() {
        JobScheduler scheduler = scheduler(1, 10);
        scheduler.submit(scenes(1), null);

        assertThat(scheduler.status(UUID.randomUUID())).isEmpty();
        assertThat(scheduler.metadata(UUID.randomUUID())).isEmpty();
    }

    @Test
    void failureMessagesHideUnexpectedDetails() {
        assertThat(JobScheduler.failureMessage(new CollaboratorException("render", "render failed: exit 1", null)))
                .isEqualTo("render failed: exit 1");
        assertThat(JobScheduler.failureMessage(new NullPointerException("field x was null")))
                .isEqualTo("Unexpected error (NullPointerException)");
    }

    @Test
    void workersNeverExceedConcurrency() throws Exception {
        JobScheduler scheduler = scheduler(2, 20);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(6);
        when(jobPipeline.run(any())).thenAnswer(inv -> {
            int now = active.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            Thread.sleep(50);
            active.decrementAndGet();
            done.countDown();
            return storage.resolveVideo(((VideoJob) inv.getArgument(0)).id());
        });
        for (int i = 0; i < 6; i++) {
            scheduler.submit(scenes(1), null);
        }

        scheduler.start();

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(peak.get()).isBetween(1, 2);
    }

    @Test
    void readyJobExposesOutputAndCanBeDeleted() throws Exception {
        JobScheduler scheduler = scheduler(1, 10);
        when(jobPipeline.run(any())).thenAnswer(inv -> completeJob(inv.getArgument(0)));
        UUID id = scheduler.submit(scenes(1), null);
        assertThat(scheduler.outputFile(id)).isEmpty();

        scheduler.start();

        assertThat(awaitTerminal(id).status()).isEqualTo(VideoStatus.READY);
        assertThat(scheduler.outputFile(id)).contains(storage.resolveVideo(id));
        assertThat(scheduler.delete(id)).isTrue();
        assertThat(storage.existsVideo(id)).isFalse();
        assertThat(scheduler.metadata(id)).isEmpty();
    }

    @Test
    void queuedJobCannotBeDeleted() {
        JobScheduler scheduler = scheduler(1, 10);
        UUID id = scheduler.submit(scenes(1), null);

        assertThat(scheduler.delete(id)).isFalse();
        assertThat(scheduler.metadata(id)).isPresent();
    }

    @Test
    void stopHaltsWorkers() throws Exception {
        JobScheduler scheduler = scheduler(1, 10);
        scheduler.start();
        assertThat(scheduler.isRunning()).isTrue();

        scheduler.stop();
        Thread.sleep(100);
        UUID id = scheduler.submit(scenes(1), null);

        verify(jobPipeline, after(300).never()).run(any());
        assertThat(scheduler.isRunning()).isFalse();
        assertThat(scheduler.status(id)).map(JobProgress::status).contains(VideoStatus.QUEUED);
    }

    private JobScheduler scheduler(int concurrency, int capacity) {
        WorkerExecutorProperties props = new WorkerExecutorProperties();
        props.setConcurrency(concurrency);
        props.setQueueCapacity(capacity);
        props.setPollTimeoutMillis(20);
        executor = Executors.newFixedThreadPool(concurrency);
        return new JobScheduler(tracker, jobPipeline, storage, executor, props,
                new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));
    }

    private Path completeJob(VideoJob job) throws Exception {
        tracker.updateProgress(job.id(), VideoStatus.PROCESSING, 5, null);
        tracker.updateProgress(job.id(), VideoStatus.GENERATING_AUDIO, 10, null);
        tracker.updateProgress(job.id(), VideoStatus.CREATING_CAPTIONS, 30, null);
        tracker.updateProgress(job.id(), VideoStatus.DOWNLOADING_VIDEO, 60, null);
        tracker.updateProgress(job.id(), VideoStatus.RENDERING, 85, null);
        Path out = storage.resolveVideo(job.id());
        Files.writeString(out, "video");
        tracker.markCompleted(job.id(), 3.0);
        return out;
    }

    private JobProgress awaitTerminal(UUID id) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (System.currentTimeMillis() < deadline) {
            JobProgress progress = tracker.getProgress(id).orElseThrow();
            if (progress.status().isTerminal()) {
                return progress;
            }
            Thread.sleep(10);
        }
        throw new AssertionError("job " + id + " did not finish");
    }

    private static List<SceneRequest> scenes(int n) {
        List<SceneRequest> list = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            list.add(SceneRequest.of("Narration " + i, "ocean"));
        }
        return list;
    }
}
