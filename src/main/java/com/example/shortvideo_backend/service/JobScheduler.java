package com.example.shortvideo_backend.service;

import com.example.shortvideo_backend.config.WorkerExecutorProperties;
import com.example.shortvideo_backend.dto.HybridOptions;
import com.example.shortvideo_backend.dto.JobMetadata;
import com.example.shortvideo_backend.dto.JobProgress;
import com.example.shortvideo_backend.dto.RenderOptions;
import com.example.shortvideo_backend.dto.SceneRequest;
import com.example.shortvideo_backend.dto.VideoJob;
import com.example.shortvideo_backend.exception.CollaboratorException;
import com.example.shortvideo_backend.exception.GenerationException;
import com.example.shortvideo_backend.exception.PersistenceException;
import com.example.shortvideo_backend.exception.QueueFullException;
import com.example.shortvideo_backend.exception.StorageException;
import com.example.shortvideo_backend.exception.ValidationException;
import com.example.shortvideo_backend.service.Interfaces.StorageService;
import com.example.shortvideo_backend.util.VideoStatus;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point for video generation. Submissions are validated synchronously, queued FIFO and
 * drained by {@code worker.concurrency} long-lived worker loops. A job is claimed by removing it
 * from {@code pending}; cancel uses the same claim, so a job is either cancelled or run, never both.
 */
@Service
public class JobScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobScheduler.class);
    static final String CANCELLED_REASON = "cancelled before processing";

    private final ProgressTracker progressTracker;
    private final JobPipeline jobPipeline;
    private final StorageService storageService;
    private final Executor workerExecutor;
    private final WorkerExecutorProperties workerProperties;
    private final Clock clock;

    private final BlockingQueue<VideoJob> queue;
    private final ConcurrentHashMap<UUID, VideoJob> pending = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public JobScheduler(ProgressTracker progressTracker,
                        JobPipeline jobPipeline,
                        StorageService storageService,
                        @Qualifier("workerTaskExecutor") Executor workerExecutor,
                        WorkerExecutorProperties workerProperties,
                        Clock clock) {
        this.progressTracker = progressTracker;
        this.jobPipeline = jobPipeline;
        this.storageService = storageService;
        this.workerExecutor = workerExecutor;
        this.workerProperties = workerProperties;
        this.clock = clock;
        this.queue = new LinkedBlockingQueue<>(Math.max(1, workerProperties.getQueueCapacity()));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        int workers = workerProperties.effectiveConcurrency();
        for (int i = 0; i < workers; i++) {
            workerExecutor.execute(this::workerLoop);
        }
        LOGGER.info("JobScheduler started workers={} queueCapacity={}", workers, workerProperties.getQueueCapacity());
    }

    /**
     * Stops taking new jobs off the queue. A job already running finishes.
     */
    @PreDestroy
    public void stop() {
        if (running.compareAndSet(true, false)) {
            LOGGER.info("JobScheduler stopping queued={}", queue.size());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Validates and enqueues a job.
     *
     * @return the new job id; the job is {@code queued} when this returns.
     * @throws ValidationException when the scenes or options are unusable.
     * @throws QueueFullException  when the queue is at capacity.
     */
    public UUID submit(List<SceneRequest> scenes, RenderOptions options) {
        validate(scenes, options);
        if (queue.remainingCapacity() == 0) {
            throw new QueueFullException(workerProperties.getQueueCapacity());
        }
        RenderOptions effective = options == null ? RenderOptions.defaults() : options.withDefaults();
        UUID id = UUID.randomUUID();
        VideoJob job = new VideoJob(id, scenes, effective, sequence.incrementAndGet(), clock.instant());

        progressTracker.initialize(id, scenes.size());
        pending.put(id, job);
        if (!queue.offer(job)) {
            pending.remove(id);
            progressTracker.discard(id);
            throw new QueueFullException(workerProperties.getQueueCapacity());
        }
        LOGGER.info("JOB QUEUED jobId={} scenes={} position={} queued={}", id, scenes.size(), job.queuePosition(), queue.size());
        return id;
    }

    public Optional<JobProgress> status(UUID id) {
        return progressTracker.getProgress(id);
    }

    /**
     * Cancels a job that has not been picked up yet.
     *
     * @return {@code false} for unknown jobs and for jobs a worker already claimed.
     */
    public boolean cancel(UUID id) {
        VideoJob job = pending.remove(id);
        if (job == null) {
            return false;
        }
        queue.remove(job);
        progressTracker.markFailed(id, CANCELLED_REASON);
        LOGGER.info("JOB CANCELLED jobId={}", id);
        return true;
    }

    public Optional<JobMetadata> metadata(UUID id) {
        return progressTracker.getMetadata(id);
    }

    public List<JobMetadata> list() {
        return progressTracker.getAllMetadata();
    }

    public Optional<Path> outputFile(UUID id) {
        return progressTracker.getMetadata(id)
                .filter(m -> m.status() == VideoStatus.READY)
                .filter(m -> storageService.existsVideo(id))
                .map(m -> storageService.resolveVideo(id));
    }

    /**
     * Removes a finished job and its output file. Jobs that are queued or running are kept.
     */
    public boolean delete(UUID id) {
        Optional<JobMetadata> meta = progressTracker.getMetadata(id);
        if (meta.isEmpty() || !meta.get().status().isTerminal()) {
            return false;
        }
        storageService.deleteVideo(id);
        boolean removed = progressTracker.delete(id);
        LOGGER.info("JOB DELETED jobId={} removed={}", id, removed);
        return removed;
    }

    public int queueSize() {
        return queue.size();
    }

    void workerLoop() {
        LOGGER.debug("Worker loop started thread={}", Thread.currentThread().getName());
        long pollMillis = Math.max(10L, workerProperties.getPollTimeoutMillis());
        while (running.get()) {
            VideoJob job;
            try {
                job = queue.poll(pollMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.info("Worker interrupted thread={}", Thread.currentThread().getName());
                return;
            }
            if (job == null) {
                continue;
            }
            if (pending.remove(job.id()) == null) {
                LOGGER.debug("Skipping cancelled job jobId={}", job.id());
                continue;
            }
            runJob(job);
        }
        LOGGER.debug("Worker loop stopped thread={}", Thread.currentThread().getName());
    }

    private void runJob(VideoJob job) {
        long t0 = System.nanoTime();
        try {
            Path output = jobPipeline.run(job);
            LOGGER.info("JOB DONE jobId={} output={} in={}ms", job.id(), output, (System.nanoTime() - t0) / 1_000_000);
        } catch (Throwable e) {
            LOGGER.error("JOB FAILED jobId={} in={}ms: {}", job.id(), (System.nanoTime() - t0) / 1_000_000, e.toString(), e);
            progressTracker.markFailed(job.id(), failureMessage(e));
        }
    }

    /**
     * Short, stack-free reason stored on a failed job.
     */
    static String failureMessage(Throwable e) {
        boolean known = e instanceof CollaboratorException
                || e instanceof GenerationException
                || e instanceof ValidationException
                || e instanceof PersistenceException
                || e instanceof StorageException;
        String message = known && e.getMessage() != null && !e.getMessage().isBlank()
                ? e.getMessage()
                : "Unexpected error (" + e.getClass().getSimpleName() + ")";
        return ProgressTracker.shortMessage(message);
    }

    static void validate(List<SceneRequest> scenes, RenderOptions options) {
        if (scenes == null || scenes.isEmpty()) {
            throw new ValidationException("At least one scene is required");
        }
        for (int i = 0; i < scenes.size(); i++) {
            SceneRequest scene = scenes.get(i);
            if (scene == null) {
                throw new ValidationException("Scene " + i + " is missing");
            }
            if (scene.text() == null || scene.text().isBlank()) {
                throw new ValidationException("Scene " + i + " has no narration text");
            }
            if (!scene.hasSearchTerm() && !scene.hasExplicitPrompt()) {
                throw new ValidationException("Scene " + i + " needs a search term or an image/video prompt");
            }
        }
        if (options == null) {
            return;
        }
        if (options.paddingBackMs() != null && options.paddingBackMs() < 0) {
            throw new ValidationException("paddingBackMs must be >= 0");
        }
        HybridOptions hybrid = options.hybrid();
        if (hybrid != null && hybrid.aiGenerationRatio() != null) {
            double ratio = hybrid.aiGenerationRatio();
            if (Double.isNaN(ratio) || ratio < 0d || ratio > 1d) {
                throw new ValidationException("aiGenerationRatio must be within [0,1]");
            }
        }
    }
}
