package com.example.shortvideo_backend.service;

import com.example.shortvideo_backend.dto.JobMetadata;
import com.example.shortvideo_backend.dto.JobProgress;
import com.example.shortvideo_backend.dto.ProgressEvent;
import com.example.shortvideo_backend.exception.PersistenceException;
import com.example.shortvideo_backend.model.VideoJobRecord;
import com.example.shortvideo_backend.repository.VideoJobRecordRepository;
import com.example.shortvideo_backend.service.observer.ProgressObserver;
import com.example.shortvideo_backend.util.ProgressEventType;
import com.example.shortvideo_backend.util.VideoStatus;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single owner of every job's status and percent. Each mutation is an atomic read-modify-write on
 * the job's entry and is written through to {@link VideoJobRecordRepository}; a failed write is
 * logged and the in-memory state stays authoritative. Observers are notified after the entry is
 * updated, outside the per-job lock.
 */
@Service
public class ProgressTracker {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProgressTracker.class);

    public static final int MAX_ERROR_LENGTH = 300;
    static final String INTERRUPTED_BY_RESTART = "interrupted by restart";
    private static final Set<VideoStatus> TERMINAL = EnumSet.of(VideoStatus.READY, VideoStatus.FAILED);

    private final ConcurrentHashMap<UUID, JobMetadata> jobs = new ConcurrentHashMap<>();
    private final VideoJobRecordRepository repository;
    private final List<ProgressObserver> observers;
    private final Clock clock;

    @Autowired
    public ProgressTracker(VideoJobRecordRepository repository,
                           ObjectProvider<ProgressObserver> observers,
                           Clock clock) {
        this(repository, observers.orderedStream().toList(), clock);
    }

    public ProgressTracker(VideoJobRecordRepository repository, List<ProgressObserver> observers, Clock clock) {
        this.repository = repository;
        this.observers = List.copyOf(observers);
        this.clock = clock;
    }

    /**
     * Reloads persisted jobs. The queue itself is not persisted, so anything that was still queued or
     * running when the process stopped can never finish and is marked failed.
     */
    @PostConstruct
    public void restore() {
        List<VideoJobRecord> records;
        try {
            records = repository.findAllByOrderByCreatedAtAsc();
        } catch (RuntimeException e) {
            LOGGER.error("RESTORE FAILED, starting with empty job table", new PersistenceException("Cannot load jobs", e));
            return;
        }
        int interrupted = 0;
        for (VideoJobRecord record : records) {
            JobMetadata meta = toMetadata(record);
            if (!meta.status().isTerminal()) {
                meta = failed(meta, INTERRUPTED_BY_RESTART, clock.instant());
                persist(meta);
                interrupted++;
            }
            jobs.put(meta.id(), meta);
        }
        LOGGER.info("RESTORE jobs={} interrupted={}", records.size(), interrupted);
    }

    public JobMetadata initialize(UUID id, int sceneCount) {
        Instant now = clock.instant();
        JobProgress progress = new JobProgress(VideoStatus.QUEUED, 0, "Queued", null, null, now, null);
        JobMetadata meta = new JobMetadata(id, VideoStatus.QUEUED, progress, sceneCount, null, now, null);
        jobs.compute(id, (key, existing) -> {
            if (existing != null) {
                throw new IllegalStateException("Job already tracked: " + id);
            }
            persist(meta);
            return meta;
        });
        notifyObservers(ProgressEventType.PROGRESS_UPDATE, meta);
        return meta;
    }

    /**
     * Moves a job to {@code status}. The percent is clamped to [0,100] and never lowered.
     * Unknown and terminal jobs are ignored with a warning.
     *
     * @throws IllegalStateException when the move is not an edge of the state machine.
     */
    public void updateProgress(UUID id, VideoStatus status, int percent, String label) {
        if (status == null || status.isTerminal()) {
            throw new IllegalArgumentException("Terminal states are set through markCompleted/markFailed, got " + status);
        }
        AtomicReference<JobMetadata> updated = new AtomicReference<>();
        JobMetadata result = jobs.computeIfPresent(id, (key, current) -> {
            if (current.status().isTerminal()) {
                LOGGER.warn("Ignoring progress for terminal job jobId={} status={} requested={}", id, current.status(), status);
                return current;
            }
            if (!current.status().canTransitionTo(status)) {
                throw new IllegalStateException("Illegal transition %s -> %s for job %s".formatted(current.status(), status, id));
            }
            Instant now = clock.instant();
            JobProgress prev = current.progress();
            int nextPercent = Math.max(prev.percent(), clamp(percent));
            Instant startedAt = prev.startedAt() != null ? prev.startedAt() : (status != VideoStatus.QUEUED ? now : null);
            Instant updatedAt = laterOf(prev.updatedAt(), now);
            JobProgress progress = new JobProgress(status, nextPercent, label != null ? label : prev.currentStep(),
                    estimateRemaining(startedAt, updatedAt, nextPercent), startedAt, updatedAt, null);
            JobMetadata next = new JobMetadata(id, status, progress, current.sceneCount(),
                    current.totalDurationSeconds(), current.createdAt(), null);
            persist(next);
            updated.set(next);
            return next;
        });
        if (result == null) {
            LOGGER.warn("Ignoring progress for unknown job jobId={} status={}", id, status);
            return;
        }
        if (updated.get() != null) {
            LOGGER.debug("PROGRESS jobId={} status={} percent={} step={}", id, status,
                    updated.get().progress().percent(), updated.get().progress().currentStep());
            notifyObservers(ProgressEventType.PROGRESS_UPDATE, updated.get());
        }
    }

    /**
     * @return {@code true} if the job moved to {@code failed}; {@code false} for unknown or already terminal jobs.
     */
    public boolean markFailed(UUID id, String reason) {
        AtomicReference<JobMetadata> updated = new AtomicReference<>();
        jobs.computeIfPresent(id, (key, current) -> {
            if (current.status().isTerminal()) {
                LOGGER.warn("Ignoring failure for terminal job jobId={} status={}", id, current.status());
                return current;
            }
            JobMetadata next = failed(current, reason, clock.instant());
            persist(next);
            updated.set(next);
            return next;
        });
        if (updated.get() == null) {
            return false;
        }
        LOGGER.info("JOB FAILED jobId={} error={}", id, updated.get().progress().error());
        notifyObservers(ProgressEventType.VIDEO_FAILED, updated.get());
        return true;
    }

    /**
     * Moves a job from {@code rendering} to {@code ready}.
     *
     * @throws IllegalStateException when the job is not rendering.
     */
    public boolean markCompleted(UUID id, double totalDurationSeconds) {
        AtomicReference<JobMetadata> updated = new AtomicReference<>();
        jobs.computeIfPresent(id, (key, current) -> {
            if (current.status().isTerminal()) {
                LOGGER.warn("Ignoring completion for terminal job jobId={} status={}", id, current.status());
                return current;
            }
            if (!current.status().canTransitionTo(VideoStatus.READY)) {
                throw new IllegalStateException("Illegal transition %s -> ready for job %s".formatted(current.status(), id));
            }
            Instant now = laterOf(current.progress().updatedAt(), clock.instant());
            JobProgress prev = current.progress();
            JobProgress progress = new JobProgress(VideoStatus.READY, 100, "Ready", 0L, prev.startedAt(), now, null);
            JobMetadata next = new JobMetadata(id, VideoStatus.READY, progress, current.sceneCount(),
                    totalDurationSeconds, current.createdAt(), now);
            persist(next);
            updated.set(next);
            return next;
        });
        if (updated.get() == null) {
            return false;
        }
        notifyObservers(ProgressEventType.VIDEO_COMPLETED, updated.get());
        return true;
    }

    public Optional<JobProgress> getProgress(UUID id) {
        return getMetadata(id).map(JobMetadata::progress);
    }

    public Optional<JobMetadata> getMetadata(UUID id) {
        return Optional.ofNullable(jobs.get(id));
    }

    public List<JobMetadata> getAllMetadata() {
        List<JobMetadata> all = new ArrayList<>(jobs.values());
        all.sort(Comparator.comparing(JobMetadata::createdAt).thenComparing(m -> m.id().toString()));
        return all;
    }

    /**
     * Forgets terminal jobs that finished before {@code cutoff}.
     *
     * @return number of jobs removed.
     */
    public int purgeFinishedBefore(Instant cutoff) {
        int removed = 0;
        for (Map.Entry<UUID, JobMetadata> entry : jobs.entrySet()) {
            JobMetadata meta = entry.getValue();
            if (meta.status().isTerminal() && meta.completedAt() != null && meta.completedAt().isBefore(cutoff)
                    && jobs.remove(entry.getKey(), meta)) {
                deleteRecord(entry.getKey());
                removed++;
            }
        }
        removed += purgeStaleRecords(cutoff);
        if (removed > 0) {
            LOGGER.info("PURGE removed={} cutoff={}", removed, cutoff);
        }
        return removed;
    }

    /**
     * Forgets a terminal job. Jobs still in flight are left alone.
     */
    public boolean delete(UUID id) {
        AtomicBoolean removed = new AtomicBoolean(false);
        jobs.computeIfPresent(id, (key, current) -> {
            if (!current.status().isTerminal()) {
                return current;
            }
            removed.set(true);
            return null;
        });
        if (removed.get()) {
            deleteRecord(id);
        }
        return removed.get();
    }

    /**
     * Drops a job that never became visible to a caller. Observers are not notified.
     */
    boolean discard(UUID id) {
        boolean removed = jobs.remove(id) != null;
        if (removed) {
            deleteRecord(id);
        }
        return removed;
    }

    public static String shortMessage(String reason) {
        String msg = reason == null || reason.isBlank() ? "Unknown error" : reason.strip();
        int newline = msg.indexOf('\n');
        if (newline > 0) {
            msg = msg.substring(0, newline).strip();
        }
        return msg.length() <= MAX_ERROR_LENGTH ? msg : msg.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }

    private JobMetadata failed(JobMetadata current, String reason, Instant clockNow) {
        JobProgress prev = current.progress();
        Instant now = laterOf(prev.updatedAt(), clockNow);
        JobProgress progress = new JobProgress(VideoStatus.FAILED, 100, prev.currentStep(), null,
                prev.startedAt(), now, shortMessage(reason));
        return new JobMetadata(current.id(), VideoStatus.FAILED, progress, current.sceneCount(),
                current.totalDurationSeconds(), current.createdAt(), now);
    }

    private void notifyObservers(ProgressEventType type, JobMetadata meta) {
        if (observers.isEmpty()) return;
        ProgressEvent event = new ProgressEvent(meta.id(), type, meta, meta.progress().updatedAt());
        for (ProgressObserver observer : observers) {
            try {
                observer.onEvent(event);
            } catch (RuntimeException e) {
                LOGGER.warn("Progress observer {} failed jobId={} event={}",
                        observer.getClass().getSimpleName(), meta.id(), type.wireValue(), e);
            }
        }
    }

    private void persist(JobMetadata meta) {
        try {
            VideoJobRecord record = repository.findById(meta.id())
                    .orElseGet(() -> new VideoJobRecord(meta.id(), meta.sceneCount(), meta.createdAt()));
            JobProgress progress = meta.progress();
            record.setStatus(meta.status());
            record.setPercent(progress.percent());
            record.setCurrentStep(progress.currentStep());
            record.setEtaSeconds(progress.estimatedSecondsRemaining());
            record.setErrorMessage(progress.error());
            record.setSceneCount(meta.sceneCount());
            record.setTotalDuration(meta.totalDurationSeconds());
            record.setStartedAt(progress.startedAt());
            record.setUpdatedAt(progress.updatedAt());
            record.setCompletedAt(meta.completedAt());
            repository.save(record);
        } catch (RuntimeException e) {
            LOGGER.error("PERSIST FAILED jobId={} status={}", meta.id(), meta.status(),
                    new PersistenceException("Cannot store job " + meta.id(), e));
        }
    }

    /**
     * Rows whose earlier delete failed are no longer tracked in memory but still expire.
     */
    private int purgeStaleRecords(Instant cutoff) {
        try {
            List<VideoJobRecord> stale = repository.findByStatusInAndCompletedAtBefore(TERMINAL, cutoff).stream()
                    .filter(r -> !jobs.containsKey(r.getId()))
                    .toList();
            if (!stale.isEmpty()) {
                repository.deleteAll(stale);
            }
            return stale.size();
        } catch (RuntimeException e) {
            LOGGER.error("PURGE FAILED cutoff={}", cutoff, new PersistenceException("Cannot purge jobs", e));
            return 0;
        }
    }

    private void deleteRecord(UUID id) {
        try {
            repository.deleteById(id);
        } catch (RuntimeException e) {
            LOGGER.error("DELETE FAILED jobId={}", id, new PersistenceException("Cannot delete job " + id, e));
        }
    }

    private static JobMetadata toMetadata(VideoJobRecord r) {
        JobProgress progress = new JobProgress(r.getStatus(), r.getPercent(), r.getCurrentStep(), r.getEtaSeconds(),
                r.getStartedAt(), r.getUpdatedAt(), r.getErrorMessage());
        return new JobMetadata(r.getId(), r.getStatus(), progress, r.getSceneCount(), r.getTotalDuration(),
                r.getCreatedAt(), r.getCompletedAt());
    }

    static Long estimateRemaining(Instant startedAt, Instant now, int percent) {
        if (startedAt == null || percent <= 0 || percent >= 100) {
            return null;
        }
        long elapsed = Math.max(0L, Duration.between(startedAt, now).toSeconds());
        return Math.round(elapsed * (100.0 - percent) / percent);
    }

    private static int clamp(int percent) {
        return Math.max(0, Math.min(100, percent));
    }

    private static Instant laterOf(Instant a, Instant b) {
        if (a == null) return b;
        return b.isAfter(a) ? b : a;
    }
}
