package com.example.shortvideo_backend.model;


import com.example.shortvideo_backend.util.VideoStatus;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Persisted snapshot of one job's metadata. The tracker keeps the authoritative copy in memory and
 * writes this row on every transition.
 */
@Entity
@Table(
        name = "video_job",
        indexes = {
                @Index(name = "idx_video_job_status_completed", columnList = "status, completed_at")
        }
)
public class VideoJobRecord {
    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private VideoStatus status = VideoStatus.QUEUED;

    @Column(name = "percent", nullable = false)
    private int percent;

    @Column(name = "current_step", length = 255)
    private String currentStep;

    @Column(name = "eta_seconds")
    private Long etaSeconds;

    @Column(name = "error_message", length = 300)
    private String errorMessage;

    @Column(name = "scene_count", nullable = false)
    private int sceneCount;

    @Column(name = "total_duration")
    private Double totalDuration;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    protected VideoJobRecord() {}

    public VideoJobRecord(UUID id, int sceneCount, Instant createdAt) {
        this.id = id;
        this.sceneCount = sceneCount;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public UUID getId() {
        return id;
    }

    public VideoStatus getStatus() {
        return status;
    }

    public void setStatus(VideoStatus status) {
        this.status = status;
    }

    public int getPercent() {
        return percent;
    }

    public void setPercent(int percent) {
        this.percent = percent;
    }

    public String getCurrentStep() {
        return currentStep;
    }

    public void setCurrentStep(String currentStep) {
        this.currentStep = currentStep;
    }

    public Long getEtaSeconds() {
        return etaSeconds;
    }

    public void setEtaSeconds(Long etaSeconds) {
        this.etaSeconds = etaSeconds;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public int getSceneCount() {
        return sceneCount;
    }

    public void setSceneCount(int sceneCount) {
        this.sceneCount = sceneCount;
    }

    public Double getTotalDuration() {
        return totalDuration;
    }

    public void setTotalDuration(Double totalDuration) {
        this.totalDuration = totalDuration;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    @PrePersist
    void prePersist() {
        if (updatedAt == null) updatedAt = createdAt != null ? createdAt : Instant.now();
        if (status == null) status = VideoStatus.QUEUED;
    }
}
