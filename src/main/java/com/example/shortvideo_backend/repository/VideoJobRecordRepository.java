package com.example.shortvideo_backend.repository;

import com.example.shortvideo_backend.model.VideoJobRecord;
import com.example.shortvideo_backend.util.VideoStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface VideoJobRecordRepository extends JpaRepository<VideoJobRecord, UUID> {
    List<VideoJobRecord> findAllByOrderByCreatedAtAsc();

    List<VideoJobRecord> findByStatusInAndCompletedAtBefore(Collection<VideoStatus> statuses, Instant cutoff);
}
