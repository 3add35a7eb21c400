package com.example.shortvideo_backend.service.observer;

import com.example.shortvideo_backend.dto.ProgressEvent;

/**
 * Receives every progress, completion and failure event of every job. Called on the thread that
 * made the transition; implementations must not block for long.
 */
public interface ProgressObserver {
    void onEvent(ProgressEvent event);
}
