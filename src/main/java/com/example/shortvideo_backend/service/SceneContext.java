package com.example.shortvideo_backend.service;

import java.util.Collections;
import java.util.Set;
import java.util.UUID;

/**
 * Per-scene view of the running job.
 *
 * @param excludedClipIds stock clip ids already used earlier in the job, read-only
 */
public record SceneContext(UUID jobId,
                           int sceneIndex,
                           int sceneCount,
                           Set<String> excludedClipIds,
                           JobWorkspace workspace) {
    public SceneContext {
        excludedClipIds = Collections.unmodifiableSet(excludedClipIds);
    }

    public boolean isLast() {
        return sceneIndex == sceneCount - 1;
    }
}
