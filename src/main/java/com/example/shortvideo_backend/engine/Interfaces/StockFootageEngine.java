package com.example.shortvideo_backend.engine.Interfaces;

import com.example.shortvideo_backend.dto.ClipRef;
import com.example.shortvideo_backend.util.Orientation;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

public interface StockFootageEngine {
    /**
     * Finds a clip that lasts at least {@code minDurationSeconds} and whose id is not in {@code excludeIds}.
     */
    ClipRef findClip(List<String> searchTerms, double minDurationSeconds, Collection<String> excludeIds,
                     Orientation orientation) throws Exception;

    byte[] download(String url, Duration timeout) throws Exception;
}
