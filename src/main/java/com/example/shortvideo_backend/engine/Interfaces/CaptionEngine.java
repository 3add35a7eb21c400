package com.example.shortvideo_backend.engine.Interfaces;

import com.example.shortvideo_backend.dto.CaptionToken;

import java.util.List;

public interface CaptionEngine {
    /**
     * Transcribes narration audio into timed words, sorted by start offset.
     */
    List<CaptionToken> transcribe(byte[] audio, String fileName) throws Exception;
}
