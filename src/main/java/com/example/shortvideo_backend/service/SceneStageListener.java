package com.example.shortvideo_backend.service;

import com.example.shortvideo_backend.util.VideoStatus;

@FunctionalInterface
public interface SceneStageListener {
    void onStage(VideoStatus stage);
}
