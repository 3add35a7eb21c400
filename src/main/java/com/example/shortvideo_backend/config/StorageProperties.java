package com.example.shortvideo_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storage.local")
public class StorageProperties {
    private String baseDir = "./data";
    private String tempPrefix = "tmp";
    private String videosPrefix = "videos";
    private String musicDir = "music";

    public String getBaseDir() { return baseDir; }
    public void setBaseDir(String baseDir) { this.baseDir = baseDir; }

    public String getTempPrefix() { return tempPrefix; }
    public void setTempPrefix(String tempPrefix) { this.tempPrefix = tempPrefix; }

    public String getVideosPrefix() { return videosPrefix; }
    public void setVideosPrefix(String videosPrefix) { this.videosPrefix = videosPrefix; }

    /** Relative paths resolve against {@code baseDir}. */
    public String getMusicDir() { return musicDir; }
    public void setMusicDir(String musicDir) { this.musicDir = musicDir; }
}
