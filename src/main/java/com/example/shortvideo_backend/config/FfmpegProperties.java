package com.example.shortvideo_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "ffmpeg")
public class FfmpegProperties {

    private String bin = "ffmpeg";
    private Duration timeout = Duration.ofMinutes(10);
    private int fps = 30;
    private int crf = 20;
    private String preset = "veryfast";
    private String fontName = "Arial";
    private String fontsDir;

    public String getBin() { return bin; }
    public void setBin(String bin) { this.bin = bin; }

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }

    public int getFps() { return fps; }
    public void setFps(int fps) { this.fps = fps; }

    public int getCrf() { return crf; }
    public void setCrf(int crf) { this.crf = crf; }

    public String getPreset() { return preset; }
    public void setPreset(String preset) { this.preset = preset; }

    public String getFontName() { return fontName; }
    public void setFontName(String fontName) { this.fontName = fontName; }

    public String getFontsDir() { return fontsDir; }
    public void setFontsDir(String fontsDir) { this.fontsDir = fontsDir; }
}
