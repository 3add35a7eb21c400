package com.example.shortvideo_backend.config;

import com.example.shortvideo_backend.engine.FfmpegVideoCompositor;
import com.example.shortvideo_backend.engine.Interfaces.VideoCompositor;
import com.example.shortvideo_backend.ffmpeg.AssCaptionWriter;
import com.example.shortvideo_backend.ffmpeg.FfmpegRunner;
import com.example.shortvideo_backend.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
@EnableConfigurationProperties(FfmpegProperties.class)
public class EngineConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public VideoCompositor videoCompositor(StorageService storageService, FfmpegProperties props) {
        Path fontsDir = props.getFontsDir() == null || props.getFontsDir().isBlank() ? null : Path.of(props.getFontsDir());
        LOGGER.info("Video compositor: ffmpeg bin={} fps={} crf={} preset={} timeout={}",
                props.getBin(), props.getFps(), props.getCrf(), props.getPreset(), props.getTimeout());
        return new FfmpegVideoCompositor(
                storageService,
                new FfmpegRunner(props.getTimeout()),
                new AssCaptionWriter(props.getFontName()),
                props.getBin(),
                props.getFps(),
                props.getCrf(),
                props.getPreset(),
                fontsDir);
    }
}
