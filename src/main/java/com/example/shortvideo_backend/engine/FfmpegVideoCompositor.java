package com.example.shortvideo_backend.engine;

import com.example.shortvideo_backend.dto.MusicTrack;
import com.example.shortvideo_backend.dto.RenderOptions;
import com.example.shortvideo_backend.dto.ResolvedScene;
import com.example.shortvideo_backend.engine.Interfaces.VideoCompositor;
import com.example.shortvideo_backend.ffmpeg.AssCaptionWriter;
import com.example.shortvideo_backend.ffmpeg.FfmpegRunner;
import com.example.shortvideo_backend.service.Interfaces.StorageService;
import com.example.shortvideo_backend.util.CaptionPosition;
import com.example.shortvideo_backend.util.MusicVolume;
import com.example.shortvideo_backend.util.Orientation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Composes the final video with the ffmpeg CLI in three passes: one segment per scene (looped
 * visual scaled and cropped to the canvas, captions burned in, narration padded to the visual
 * length), a stream-copy concat, then the background music mix. Intermediates live in the job's
 * temp directory and are removed with it.
 */
public class FfmpegVideoCompositor implements VideoCompositor {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegVideoCompositor.class);

    private final StorageService storageService;
    private final FfmpegRunner runner;
    private final AssCaptionWriter captionWriter;
    private final String ffmpegBin;
    private final int fps;
    private final int crf;
    private final String preset;
    private final @Nullable Path fontsDir;

    public FfmpegVideoCompositor(StorageService storageService, FfmpegRunner runner, AssCaptionWriter captionWriter,
                                 String ffmpegBin, int fps, int crf, String preset, @Nullable Path fontsDir) {
        this.storageService = storageService;
        this.runner = runner;
        this.captionWriter = captionWriter;
        this.ffmpegBin = ffmpegBin;
        this.fps = fps;
        this.crf = crf;
        this.preset = preset;
        this.fontsDir = fontsDir != null ? fontsDir.toAbsolutePath().normalize() : null;
    }

    @Override
    public Path render(List<ResolvedScene> scenes, @Nullable MusicTrack music, RenderOptions options, UUID jobId,
                       Orientation orientation) throws IOException, InterruptedException {
        if (scenes == null || scenes.isEmpty()) {
            throw new IllegalArgumentException("Nothing to render for job " + jobId);
        }
        Orientation canvas = orientation != null ? orientation : Orientation.PORTRAIT;
        Path workDir = storageService.createJobTempDir(jobId).resolve("render-" + UUID.randomUUID());
        Files.createDirectories(workDir);

        List<Path> segments = new ArrayList<>(scenes.size());
        double total = 0d;
        for (ResolvedScene scene : scenes) {
            segments.add(renderSegment(scene, options, canvas, workDir));
            total += scene.visualDurationSeconds();
        }

        Path concat = workDir.resolve("concat.mp4");
        Path list = workDir.resolve("segments.txt");
        StringBuilder sb = new StringBuilder();
        for (Path segment : segments) {
            sb.append("file '").append(segment.toAbsolutePath().toString().replace("'", "'\\''")).append("'\n");
        }
        Files.writeString(list, sb.toString(), StandardCharsets.UTF_8);
        runner.run(List.of(ffmpegBin, "-y", "-f", "concat", "-safe", "0",
                "-i", list.toAbsolutePath().toString(),
                "-c", "copy",
                concat.toAbsolutePath().toString()), "concat");

        Path output = storageService.resolveVideo(jobId);
        Files.createDirectories(output.getParent());
        MusicVolume volume = options.musicVolume() != null ? options.musicVolume() : MusicVolume.HIGH;
        if (music != null && volume.gain() > 0d && Files.exists(music.file())) {
            Path mixed = workDir.resolve("mixed.mp4");
            runner.run(musicMixCommand(concat, music.file(), volume.gain(), total, mixed), "music");
            Files.move(mixed, output, StandardCopyOption.REPLACE_EXISTING);
        } else {
            Files.move(concat, output, StandardCopyOption.REPLACE_EXISTING);
        }
        LOGGER.info("Composed video jobId={} scenes={} durationSec={} music={} output={}",
                jobId, scenes.size(), String.format(Locale.ROOT, "%.2f", total),
                music == null ? "<none>" : music.name(), output);
        return output;
    }

    private Path renderSegment(ResolvedScene scene, RenderOptions options, Orientation canvas, Path workDir)
            throws IOException, InterruptedException {
        int w = canvas.width();
        int h = canvas.height();
        Path segment = workDir.resolve("segment-" + scene.index() + ".mp4");

        String vf = "scale=" + w + ":" + h + ":force_original_aspect_ratio=increase"
                + ",crop=" + w + ":" + h
                + ",setsar=1"
                + ",fps=" + fps;
        if (!scene.captions().isEmpty()) {
            Path ass = workDir.resolve("captions-" + scene.index() + ".ass");
            CaptionPosition position = options.captionPosition() != null ? options.captionPosition() : CaptionPosition.BOTTOM;
            captionWriter.write(ass, scene.captions(), canvas, position, options.captionBackgroundColor());
            String subFilter = "subtitles='" + escapeForFilter(ass.toAbsolutePath().toString()) + "'";
            if (fontsDir != null) subFilter += ":fontsdir='" + escapeForFilter(fontsDir.toString()) + "'";
            vf += "," + subFilter;
        }

        List<String> cmd = new ArrayList<>();
        cmd.add(ffmpegBin);
        cmd.add("-y");
        cmd.add("-stream_loop"); cmd.add("-1");
        cmd.add("-i"); cmd.add(scene.clipPath().toAbsolutePath().toString());
        cmd.add("-i"); cmd.add(scene.audioPath().toAbsolutePath().toString());
        cmd.add("-filter_complex"); cmd.add("[0:v]" + vf + "[v];[1:a]apad[a]");
        cmd.add("-map"); cmd.add("[v]");
        cmd.add("-map"); cmd.add("[a]");
        cmd.add("-t"); cmd.add(seconds(scene.visualDurationSeconds()));
        cmd.add("-c:v"); cmd.add("libx264");
        cmd.add("-preset"); cmd.add(preset);
        cmd.add("-crf"); cmd.add(String.valueOf(crf));
        cmd.add("-pix_fmt"); cmd.add("yuv420p");
        cmd.add("-c:a"); cmd.add("aac");
        cmd.add("-ar"); cmd.add("44100");
        cmd.add("-ac"); cmd.add("2");
        cmd.add(segment.toAbsolutePath().toString());

        runner.run(cmd, "segment-" + scene.index());
        return segment;
    }

    private List<String> musicMixCommand(Path video, Path music, double gain, double totalSeconds, Path out) {
        String filter = "[1:a]volume=" + String.format(Locale.ROOT, "%.2f", gain) + "[m];"
                + "[0:a][m]amix=inputs=2:duration=first:dropout_transition=0:normalize=0[a]";
        return List.of(ffmpegBin, "-y",
                "-i", video.toAbsolutePath().toString(),
                "-stream_loop", "-1",
                "-i", music.toAbsolutePath().toString(),
                "-filter_complex", filter,
                "-map", "0:v",
                "-map", "[a]",
                "-c:v", "copy",
                "-c:a", "aac",
                "-t", seconds(totalSeconds),
                "-movflags", "+faststart",
                out.toAbsolutePath().toString());
    }

    private static String seconds(double s) {
        return String.format(Locale.ROOT, "%.3f", Math.max(0.1, s));
    }

    private static String escapeForFilter(String path) {
        return path
                .replace("\\", "\\\\")
                .replace(":", "\\:")
                .replace("'", "\\'");
    }
}
