package com.example.shortvideo_backend.engine;

import com.example.shortvideo_backend.dto.CaptionToken;
import com.example.shortvideo_backend.dto.MusicTrack;
import com.example.shortvideo_backend.dto.RenderOptions;
import com.example.shortvideo_backend.dto.ResolvedScene;
import com.example.shortvideo_backend.ffmpeg.AssCaptionWriter;
import com.example.shortvideo_backend.ffmpeg.FfmpegRunner;
import com.example.shortvideo_backend.service.LocalStorageService;
import com.example.shortvideo_backend.util.MusicMood;
import com.example.shortvideo_backend.util.MusicVolume;
import com.example.shortvideo_backend.util.Orientation;
import com.example.shortvideo_backend.util.Provenance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FfmpegVideoCompositorTest {

    @TempDir
    Path base;

    private LocalStorageService storage;
    private RecordingRunner runner;
    private FfmpegVideoCompositor compositor;

    @BeforeEach
    void setUp() {
        storage = new LocalStorageService(base, "tmp", "videos", "music");
        runner = new RecordingRunner();
        compositor = new FfmpegVideoCompositor(storage, runner, new AssCaptionWriter("Arial"),
                "ffmpeg", 30, 20, "veryfast", null);
    }

    @Test
    void rendersSegmentsThenConcatenates() throws Exception {
        UUID jobId = UUID.randomUUID();
        List<ResolvedScene> scenes = List.of(scene(0, 2.0, 2.0), scene(1, 3.0, 4.5));

        Path output = compositor.render(scenes, null, RenderOptions.defaults(), jobId, Orientation.PORTRAIT);

        assertThat(output).isEqualTo(storage.resolveVideo(jobId)).exists();
        assertThat(runner.labels).containsExactly("segment-0", "segment-1", "concat");
        List<String> second = runner.commands.get(1);
        assertThat(second).containsSequence("-stream_loop", "-1");
        assertThat(second).containsSequence("-t", "4.500");
        assertThat(String.join(" ", second))
                .contains("scale=1080:1920:force_original_aspect_ratio=increase,crop=1080:1920,setsar=1,fps=30,subtitles=")
                .contains("[1:a]apad[a]");
        assertThat(runner.commands.get(2)).containsSequence("-f", "concat", "-safe", "0");
    }

    @Test
    void mixesMusicAtRequestedVolume() throws Exception {
        UUID jobId = UUID.randomUUID();
        Path track = Files.createDirectories(storage.rootMusic().resolve("chill")).resolve("lofi.mp3");
        Files.write(track, new byte[]{1});
        RenderOptions options = new RenderOptions(Orientation.LANDSCAPE, 0L, null, null, null, MusicMood.CHILL,
                MusicVolume.MEDIUM, List.of(), null).withDefaults();

        Path output = compositor.render(List.of(scene(0, 2.0, 2.0), scene(1, 1.5, 1.5)),
                new MusicTrack("lofi", track, MusicMood.CHILL), options, jobId, Orientation.LANDSCAPE);

        assertThat(output).exists();
        assertThat(runner.labels).containsExactly("segment-0", "segment-1", "concat", "music");
        List<String> mix = runner.commands.get(3);
        assertThat(String.join(" ", mix)).contains("[1:a]volume=0.45[m]").contains("normalize=0");
        assertThat(mix).containsSequence("-t", "3.500");
    }

    @Test
    void mutedMusicSkipsTheMix() throws Exception {
        Path track = Files.write(storage.rootMusic().resolve("any.mp3"), new byte[]{1});
        RenderOptions options = new RenderOptions(null, null, null, null, null, null,
                MusicVolume.MUTED, null, null).withDefaults();

        compositor.render(List.of(scene(0, 2.0, 2.0)), new MusicTrack("any", track, null), options,
                UUID.randomUUID(), Orientation.PORTRAIT);

        assertThat(runner.labels).doesNotContain("music");
    }

    @Test
    void ffmpegFailurePropagates() {
        runner.failOn = "segment-0";

        assertThatThrownBy(() -> compositor.render(List.of(scene(0, 2.0, 2.0)), null, RenderOptions.defaults(),
                UUID.randomUUID(), Orientation.PORTRAIT))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("segment-0");
    }

    private ResolvedScene scene(int index, double audio, double visual) throws IOException {
        Path audioPath = Files.write(base.resolve("a" + index + ".wav"), new byte[]{1});
        Path clipPath = Files.write(base.resolve("c" + index + ".mp4"), new byte[]{2});
        return new ResolvedScene(index, audioPath, audio, visual,
                List.of(new CaptionToken("word" + index, 0, 500)), clipPath, "clip" + index, Provenance.STOCK, null);
    }

    /** Records commands and creates the output file ffmpeg would have written. */
    private static final class RecordingRunner extends FfmpegRunner {
        final List<List<String>> commands = new ArrayList<>();
        final List<String> labels = new ArrayList<>();
        String failOn;

        RecordingRunner() {
            super(Duration.ofSeconds(1));
        }

        @Override
        public void run(List<String> cmd, String label) throws IOException {
            commands.add(List.copyOf(cmd));
            labels.add(label);
            if (label.equals(failOn)) {
                throw new IOException("ffmpeg " + label + " failed with exit 1");
            }
            Files.write(Path.of(cmd.get(cmd.size() - 1)), new byte[]{0});
        }
    }
}
