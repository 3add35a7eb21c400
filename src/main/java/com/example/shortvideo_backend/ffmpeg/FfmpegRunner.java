package com.example.shortvideo_backend.ffmpeg;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs one ffmpeg invocation with a hard timeout, draining stdout and stderr on daemon threads.
 */
public class FfmpegRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegRunner.class);
    private static final int MAX_STDERR_TAIL = 2000;

    private final Duration timeout;

    public FfmpegRunner(Duration timeout) {
        this.timeout = timeout != null ? timeout : Duration.ofMinutes(10);
    }

    public void run(List<String> cmd, String label) throws IOException, InterruptedException {
        LOGGER.info("FFmpeg {} command: {}", label, String.join(" ", cmd));

        ProcessBuilder pb = new ProcessBuilder(cmd).redirectErrorStream(false);
        Process p = pb.start();

        StringBuffer errBuf = new StringBuffer();

        Thread tOut = drain(p.getInputStream(), "[ffmpeg-out] {}", null);
        Thread tErr = drain(p.getErrorStream(), "[ffmpeg-err] {}", errBuf);
        tOut.start();
        tErr.start();

        try {
            boolean finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                throw new IOException("ffmpeg " + label + " timed out after " + timeout + "\n---- ffmpeg stderr ----\n" + tail(errBuf));
            }
        } finally {
            if (p.isAlive()) {
                LOGGER.warn("FFmpeg {} still running, killing pid={}", label, p.pid());
                p.destroyForcibly();
            }
        }
        tErr.join(1000);
        if (p.exitValue() != 0) {
            throw new IOException("ffmpeg " + label + " failed with exit " + p.exitValue()
                    + "\n---- ffmpeg stderr ----\n" + tail(errBuf));
        }
    }

    private static Thread drain(InputStream in, String pattern, StringBuffer sink) {
        Thread t = new Thread(() -> {
            try (var br = new BufferedReader(new InputStreamReader(in))) {
                br.lines().forEach(line -> {
                    LOGGER.debug(pattern, line);
                    if (sink != null) sink.append(line).append('\n');
                });
            } catch (IOException | UncheckedIOException e) {
                LOGGER.debug("ffmpeg stream closed: {}", e.toString());
            }
        });
        t.setDaemon(true);
        return t;
    }

    private static String tail(StringBuffer buf) {
        int len = buf.length();
        return len <= MAX_STDERR_TAIL ? buf.toString() : buf.substring(len - MAX_STDERR_TAIL);
    }
}
