package com.example.shortvideo_backend.engine;

import com.example.shortvideo_backend.config.AiVideoProperties;
import com.example.shortvideo_backend.engine.Interfaces.AiVideoEngine;
import com.example.shortvideo_backend.util.AiQuality;
import com.example.shortvideo_backend.util.Orientation;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Client for a self-hosted video diffusion server exposing a small job API:
 * {@code POST /api/generate} starts a job, {@code GET /api/jobs/{id}} reports
 * {@code queued|processing|completed|failed} and, once completed, a {@code video_url}.
 */
public class HttpAiVideoEngine implements AiVideoEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpAiVideoEngine.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final double CFG_SCALE = 1.0;

    private final WebClient client;
    private final AiVideoProperties props;
    private final Random random;

    public HttpAiVideoEngine(WebClient client, AiVideoProperties props, Random random) {
        this.client = client;
        this.props = props;
        this.random = random;
    }

    @Override
    public GeneratedClip generate(String prompt, double durationSeconds, Style style) throws Exception {
        if (prompt == null || prompt.isBlank()) throw new IllegalArgumentException("prompt is blank");
        AiQuality quality = style != null && style.quality() != null ? style.quality() : AiQuality.BALANCED;
        Orientation orientation = style != null && style.orientation() != null ? style.orientation() : Orientation.PORTRAIT;
        long seed = random.nextInt(Integer.MAX_VALUE);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prompt", prompt);
        body.put("negative_prompt", props.getNegativePrompt());
        body.put("duration", Math.max(1d, durationSeconds));
        body.put("width", orientation.width());
        body.put("height", orientation.height());
        body.put("fps", props.getFps());
        body.put("seed", seed);
        body.put("steps", quality.inferenceSteps());
        body.put("cfg", CFG_SCALE);
        body.put("use_teacache", quality.teaCache());
        body.put("mp4_crf", quality.crf());
        if (style != null && style.imageStyle() != null) {
            body.put("style", style.imageStyle().wireValue());
        }

        long t0 = System.nanoTime();
        JsonNode created = client.post()
                .uri("/api/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(err -> new IllegalStateException("AI video error %s: %s".formatted(resp.statusCode(), err))))
                .bodyToMono(JsonNode.class)
                .block(REQUEST_TIMEOUT);
        String jobId = created == null ? "" : created.path("job_id").asText(created.path("id").asText(""));
        if (jobId.isBlank()) throw new IllegalStateException("AI video server returned no job id");
        LOGGER.info("AI video job started remoteId={} steps={} durationSec={}", jobId, quality.inferenceSteps(), durationSeconds);

        JsonNode done = awaitCompletion(jobId);
        String videoUrl = done.path("video_url").asText("");
        if (videoUrl.isBlank()) throw new IllegalStateException("AI video job " + jobId + " completed without video_url");

        byte[] video = client.get()
                .uri(videoUrl)
                .retrieve()
                .bodyToMono(byte[].class)
                .block(Duration.ofSeconds(props.getTimeoutSeconds()));
        if (video == null || video.length == 0) throw new IllegalStateException("AI video job " + jobId + " returned an empty file");

        long latencyMs = (System.nanoTime() - t0) / 1_000_000;
        Long reportedSeed = done.hasNonNull("seed") ? done.get("seed").asLong() : seed;
        return new GeneratedClip(video, reportedSeed, latencyMs);
    }

    private JsonNode awaitCompletion(String jobId) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(props.getTimeoutSeconds()).toNanos();
        while (true) {
            JsonNode status = client.get()
                    .uri("/api/jobs/{id}", jobId)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(err -> new IllegalStateException("AI video status error %s: %s".formatted(resp.statusCode(), err))))
                    .bodyToMono(JsonNode.class)
                    .block(REQUEST_TIMEOUT);
            String state = status == null ? "" : status.path("status").asText("").toLowerCase(Locale.ROOT);
            switch (state) {
                case "completed" -> {
                    return status;
                }
                case "failed" -> throw new IllegalStateException("AI video job " + jobId + " failed: "
                        + status.path("error").asText("unknown error"));
                default -> LOGGER.debug("AI video job remoteId={} status={} progress={}", jobId, state,
                        status == null ? null : status.path("progress").asInt(0));
            }
            if (System.nanoTime() > deadline) {
                throw new IllegalStateException("AI video job " + jobId + " timed out after " + props.getTimeoutSeconds() + "s");
            }
            Thread.sleep(Math.max(10L, props.getPollIntervalMillis()));
        }
    }
}
