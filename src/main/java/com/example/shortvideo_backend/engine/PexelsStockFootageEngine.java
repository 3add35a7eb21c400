package com.example.shortvideo_backend.engine;

import com.example.shortvideo_backend.config.PexelsProperties;
import com.example.shortvideo_backend.dto.ClipRef;
import com.example.shortvideo_backend.engine.Interfaces.StockFootageEngine;
import com.example.shortvideo_backend.util.Orientation;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Stock footage from the Pexels video search API. Each search term is tried in order, then the
 * generic joker terms in random order; within one result page a random eligible clip is chosen.
 * A clip is eligible when it lasts long enough, has not been used by the job and offers a file in
 * the requested orientation.
 */
public class PexelsStockFootageEngine implements StockFootageEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(PexelsStockFootageEngine.class);
    private static final Duration SEARCH_RETRY_BACKOFF = Duration.ofMillis(500);
    private static final int MIN_SHORT_SIDE = 720;

    private final WebClient apiClient;
    private final WebClient downloadClient;
    private final PexelsProperties props;
    private final Random random;
    private final ObjectMapper om = new ObjectMapper();

    public PexelsStockFootageEngine(WebClient apiClient, WebClient downloadClient, PexelsProperties props, Random random) {
        this.apiClient = apiClient;
        this.downloadClient = downloadClient;
        this.props = props;
        this.random = random;
    }

    @Override
    public ClipRef findClip(List<String> searchTerms, double minDurationSeconds, Collection<String> excludeIds,
                            Orientation orientation) throws Exception {
        Orientation target = orientation != null ? orientation : Orientation.PORTRAIT;
        double required = minDurationSeconds + props.getDurationBufferSeconds();
        Set<String> excluded = excludeIds == null ? Set.of() : Set.copyOf(excludeIds);

        Set<String> terms = new LinkedHashSet<>();
        if (searchTerms != null) {
            searchTerms.stream().filter(t -> t != null && !t.isBlank()).map(String::trim).forEach(terms::add);
        }
        List<String> jokers = new ArrayList<>(props.getJokerTerms());
        Collections.shuffle(jokers, random);
        terms.addAll(jokers);

        for (String term : terms) {
            JsonNode page = search(term, target);
            Optional<ClipRef> clip = pick(page, required, excluded, target);
            if (clip.isPresent()) {
                LOGGER.debug("Pexels clip term='{}' id={} duration={}s", term, clip.get().id(), clip.get().durationSeconds());
                return clip.get();
            }
            LOGGER.debug("Pexels no eligible clip term='{}' requiredSec={}", term, required);
        }
        LOGGER.warn("Pexels found nothing terms={} requiredSec={} excluded={}", searchTerms, required, excluded.size());
        return null;
    }

    @Override
    public byte[] download(String url, Duration timeout) throws Exception {
        byte[] body = downloadClient.get()
                .uri(url)
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(err -> new IllegalStateException("Download error %s for %s".formatted(resp.statusCode(), url))))
                .bodyToMono(byte[].class)
                .timeout(timeout)
                .block();
        if (body == null || body.length == 0) throw new IllegalStateException("Empty download from " + url);
        return body;
    }

    JsonNode search(String term, Orientation orientation) throws Exception {
        String raw = apiClient.get()
                .uri(b -> b.path("/videos/search")
                        .queryParam("query", term)
                        .queryParam("per_page", props.getPerPage())
                        .queryParam("orientation", orientation.wireValue())
                        .build())
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(err -> new IllegalStateException("Pexels error %s: %s".formatted(resp.statusCode(), err))))
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(props.getSearchTimeoutSeconds()))
                .retryWhen(Retry.backoff(Math.max(0, props.getSearchAttempts() - 1), SEARCH_RETRY_BACKOFF)
                        .filter(t -> t instanceof TimeoutException || t instanceof WebClientRequestException)
                        .doBeforeRetry(signal -> LOGGER.warn("Pexels search retry attempt={} term='{}' cause={}",
                                signal.totalRetries() + 1, term, signal.failure().toString()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .block();
        return raw == null ? om.createObjectNode() : om.readTree(raw);
    }

    Optional<ClipRef> pick(JsonNode page, double requiredSeconds, Set<String> excluded, Orientation orientation) {
        List<ClipRef> eligible = new ArrayList<>();
        for (JsonNode video : page.path("videos")) {
            String id = video.path("id").asText("");
            double duration = video.path("duration").asDouble(0d);
            if (id.isEmpty() || excluded.contains(id) || duration < requiredSeconds) {
                continue;
            }
            bestFile(video.path("video_files"), orientation)
                    .map(f -> new ClipRef(id, f.path("link").asText(), f.path("width").asInt(), f.path("height").asInt(), duration))
                    .ifPresent(eligible::add);
        }
        if (eligible.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(eligible.get(random.nextInt(eligible.size())));
    }

    /**
     * Exact canvas resolution first, otherwise the largest mp4 with the right aspect that is at least 720p.
     */
    static Optional<JsonNode> bestFile(JsonNode files, Orientation orientation) {
        List<JsonNode> candidates = new ArrayList<>();
        for (JsonNode f : files) {
            int w = f.path("width").asInt(0);
            int h = f.path("height").asInt(0);
            String type = f.path("file_type").asText("video/mp4").toLowerCase(Locale.ROOT);
            if (w <= 0 || h <= 0 || !type.contains("mp4") || f.path("link").asText("").isBlank()) continue;
            boolean portrait = h > w;
            if (portrait != (orientation == Orientation.PORTRAIT)) continue;
            if (Math.min(w, h) < MIN_SHORT_SIDE) continue;
            if (w == orientation.width() && h == orientation.height()) return Optional.of(f);
            candidates.add(f);
        }
        return candidates.stream()
                .max(Comparator.comparingInt(f -> f.path("width").asInt() * f.path("height").asInt()));
    }
}
