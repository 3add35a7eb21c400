package com.example.shortvideo_backend.engine;

import com.example.shortvideo_backend.config.OpenAIAudioProperties;
import com.example.shortvideo_backend.dto.CaptionToken;
import com.example.shortvideo_backend.engine.Interfaces.CaptionEngine;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpStatusCode;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Word-level captions from the OpenAI {@code /v1/audio/transcriptions} endpoint ({@code verbose_json}
 * with word timestamps). When the server only returns segments, words are spread evenly across them.
 */
public class OpenAICaptionEngine implements CaptionEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAICaptionEngine.class);
    private static final long DEFAULT_SYNTHETIC_WORD_MS = 200L;

    private final WebClient client;
    private final OpenAIAudioProperties props;
    private final ObjectMapper om = new ObjectMapper();

    public OpenAICaptionEngine(WebClient client, OpenAIAudioProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public List<CaptionToken> transcribe(byte[] audio, String fileName) throws Exception {
        if (audio == null || audio.length == 0) throw new IllegalArgumentException("audio is empty");
        String name = fileName == null || fileName.isBlank() ? "speech.wav" : fileName;

        var form = new LinkedMultiValueMap<String, Object>();
        form.add("file", new ByteArrayResource(audio) {
            @Override
            public String getFilename() {
                return name;
            }
        });
        form.add("model", props.getTranscription().getModel());
        form.add("response_format", "verbose_json");
        form.add("timestamp_granularities[]", "word");
        String lang = props.getLanguage();
        if (lang != null && !lang.isBlank() && !"auto".equalsIgnoreCase(lang)) {
            form.add("language", lang.toLowerCase(Locale.ROOT));
        }

        Mono<JsonNode> mono = client.post()
                .uri("/v1/audio/transcriptions")
                .body(BodyInserters.fromMultipartData(form))
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(body -> new IllegalStateException("Transcription error %s: %s".formatted(resp.statusCode(), body))))
                .bodyToMono(String.class)
                .map(this::parseJson);

        JsonNode root = mono.block(Duration.ofSeconds(props.getTimeoutSeconds()));
        if (root == null) throw new IllegalStateException("Empty response from transcription endpoint");

        List<CaptionToken> words = new ArrayList<>();
        JsonNode segments = root.has("segments") && root.get("segments").isArray() ? root.get("segments") : null;
        if (root.has("words") && root.get("words").isArray()) {
            for (var w : root.get("words")) words.add(parseWordSafe(w));
        } else if (segments != null) {
            for (var seg : segments) {
                if (seg.has("words")) {
                    for (var w : seg.get("words")) words.add(parseWordSafe(w));
                }
            }
        }
        if (words.isEmpty() && segments != null) {
            words.addAll(synthesizeWordsFromSegments(segments));
        }

        // blanks out, sorted by start
        List<CaptionToken> tokens = words.stream()
                .filter(w -> !w.text().isBlank())
                .sorted(Comparator.comparingLong(CaptionToken::startMs))
                .toList();
        LOGGER.debug("Transcribed file={} words={}", name, tokens.size());
        return tokens;
    }

    private List<CaptionToken> synthesizeWordsFromSegments(JsonNode segments) {
        List<CaptionToken> synthetic = new ArrayList<>();
        for (var seg : segments) {
            String segText = seg.path("text").asText("").trim();
            if (segText.isBlank()) continue;
            List<String> tokens = Arrays.stream(segText.split("\\s+"))
                    .filter(token -> !token.isBlank())
                    .toList();
            long segStartMs = Math.max(0L, toMs(seg.path("start").asDouble(0d)));
            long segEndMs = toMs(seg.path("end").asDouble(Double.NaN));
            if (segEndMs <= segStartMs) {
                segEndMs = segStartMs + DEFAULT_SYNTHETIC_WORD_MS * tokens.size();
            }
            double step = (segEndMs - segStartMs) / (double) tokens.size();
            for (int i = 0; i < tokens.size(); i++) {
                long tokenStart = segStartMs + Math.round(i * step);
                long tokenEnd = Math.max(tokenStart, segStartMs + Math.round((i + 1) * step));
                synthetic.add(new CaptionToken(tokens.get(i), tokenStart, tokenEnd));
            }
        }
        LOGGER.info("Transcription without word timestamps, synthesized words={} segments={}", synthetic.size(), segments.size());
        return synthetic;
    }

    private CaptionToken parseWordSafe(JsonNode w) {
        double s = w.path("start").asDouble(Double.NaN);
        double e = w.path("end").asDouble(Double.NaN);
        long startMs = Double.isFinite(s) ? Math.max(0L, Math.round(s * 1000.0)) : 0L;
        long endMs   = Double.isFinite(e) ? Math.max(startMs, Math.round(e * 1000.0)) : startMs;
        String text  = w.path("word").asText(w.path("text").asText("")).trim();
        return new CaptionToken(text, startMs, endMs);
    }

    private static long toMs(double seconds) {
        return Double.isFinite(seconds) ? Math.max(0L, Math.round(seconds * 1000.0)) : -1L;
    }

    private JsonNode parseJson(String body) {
        try {
            return om.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unparseable transcription response length="
                    + (body == null ? 0 : body.length()), e);
        }
    }
}
