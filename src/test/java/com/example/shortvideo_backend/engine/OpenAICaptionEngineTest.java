package com.example.shortvideo_backend.engine;

import com.example.shortvideo_backend.config.OpenAIAudioProperties;
import com.example.shortvideo_backend.dto.CaptionToken;
import com.example.shortvideo_backend.engine.Interfaces.CaptionEngine;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAICaptionEngineTest {

    private static final byte[] AUDIO = {1, 2, 3, 4};

    @Test
    void parsesWordTimestampsInOrder() throws Exception {
        AtomicReference<String> body = new AtomicReference<>();
        CaptionEngine engine = engine(request -> {
            body.set(ExchangeStubs.bodyOf(request));
            return Mono.just(ExchangeStubs.json(HttpStatus.OK, """
                    {"text":"Hello big world","words":[
                      {"word":"world","start":0.9,"end":1.3},
                      {"word":"Hello","start":0.0,"end":0.42},
                      {"word":" ","start":0.42,"end":0.5},
                      {"word":"big","start":0.5,"end":0.8}
                    ]}
                    """));
        });

        List<CaptionToken> tokens = engine.transcribe(AUDIO, "scene-0.wav");

        assertThat(tokens).containsExactly(
                new CaptionToken("Hello", 0, 420),
                new CaptionToken("big", 500, 800),
                new CaptionToken("world", 900, 1300));
        assertThat(body.get())
                .contains("name=\"file\"; filename=\"scene-0.wav\"")
                .contains("verbose_json")
                .contains("timestamp_granularities[]");
    }

    @Test
    void spreadsWordsAcrossSegmentsWhenServerOmitsWords() throws Exception {
        CaptionEngine engine = engine(request -> Mono.just(ExchangeStubs.json(HttpStatus.OK, """
                {"text":"one two","segments":[{"start":1.0,"end":2.0,"text":" one two "}]}
                """)));

        List<CaptionToken> tokens = engine.transcribe(AUDIO, "a.wav");

        assertThat(tokens).containsExactly(
                new CaptionToken("one", 1000, 1500),
                new CaptionToken("two", 1500, 2000));
    }

    @Test
    void truncatedBodyFailsOnFirstAttempt() {
        AtomicInteger attempts = new AtomicInteger();
        CaptionEngine engine = engine(request -> {
            attempts.incrementAndGet();
            return Mono.just(ExchangeStubs.json(HttpStatus.OK, "{\"words\":[{\"word\":\"ok\",\"sta"));
        });

        assertThatThrownBy(() -> engine.transcribe(AUDIO, "a.wav"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Unparseable transcription response");
        assertThat(attempts).hasValue(1);
    }

    @Test
    void connectionFailureIsNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        CaptionEngine engine = engine(request -> {
            attempts.incrementAndGet();
            return Mono.error(new IOException("connection reset"));
        });

        assertThatThrownBy(() -> engine.transcribe(AUDIO, "a.wav"))
                .hasRootCauseInstanceOf(IOException.class);
        assertThat(attempts).hasValue(1);
    }

    @Test
    void clientErrorIsNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        CaptionEngine engine = engine(request -> {
            attempts.incrementAndGet();
            return Mono.just(ExchangeStubs.json(HttpStatus.BAD_REQUEST, "{\"error\":\"bad file\"}"));
        });

        assertThatThrownBy(() -> engine.transcribe(AUDIO, "a.wav"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("bad file");
        assertThat(attempts).hasValue(1);
    }

    @Test
    void emptyAudioIsRejected() {
        CaptionEngine engine = engine(request -> Mono.error(new AssertionError("no call expected")));

        assertThatThrownBy(() -> engine.transcribe(new byte[0], "a.wav")).isInstanceOf(IllegalArgumentException.class);
    }

    private static CaptionEngine engine(ExchangeFunction exchange) {
        return new OpenAICaptionEngine(WebClient.builder().exchangeFunction(exchange).build(), new OpenAIAudioProperties());
    }
}
