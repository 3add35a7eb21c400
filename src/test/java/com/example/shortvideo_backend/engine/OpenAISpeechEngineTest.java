package com.example.shortvideo_backend.engine;

import com.example.shortvideo_backend.config.OpenAIAudioProperties;
import com.example.shortvideo_backend.engine.Interfaces.SpeechEngine;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class OpenAISpeechEngineTest {

    @Test
    void synthesizeSendsVoiceAndMeasuresWav() throws Exception {
        byte[] wav = wav(16_000, 8_000);
        AtomicReference<String> requestBody = new AtomicReference<>();
        AtomicReference<String> path = new AtomicReference<>();
        ExchangeFunction exchange = request -> {
            path.set(request.url().getPath());
            requestBody.set(ExchangeStubs.bodyOf(request));
            return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, "audio/wav")
                    .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(wav)))
                    .build());
        };
        SpeechEngine engine = new OpenAISpeechEngine(WebClient.builder().exchangeFunction(exchange).build(),
                new OpenAIAudioProperties());

        SpeechEngine.Speech speech = engine.synthesize("Hello there", "af_heart");

        assertThat(path.get()).isEqualTo("/v1/audio/speech");
        assertThat(requestBody.get())
                .contains("\"voice\":\"af_heart\"")
                .contains("\"input\":\"Hello there\"")
                .contains("\"response_format\":\"wav\"");
        assertThat(speech.audio()).isEqualTo(wav);
        assertThat(speech.format()).isEqualTo("wav");
        assertThat(speech.durationSeconds()).isCloseTo(0.5, within(1e-6));
    }

    @Test
    void serverErrorSurfacesStatus() {
        ExchangeFunction exchange = request -> Mono.just(ExchangeStubs.json(HttpStatus.BAD_GATEWAY, "{\"error\":\"down\"}"));
        SpeechEngine engine = new OpenAISpeechEngine(WebClient.builder().exchangeFunction(exchange).build(),
                new OpenAIAudioProperties());

        assertThatThrownBy(() -> engine.synthesize("Hello", "af_heart"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("502");
    }

    @Test
    void durationFallsBackToPayloadWhenHeaderOverstates() throws Exception {
        byte[] full = wav(16_000, 8_000);
        byte[] truncated = Arrays.copyOf(full, 44 + 4_000 * 2);

        assertThat(OpenAISpeechEngine.durationSeconds(truncated)).isCloseTo(0.25, within(1e-6));
    }

    @Test
    void nonWavAudioIsRejected() {
        byte[] mp3ish = "ID3 this is not a wave file, only some text bytes padded out to a decent length"
                .getBytes(StandardCharsets.US_ASCII);

        assertThatThrownBy(() -> OpenAISpeechEngine.durationSeconds(mp3ish))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("speech-format=wav");
    }

    static byte[] wav(int sampleRate, int frames) throws Exception {
        AudioFormat format = new AudioFormat(sampleRate, 16, 1, true, false);
        byte[] pcm = new byte[frames * 2];
        try (AudioInputStream in = new AudioInputStream(new ByteArrayInputStream(pcm), format, frames);
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            AudioSystem.write(in, AudioFileFormat.Type.WAVE, out);
            return out.toByteArray();
        }
    }
}
