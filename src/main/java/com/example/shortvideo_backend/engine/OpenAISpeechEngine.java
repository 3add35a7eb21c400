package com.example.shortvideo_backend.engine;

import com.example.shortvideo_backend.config.OpenAIAudioProperties;
import com.example.shortvideo_backend.engine.Interfaces.SpeechEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Text-to-speech over the OpenAI {@code /v1/audio/speech} endpoint, which Kokoro servers also expose.
 * Audio is requested as WAV so the duration can be read from the header.
 */
public class OpenAISpeechEngine implements SpeechEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAISpeechEngine.class);
    private static final int WAV_HEADER_BYTES = 44;

    private final WebClient client;
    private final OpenAIAudioProperties props;

    public OpenAISpeechEngine(WebClient client, OpenAIAudioProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public Speech synthesize(String text, String voice) throws Exception {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("text is blank");
        String format = props.getSpeechFormat() == null ? "wav" : props.getSpeechFormat().toLowerCase(Locale.ROOT);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", props.getSpeech().getModel());
        body.put("input", text);
        body.put("voice", voice);
        body.put("response_format", format);
        body.put("speed", props.getSpeechSpeed());

        long t0 = System.nanoTime();
        byte[] audio = client.post()
                .uri("/v1/audio/speech")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.ALL)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(err -> new IllegalStateException("Speech error %s: %s".formatted(resp.statusCode(), err))))
                .bodyToMono(byte[].class)
                .block(Duration.ofSeconds(props.getTimeoutSeconds()));

        if (audio == null || audio.length == 0) throw new IllegalStateException("Empty response from speech endpoint");

        double duration = durationSeconds(audio);
        LOGGER.debug("Speech synthesized voice={} chars={} bytes={} durationSec={} in={}ms",
                voice, text.length(), audio.length, duration, (System.nanoTime() - t0) / 1_000_000);
        return new Speech(audio, duration, format);
    }

    /**
     * Reads the duration from a WAV header. Streaming servers often leave the data length unset,
     * in which case the byte rate and the payload size are used instead.
     */
    static double durationSeconds(byte[] audio) throws IOException {
        try (var in = new BufferedInputStream(new ByteArrayInputStream(audio))) {
            AudioFileFormat fileFormat = AudioSystem.getAudioFileFormat(in);
            AudioFormat format = fileFormat.getFormat();
            float frameRate = format.getFrameRate();
            int frameSize = format.getFrameSize();
            if (frameRate <= 0 || frameSize <= 0) {
                throw new IllegalStateException("Audio without frame rate, cannot measure duration");
            }
            long payloadFrames = Math.max(0, audio.length - WAV_HEADER_BYTES) / frameSize;
            long frames = fileFormat.getFrameLength();
            if (frames == AudioSystem.NOT_SPECIFIED || frames <= 0 || frames > payloadFrames) {
                frames = payloadFrames;
            }
            return frames / (double) frameRate;
        } catch (UnsupportedAudioFileException e) {
            throw new IllegalStateException("Speech audio is not WAV/AIFF/AU; configure openai.audio.speech-format=wav", e);
        }
    }
}
