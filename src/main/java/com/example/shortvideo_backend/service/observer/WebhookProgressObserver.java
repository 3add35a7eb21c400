package com.example.shortvideo_backend.service.observer;

import com.example.shortvideo_backend.config.WebhookProperties;
import com.example.shortvideo_backend.dto.ProgressEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts job events to a configured URL. With a secret configured, the JSON body is signed with HMAC-SHA256
 * ({@code X-Webhook-Signature}, lowercase hex). Delivery is asynchronous and best effort:
 * failures are retried a few times and then logged, never reported back to the job.
 */
public class WebhookProgressObserver implements ProgressObserver {
    private static final Logger LOGGER = LoggerFactory.getLogger(WebhookProgressObserver.class);
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    static final String SIGNATURE_HEADER = "X-Webhook-Signature";
    static final String EVENT_HEADER = "X-Webhook-Event";
    static final String TIMESTAMP_HEADER = "X-Webhook-Timestamp";

    private final WebClient client;
    private final WebhookProperties props;
    private final ObjectMapper objectMapper;

    public WebhookProgressObserver(WebClient client, WebhookProperties props, ObjectMapper objectMapper) {
        this.client = client;
        this.props = props;
        this.objectMapper = objectMapper;
    }

    @Override
    public void onEvent(ProgressEvent event) {
        deliver(event).subscribe();
    }

    Mono<Void> deliver(ProgressEvent event) {
        if (!props.isEnabled() || props.getUrl() == null || props.getUrl().isBlank()) {
            return Mono.empty();
        }
        String eventName = event.type().webhookEvent();
        if (!props.getEvents().isEmpty() && !props.getEvents().contains(eventName)) {
            return Mono.empty();
        }

        String timestamp = event.timestamp() != null ? event.timestamp().toString() : "";
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", eventName);
        payload.put("videoId", event.jobId().toString());
        payload.put("timestamp", timestamp);
        payload.put("data", event.metadata());

        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            LOGGER.error("Webhook payload serialization failed jobId={} event={}", event.jobId(), eventName, e);
            return Mono.empty();
        }

        boolean signed = props.getSecret() != null && !props.getSecret().isEmpty();
        return client.post()
                .uri(props.getUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .headers(h -> {
                    if (signed) h.set(SIGNATURE_HEADER, sign(body, props.getSecret()));
                })
                .header(EVENT_HEADER, eventName)
                .header(TIMESTAMP_HEADER, timestamp)
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .timeout(Duration.ofSeconds(props.getTimeoutSeconds()))
                .retryWhen(Retry.backoff(props.getMaxRetries(), Duration.ofMillis(props.getRetryBackoffMillis()))
                        .jitter(0d)
                        .doBeforeRetry(signal -> LOGGER.warn("Webhook retry attempt={} jobId={} event={} cause={}",
                                signal.totalRetries() + 1, event.jobId(), eventName, signal.failure().toString())))
                .doOnSuccess(response -> LOGGER.info("Webhook delivered jobId={} event={} status={}",
                        event.jobId(), eventName, response == null ? null : response.getStatusCode()))
                .doOnError(error -> LOGGER.error("Webhook delivery failed jobId={} event={}: {}",
                        event.jobId(), eventName, error.getMessage()))
                .onErrorResume(e -> Mono.empty())
                .then();
    }

    /**
     * Unsigned deliveries are sent when no secret is configured; the secret must not be empty here.
     */
    public static String sign(String body, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
