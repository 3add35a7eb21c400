package com.example.shortvideo_backend.service;

import com.example.shortvideo_backend.config.PipelineProperties;
import com.example.shortvideo_backend.exception.CollaboratorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a blocking call with exponential backoff and no jitter: the delay before retry {@code n}
 * (0-based) is {@code baseDelay * 2^n}. Retries are resubscribed on the bounded elastic scheduler
 * so the call itself may block.
 */
@Component
public class RetryExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetryExecutor.class);
    private static final int MAX_MESSAGE_LENGTH = 200;

    private final int maxAttempts;
    private final Duration baseDelay;

    @Autowired
    public RetryExecutor(PipelineProperties properties) {
        this(properties.getRetry().getMaxAttempts(), properties.getRetry().getBaseDelay());
    }

    public RetryExecutor(int maxAttempts, Duration baseDelay) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * @throws CollaboratorException once every attempt failed, carrying the last failure as cause.
     */
    public <T> T execute(String operation, Callable<T> call) {
        AtomicInteger attempts = new AtomicInteger();
        try {
            return Mono.fromCallable(() -> {
                        attempts.incrementAndGet();
                        return call.call();
                    })
                    .retryWhen(Retry.backoff(maxAttempts - 1L, baseDelay)
                            .jitter(0d)
                            .scheduler(Schedulers.boundedElastic())
                            .filter(t -> !(t instanceof InterruptedException))
                            .doBeforeRetry(signal -> LOGGER.warn(
                                    "RETRY op={} attempt={}/{} delayMs={} cause={}",
                                    operation,
                                    signal.totalRetries() + 1,
                                    maxAttempts,
                                    baseDelay.multipliedBy(1L << signal.totalRetries()).toMillis(),
                                    describe(signal.failure())))
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new CollaboratorException(operation,
                    "%s failed after %d attempt(s): %s".formatted(operation, attempts.get(), describe(cause)),
                    cause);
        }
    }

    static String describe(Throwable t) {
        if (t == null) return "unknown";
        String msg = t.getMessage();
        String text = (msg == null || msg.isBlank()) ? t.getClass().getSimpleName() : msg;
        return text.length() <= MAX_MESSAGE_LENGTH ? text : text.substring(0, MAX_MESSAGE_LENGTH) + "...";
    }
}
