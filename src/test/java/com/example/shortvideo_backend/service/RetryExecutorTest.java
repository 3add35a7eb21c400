package com.example.shortvideo_backend.service;

import com.example.shortvideo_backend.exception.CollaboratorException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryExecutorTest {

    @Test
    void returnsFirstSuccessfulResult() {
        RetryExecutor retry = new RetryExecutor(3, Duration.ofMillis(10));
        AtomicInteger calls = new AtomicInteger();

        String result = retry.execute("download", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("connection reset");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    void failsWithLastCauseAfterAllAttempts() {
        RetryExecutor retry = new RetryExecutor(2, Duration.ofMillis(5));
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retry.execute("ai generation", () -> {
            throw new IOException("attempt " + calls.incrementAndGet());
        }))
                .isInstanceOf(CollaboratorException.class)
                .hasMessage("ai generation failed after 2 attempt(s): attempt 2")
                .hasCauseInstanceOf(IOException.class)
                .satisfies(e -> assertThat(((CollaboratorException) e).getOperation()).isEqualTo("ai generation"));
        assertThat(calls).hasValue(2);
    }

    @Test
    void waitsExponentiallyBetweenAttempts() {
        RetryExecutor retry = new RetryExecutor(3, Duration.ofMillis(100));
        List<Long> starts = new ArrayList<>();

        assertThatThrownBy(() -> retry.execute("download", () -> {
            starts.add(System.nanoTime());
            throw new IllegalStateException("down");
        })).isInstanceOf(CollaboratorException.class);

        assertThat(starts).hasSize(3);
        long firstGapMs = (starts.get(1) - starts.get(0)) / 1_000_000;
        long secondGapMs = (starts.get(2) - starts.get(1)) / 1_000_000;
        assertThat(firstGapMs).isGreaterThanOrEqualTo(90);
        assertThat(secondGapMs).isGreaterThanOrEqualTo(190);
    }

    @Test
    void singleAttemptDoesNotRetry() {
        RetryExecutor retry = new RetryExecutor(0, Duration.ofSeconds(1));
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retry.execute("download", () -> {
            calls.incrementAndGet();
            throw new IOException("nope");
        })).isInstanceOf(CollaboratorException.class);

        assertThat(retry.getMaxAttempts()).isEqualTo(1);
        assertThat(calls).hasValue(1);
    }

    @Test
    void describeFallsBackToTypeName() {
        assertThat(RetryExecutor.describe(new IOException())).isEqualTo("IOException");
        assertThat(RetryExecutor.describe(new IOException("x".repeat(300)))).hasSize(203);
    }
}
