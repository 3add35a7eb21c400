package com.example.shortvideo_backend.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configures the job queue and the worker pool that drains it.
 */
@Validated
@ConfigurationProperties(prefix = "worker")
public class WorkerExecutorProperties {

    private int concurrency = 1;
    @Min(1)
    private int queueCapacity = 100;
    @Min(10)
    private long pollTimeoutMillis = 500;

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public long getPollTimeoutMillis() {
        return pollTimeoutMillis;
    }

    public void setPollTimeoutMillis(long pollTimeoutMillis) {
        this.pollTimeoutMillis = pollTimeoutMillis;
    }

    /**
     * Number of worker threads, never below one.
     *
     * @return effective worker count.
     */
    public int effectiveConcurrency() {
        return Math.max(1, concurrency);
    }
}
