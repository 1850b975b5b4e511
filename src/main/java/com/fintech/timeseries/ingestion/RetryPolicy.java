package com.fintech.timeseries.ingestion;

import com.fintech.timeseries.config.TimeSeriesProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Shared exponential backoff policy for upstream fetches. Only
 * {@link TransientFetchException} is retried; every other failure
 * surfaces immediately.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final RetryConfig config;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.config = RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, multiplier, maxBackoff))
            .retryExceptions(TransientFetchException.class)
            .build();
    }

    public static RetryPolicy from(TimeSeriesProperties.Retry retry) {
        return new RetryPolicy(retry.getMaxAttempts(), retry.getInitialBackoff(),
            retry.getMultiplier(), retry.getMaxBackoff());
    }

    /** Creates a named retry instance that logs each attempt. */
    public Retry newRetry(String name) {
        Retry retry = Retry.of(name, config);
        retry.getEventPublisher()
            .onRetry(event -> log.warn("Retrying {} (attempt {}) in {}ms: {}",
                name,
                event.getNumberOfRetryAttempts(),
                event.getWaitInterval().toMillis(),
                event.getLastThrowable().getMessage()));
        return retry;
    }
}
