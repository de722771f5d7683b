package com.landrecords.ec.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded exponential backoff shared by every retried remote call.
 *
 * Attempt n waits baseDelay * multiplier^(n-1) before the next one,
 * e.g. 1s, 2s, 4s with the defaults.
 */
@Slf4j
@Getter
public class BackoffPolicy {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final double multiplier;
    private final RetryConfig retryConfig;

    public BackoffPolicy(int maxAttempts, Duration baseDelay, double multiplier) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.multiplier = multiplier;
        this.retryConfig = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(baseDelay, multiplier))
                .build();
    }

    /**
     * Run the call, retrying any runtime exception. The last exception is rethrown
     * once attempts are exhausted.
     */
    public <T> T execute(String name, Supplier<T> call) {
        return execute(name, call, e -> true);
    }

    /**
     * As {@link #execute(String, Supplier)}, but an exception failing {@code retryable}
     * is rethrown straight away.
     */
    public <T> T execute(String name, Supplier<T> call, Predicate<Throwable> retryable) {
        RetryConfig config = RetryConfig.from(retryConfig).retryOnException(retryable).build();
        Retry retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(event -> log.warn("{}: attempt {} failed ({}), retrying in {}ms",
                name,
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown",
                event.getWaitInterval().toMillis()));
        return retry.executeSupplier(call);
    }
}
