package com.p14n.pgbus;

import com.p14n.pgbus.supervision.ReconnectionPolicy;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Caller-chosen retry behaviour for publishes that fail with a
 * {@link TransientStoreException}. Validation errors are never retried.
 *
 * <pre>{@code
 * Publisher p = bus.publisher().withRetry(
 *         PublishRetryPolicy.exponential(3, Duration.ofMillis(100), Duration.ofSeconds(2)));
 * }</pre>
 */
public record PublishRetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay) {

    public PublishRetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    /**
     * A single attempt. Transient failures go straight back to the caller.
     */
    public static PublishRetryPolicy none() {
        return new PublishRetryPolicy(1, Duration.ofMillis(1), Duration.ofMillis(1));
    }

    /**
     * Up to {@code maxAttempts} attempts, doubling the wait between them.
     */
    public static PublishRetryPolicy exponential(int maxAttempts, Duration initialDelay, Duration maxDelay) {
        return new PublishRetryPolicy(maxAttempts, initialDelay, maxDelay);
    }

    <T> T execute(Supplier<T> attempt) {
        if (maxAttempts == 1) {
            return attempt.get();
        }
        ReconnectionPolicy backoff = ReconnectionPolicy.builder()
                .initialDelay(initialDelay)
                .maxDelay(maxDelay)
                .maxAttempts(maxAttempts)
                .build();
        while (true) {
            try {
                return attempt.get();
            } catch (TransientStoreException e) {
                Duration wait = backoff.recordFailure();
                if (!backoff.shouldRetry()) {
                    throw e;
                }
                try {
                    Thread.sleep(wait.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(ie);
                    throw e;
                }
            }
        }
    }
}
