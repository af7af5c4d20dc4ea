package com.p14n.pgbus.supervision;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Exponential backoff between reconnect or restart attempts.
 *
 * Features:
 * - Delay grows by a multiplier on each failure, capped at a maximum
 * - Optional attempt limit, after which the circuit opens
 * - Reset on success
 *
 * Usage:
 * <pre>
 * ReconnectionPolicy policy = ReconnectionPolicy.builder()
 *     .initialDelay(Duration.ofSeconds(1))
 *     .maxDelay(Duration.ofMinutes(5))
 *     .build();
 *
 * while (policy.shouldRetry()) {
 *     try {
 *         connect();
 *         policy.recordSuccess();
 *         break;
 *     } catch (SQLException e) {
 *         sleep(policy.recordFailure());
 *     }
 * }
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;
    private final Clock clock;

    private int attemptCount = 0;
    private Duration currentDelay;
    private Instant lastAttemptTime;
    private boolean circuitOpen = false;

    private ReconnectionPolicy(Duration initialDelay, Duration maxDelay,
                              double multiplier, int maxAttempts, Clock clock) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.clock = clock;
        this.currentDelay = initialDelay;
    }

    /**
     * Check if another attempt should be made.
     *
     * @return true if retry should be attempted, false if circuit is open
     */
    public synchronized boolean shouldRetry() {
        if (circuitOpen) {
            return false;
        }
        return attemptCount < maxAttempts;
    }

    /**
     * The delay the next failure will return.
     *
     * @return Duration to wait after the next failure
     */
    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    /**
     * Record a failed attempt.
     *
     * @return how long to wait before the next attempt
     */
    public synchronized Duration recordFailure() {
        Duration wait = currentDelay;
        attemptCount++;
        lastAttemptTime = clock.instant();

        long newDelayMillis = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(newDelayMillis, maxDelay.toMillis()));

        if (attemptCount >= maxAttempts) {
            circuitOpen = true;
        }
        return wait;
    }

    /**
     * Record a successful attempt.
     * Resets all counters and closes the circuit.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        currentDelay = initialDelay;
        lastAttemptTime = null;
        circuitOpen = false;
    }

    /**
     * @return true if the attempt limit has been reached
     */
    public synchronized boolean isCircuitOpen() {
        return circuitOpen;
    }

    /**
     * @return Number of failed attempts since last success
     */
    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    /**
     * @return Instant of last failed attempt, or null if none since last success
     */
    public synchronized Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for ReconnectionPolicy. Attempts are unlimited unless
     * {@link #maxAttempts(int)} is set.
     */
    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(5);
        private double multiplier = 2.0;
        private int maxAttempts = Integer.MAX_VALUE;
        private Clock clock = Clock.systemUTC();

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(initialDelay, maxDelay, multiplier, maxAttempts, clock);
        }
    }
}
