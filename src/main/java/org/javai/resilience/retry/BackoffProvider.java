package org.javai.resilience.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Computes how long to wait before a retry.
 */
@FunctionalInterface
public interface BackoffProvider {

    /**
     * Computes the wait before the given retry.
     *
     * @param attempt the retry number (non-negative)
     * @return a non-negative duration
     * @throws IllegalArgumentException if attempt is negative
     */
    Duration compute(int attempt);

    /**
     * Creates a provider with exponential growth plus uniform jitter:
     * {@code baseDelay * 2^attempt + random[0, jitterMax)}.
     */
    static BackoffProvider exponential(Duration baseDelay, Duration jitterMax) {
        return new ExponentialBackoff(baseDelay, jitterMax);
    }

    /**
     * Creates a provider that always waits the same delay.
     */
    static BackoffProvider fixed(Duration delay) {
        Objects.requireNonNull(delay, "delay must not be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        return attempt -> {
            ExponentialBackoff.requireValidAttempt(attempt);
            return delay;
        };
    }

    /**
     * Creates a provider that never waits.
     */
    static BackoffProvider none() {
        return fixed(Duration.ZERO);
    }
}
