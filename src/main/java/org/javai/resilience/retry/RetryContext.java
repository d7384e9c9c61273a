package org.javai.resilience.retry;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Per-call state of a retry loop, provided to {@link RetryPolicy#decide} for each failure.
 * A new context starts with every top-level call; it is never shared or persisted.
 *
 * @param attemptNumber The attempt that just failed (1-based); also the number of the retry that would follow
 * @param startedAt When the first attempt began
 * @param elapsed Time elapsed since the first attempt
 */
public record RetryContext(
        int attemptNumber,
        Instant startedAt,
        Duration elapsed
) {
    public RetryContext {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1");
        }
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }

    public static RetryContext first() {
        return new RetryContext(1, Instant.now(), Duration.ZERO);
    }

    public RetryContext next() {
        return new RetryContext(attemptNumber + 1, startedAt, Duration.between(startedAt, Instant.now()));
    }

    /**
     * Number of retries already performed before the attempt that just failed.
     */
    public int retriesSoFar() {
        return attemptNumber - 1;
    }
}
