package org.javai.resilience.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Exponential backoff with additive jitter: {@code baseDelay * 2^attempt + random[0, jitterMax)}.
 *
 * <p>The jitter source is shared by every call on this instance and is never reseeded, so
 * concurrent callers draw from one stream and spread their retries apart. Jitter is only
 * ever added, so the result is never below {@code baseDelay * 2^attempt}. Values that do not
 * fit in a {@link Duration} saturate at the largest representable duration.
 */
public final class ExponentialBackoff implements BackoffProvider {

    static final Duration MAX_DURATION = Duration.ofSeconds(Long.MAX_VALUE, 999_999_999);

    private final Duration baseDelay;
    private final Duration jitterMax;
    private final Random random;

    public ExponentialBackoff(Duration baseDelay, Duration jitterMax) {
        this(baseDelay, jitterMax, new Random());
    }

    /**
     * Creates a backoff with an explicit random source. Useful for testing.
     */
    public ExponentialBackoff(Duration baseDelay, Duration jitterMax, Random random) {
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        this.jitterMax = Objects.requireNonNull(jitterMax, "jitterMax must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        if (jitterMax.isNegative()) {
            throw new IllegalArgumentException("jitterMax must not be negative");
        }
    }

    @Override
    public Duration compute(int attempt) {
        requireValidAttempt(attempt);
        return saturatingPlus(exponentialPart(attempt), jitter());
    }

    /**
     * The deterministic lower bound of {@link #compute(int)}: {@code baseDelay * 2^attempt}.
     */
    public Duration exponentialPart(int attempt) {
        requireValidAttempt(attempt);
        if (baseDelay.isZero()) {
            return Duration.ZERO;
        }
        if (attempt >= Long.SIZE - 1) {
            return MAX_DURATION;
        }
        try {
            return baseDelay.multipliedBy(1L << attempt);
        } catch (ArithmeticException overflow) {
            return MAX_DURATION;
        }
    }

    public Duration baseDelay() {
        return baseDelay;
    }

    public Duration jitterMax() {
        return jitterMax;
    }

    private Duration jitter() {
        long boundNanos = jitterMax.toNanos();
        if (boundNanos <= 0) {
            return Duration.ZERO;
        }
        return Duration.ofNanos(random.nextLong(boundNanos));
    }

    static void requireValidAttempt(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, was: " + attempt);
        }
    }

    private static Duration saturatingPlus(Duration a, Duration b) {
        try {
            return a.plus(b);
        } catch (ArithmeticException overflow) {
            return MAX_DURATION;
        }
    }
}
