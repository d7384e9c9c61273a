package org.javai.resilience.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * The decision made by a retry policy after evaluating a failure.
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.GiveUp {

    /**
     * Retry the operation after waiting for the specified delay.
     */
    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }

        public static Retry after(Duration delay) {
            return new Retry(delay);
        }
    }

    /**
     * Do not retry; the failure is final.
     */
    record GiveUp(Reason reason) implements RetryDecision {
        public GiveUp {
            Objects.requireNonNull(reason, "reason must not be null");
        }

        public static GiveUp notRetryable() {
            return new GiveUp(Reason.NOT_RETRYABLE);
        }

        public static GiveUp exhausted() {
            return new GiveUp(Reason.EXHAUSTED);
        }

        public boolean isExhausted() {
            return reason == Reason.EXHAUSTED;
        }
    }

    enum Reason {
        /** The retry predicate rejected the failure; it propagates unchanged. */
        NOT_RETRYABLE,
        /** Every allowed retry has been spent. */
        EXHAUSTED
    }
}
