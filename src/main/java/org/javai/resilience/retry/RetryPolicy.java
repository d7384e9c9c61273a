package org.javai.resilience.retry;

import org.javai.resilience.Action;
import org.javai.resilience.circuit.CircuitOpenException;
import org.javai.resilience.classify.DefaultFailureClassifier;
import org.javai.resilience.classify.FailureClassifier;
import org.javai.resilience.classify.GuardedFailureClassifier;
import org.javai.resilience.ops.CompositeResilienceListener;
import org.javai.resilience.ops.ResilienceListener;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Re-invokes a failing action after a backoff delay, up to a bounded number of retries.
 *
 * <p>Each call to {@link #execute(Action)} runs its own retry loop: attempts of one call are
 * strictly sequential, and the wait between them suspends only the calling thread. A policy
 * instance holds no per-call state and may be shared by any number of concurrent callers.
 *
 * <p>On failure the policy asks {@link #decide(RetryContext, Throwable)}:
 * <ul>
 *   <li>failures rejected by the retry predicate are rethrown unchanged;</li>
 *   <li>once {@code maxRetryCount} retries are spent, a {@link RetryExhaustedException}
 *       carrying the last failure is thrown;</li>
 *   <li>otherwise the listener is notified, the policy sleeps, and the action runs again.</li>
 * </ul>
 * The action is therefore invoked at most {@code maxRetryCount + 1} times per call.
 *
 * <p>{@link InterruptedException} is cancellation: it is never retried, and an interrupt
 * during the wait ends the call without invoking the action again.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RetryPolicy retry = RetryPolicy.builder()
 *     .name("orders-api")
 *     .maxRetryCount(3)
 *     .backoff(BackoffProvider.exponential(Duration.ofMillis(100), Duration.ofMillis(300)))
 *     .listener(listener)
 *     .build();
 *
 * retry.execute(() -> ordersApi.submit(order));
 * }</pre>
 */
public final class RetryPolicy {

    /**
     * The default retry predicate: everything except a rejection by an open circuit breaker.
     * Retrying against an open breaker cannot succeed and would defeat the breaker.
     */
    public static final Predicate<Throwable> RETRY_UNLESS_CIRCUIT_OPEN = t -> !(t instanceof CircuitOpenException);

    private final String name;
    private final int maxRetryCount;
    private final BackoffProvider backoff;
    private final Predicate<Throwable> shouldRetry;
    private final FailureClassifier classifier;
    private final ResilienceListener listener;
    private final Sleeper sleeper;

    private RetryPolicy(Builder builder) {
        this.name = builder.name;
        this.maxRetryCount = builder.maxRetryCount;
        this.backoff = builder.backoff;
        this.shouldRetry = builder.shouldRetry;
        this.classifier = GuardedFailureClassifier.guarding(builder.classifier);
        this.listener = CompositeResilienceListener.guarding(builder.listener);
        this.sleeper = builder.sleeper;
    }

    /**
     * Creates a builder for configuring a RetryPolicy.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns an action that runs {@code inner} under this policy.
     */
    public Action wrap(Action inner) {
        Objects.requireNonNull(inner, "inner must not be null");
        return () -> execute(inner);
    }

    /**
     * Runs the action, retrying qualifying failures.
     *
     * @param action the action to run
     * @throws RetryExhaustedException if every allowed attempt failed
     * @throws InterruptedException if the calling thread is interrupted
     * @throws Exception a non-retryable failure of the action, unchanged
     */
    public void execute(Action action) throws Exception {
        Objects.requireNonNull(action, "action must not be null");

        RetryContext context = RetryContext.first();
        while (true) {
            try {
                action.run();
                return;
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                RetryDecision decision = decide(context, e);

                if (decision instanceof RetryDecision.Retry retry) {
                    listener.onRetry(classifier.classify(name, e), retry.delay(), context.attemptNumber());
                    sleep(retry.delay());
                    context = context.next();
                } else if (((RetryDecision.GiveUp) decision).isExhausted()) {
                    RetryExhaustedException exhausted = new RetryExhaustedException(name, context.attemptNumber(), e);
                    listener.onRetryExhausted(classifier.classify(name, exhausted), context.attemptNumber());
                    throw exhausted;
                } else {
                    throw e;
                }
            }
        }
    }

    /**
     * Evaluates a failure and decides whether to retry.
     *
     * @param context The current retry context
     * @param failure The failure that occurred
     * @return Retry with a delay, or GiveUp
     */
    public RetryDecision decide(RetryContext context, Throwable failure) {
        if (!shouldRetry.test(failure)) {
            return RetryDecision.GiveUp.notRetryable();
        }
        if (context.retriesSoFar() >= maxRetryCount) {
            return RetryDecision.GiveUp.exhausted();
        }
        return RetryDecision.Retry.after(backoff.compute(context.attemptNumber()));
    }

    public String name() {
        return name;
    }

    public int maxRetryCount() {
        return maxRetryCount;
    }

    private void sleep(Duration duration) throws InterruptedException {
        if (duration.isZero()) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Interrupted before retry of [" + name + "]");
            }
            return;
        }
        sleeper.sleep(duration);
    }

    /**
     * Builder for configuring a RetryPolicy.
     */
    public static final class Builder {
        private String name = "retry";
        private int maxRetryCount = 3;
        private BackoffProvider backoff = BackoffProvider.exponential(Duration.ofMillis(100), Duration.ofMillis(300));
        private Predicate<Throwable> shouldRetry = RETRY_UNLESS_CIRCUIT_OPEN;
        private FailureClassifier classifier = new DefaultFailureClassifier();
        private ResilienceListener listener = ResilienceListener.noOp();
        private Sleeper sleeper = Sleeper.threadSleep();

        private Builder() {}

        /**
         * Sets the name used in diagnostics (optional, defaults to "retry").
         */
        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            return this;
        }

        /**
         * Sets the maximum number of retries after the first attempt (optional, defaults to 3).
         *
         * @throws IllegalArgumentException if negative
         */
        public Builder maxRetryCount(int maxRetryCount) {
            if (maxRetryCount < 0) {
                throw new IllegalArgumentException("maxRetryCount must be >= 0, was: " + maxRetryCount);
            }
            this.maxRetryCount = maxRetryCount;
            return this;
        }

        /**
         * Sets how long to wait before each retry (optional, defaults to 100ms exponential with 300ms jitter).
         */
        public Builder backoff(BackoffProvider backoff) {
            this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
            return this;
        }

        /**
         * Sets which failures are retried (optional, defaults to {@link #RETRY_UNLESS_CIRCUIT_OPEN}).
         * Circuit-open rejections are never retried, whatever the predicate says.
         */
        public Builder shouldRetry(Predicate<Throwable> shouldRetry) {
            Objects.requireNonNull(shouldRetry, "shouldRetry must not be null");
            this.shouldRetry = RETRY_UNLESS_CIRCUIT_OPEN.and(shouldRetry);
            return this;
        }

        /**
         * Sets the classifier used to describe failures to the listener (optional).
         */
        public Builder classifier(FailureClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        /**
         * Sets the listener for retry events (optional, defaults to no-op).
         */
        public Builder listener(ResilienceListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener must not be null");
            return this;
        }

        /**
         * Sets the sleeper for testing (package-private).
         */
        Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * Builds the RetryPolicy instance.
         *
         * @return a configured RetryPolicy
         */
        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
