package org.javai.resilience;

import org.javai.resilience.circuit.CircuitBreaker;
import org.javai.resilience.config.ResilienceConfig;
import org.javai.resilience.fallback.FallbackFailedException;
import org.javai.resilience.fallback.FallbackPolicy;
import org.javai.resilience.ops.ResilienceListener;
import org.javai.resilience.retry.BackoffProvider;
import org.javai.resilience.retry.RetryPolicy;

import java.util.Objects;

/**
 * Composes fallback, retry and circuit breaking into one call, in a fixed order:
 *
 * <pre>
 *   execute(action) = fallback( retry( circuitBreaker( action ) ) )
 * </pre>
 *
 * <ul>
 *   <li>The circuit breaker is innermost, so every individual attempt is counted by the
 *       breaker and can be short-circuited by it.</li>
 *   <li>Retry sits inside fallback, so the fallback engages only once retries are exhausted
 *       or the breaker rejects the call, never on the first transient failure.</li>
 * </ul>
 * The order is part of the contract and cannot be configured.
 *
 * <p>A pipeline holds no mutable state of its own. Its three policies are shared by every
 * call, so one pipeline may serve many concurrent callers; the breaker's statistics then
 * reflect all of them.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * PolicyPipeline pipeline = PolicyPipeline.of(
 *     "orders-api",
 *     ResilienceConfig.defaults(),
 *     () -> cache.serveStale(),
 *     new Log4jResilienceListener());
 *
 * pipeline.execute(() -> ordersApi.submit(order));
 * }</pre>
 */
public final class PolicyPipeline {

    private final FallbackPolicy fallback;
    private final RetryPolicy retry;
    private final CircuitBreaker circuitBreaker;

    private PolicyPipeline(FallbackPolicy fallback, RetryPolicy retry, CircuitBreaker circuitBreaker) {
        this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
        this.retry = Objects.requireNonNull(retry, "retry must not be null");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker must not be null");
    }

    /**
     * Builds all three policies from one configuration, sharing a single listener.
     *
     * @param name the name reported by every policy of this pipeline
     * @param config thresholds and delays
     * @param fallbackAction what to do when the protected path ultimately fails
     * @param listener receives retry, breaker and fallback events
     * @return a ready pipeline
     */
    public static PolicyPipeline of(String name, ResilienceConfig config, Action fallbackAction, ResilienceListener listener) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(fallbackAction, "fallbackAction must not be null");
        Objects.requireNonNull(listener, "listener must not be null");

        CircuitBreaker circuitBreaker = CircuitBreaker.builder()
                .name(name)
                .failureThreshold(config.failureThreshold())
                .samplingDuration(config.samplingDuration())
                .breakDuration(config.breakDuration())
                .minimumThroughput(config.minimumThroughput())
                .listener(listener)
                .build();
        RetryPolicy retry = RetryPolicy.builder()
                .name(name)
                .maxRetryCount(config.maxRetryCount())
                .backoff(BackoffProvider.exponential(config.baseDelay(), config.jitterMax()))
                .listener(listener)
                .build();
        FallbackPolicy fallback = FallbackPolicy.builder()
                .name(name)
                .fallbackAction(fallbackAction)
                .listener(listener)
                .build();
        return new PolicyPipeline(fallback, retry, circuitBreaker);
    }

    /**
     * Creates a builder for assembling a pipeline from pre-built policies.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the composed action: fallback around retry around the circuit breaker.
     */
    public Action wrap(Action action) {
        Objects.requireNonNull(action, "action must not be null");
        return fallback.wrap(retry.wrap(circuitBreaker.wrap(action)));
    }

    /**
     * Runs the action through the pipeline.
     *
     * <p>Returns normally whenever either the action or the fallback action succeeds.
     *
     * @param action the primary action
     * @throws FallbackFailedException if the fallback action itself fails
     * @throws InterruptedException if the calling thread is interrupted, for example while
     *     waiting to retry; the action is not invoked again afterwards
     */
    public void execute(Action action) throws InterruptedException {
        Objects.requireNonNull(action, "action must not be null");
        fallback.execute(retry.wrap(circuitBreaker.wrap(action)));
    }

    public FallbackPolicy fallback() {
        return fallback;
    }

    public RetryPolicy retry() {
        return retry;
    }

    public CircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    /**
     * Builder for assembling a pipeline from pre-built policies. All three are required.
     */
    public static final class Builder {
        private FallbackPolicy fallback;
        private RetryPolicy retry;
        private CircuitBreaker circuitBreaker;

        private Builder() {}

        public Builder fallback(FallbackPolicy fallback) {
            this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
            return this;
        }

        public Builder retry(RetryPolicy retry) {
            this.retry = Objects.requireNonNull(retry, "retry must not be null");
            return this;
        }

        public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
            this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker must not be null");
            return this;
        }

        /**
         * Builds the pipeline.
         *
         * @throws NullPointerException if any policy has not been set
         */
        public PolicyPipeline build() {
            return new PolicyPipeline(fallback, retry, circuitBreaker);
        }
    }
}
