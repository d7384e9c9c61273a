package org.javai.resilience.ops;

import org.javai.resilience.Failure;

import java.time.Duration;

/**
 * Receives diagnostics from the resilience policies.
 * Implementations might emit metrics, structured logs, or alerts.
 *
 * <p>Listeners are side-effect only. They cannot alter control flow: policies invoke them
 * through {@link CompositeResilienceListener}, which discards anything a listener throws.
 */
public interface ResilienceListener {

    /**
     * Called before the retry policy waits and re-invokes the action.
     *
     * @param failure The failure that triggered the retry
     * @param delay How long the policy will wait before the next attempt
     * @param retryNumber The retry about to happen (1-based)
     */
    default void onRetry(Failure failure, Duration delay, int retryNumber) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Called when the retry policy has spent all of its attempts.
     *
     * @param failure The final failure
     * @param totalAttempts The total number of attempts made
     */
    default void onRetryExhausted(Failure failure, int totalAttempts) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Called when the circuit breaker opens, from closed or after a failed half-open trial.
     *
     * @param failure The failure that tripped the breaker
     * @param breakDuration How long the breaker will reject calls
     */
    default void onBreak(Failure failure, Duration breakDuration) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Called when a successful half-open trial closes the circuit breaker.
     */
    default void onReset() {
        // Default: no-op. Implementations may override.
    }

    /**
     * Called when the circuit breaker admits a half-open trial.
     */
    default void onHalfOpen() {
        // Default: no-op. Implementations may override.
    }

    /**
     * Called when the fallback policy substitutes the fallback action for a failure.
     *
     * @param failure The failure being absorbed
     */
    default void onFallback(Failure failure) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A listener that does nothing. Useful for testing.
     */
    static ResilienceListener noOp() {
        return new ResilienceListener() {};
    }

    /**
     * Creates a composite listener that fans out to all given listeners.
     *
     * @param listeners the listeners to delegate to
     * @return a composite listener
     */
    static ResilienceListener composite(ResilienceListener... listeners) {
        return CompositeResilienceListener.of(listeners);
    }
}
