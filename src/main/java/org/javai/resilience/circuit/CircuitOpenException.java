package org.javai.resilience.circuit;

import org.javai.resilience.ResilienceException;

import java.time.Duration;

/**
 * Thrown when a {@link CircuitBreaker} rejects a call without running the action.
 *
 * <p>This happens in two situations:
 * <ol>
 *   <li>the circuit is {@link CircuitState#OPEN} and the break duration has not elapsed;</li>
 *   <li>the circuit is {@link CircuitState#HALF_OPEN} and another call already holds the trial.</li>
 * </ol>
 * It is not a failure of the action, which is why retry policies refuse to retry it.
 */
public class CircuitOpenException extends ResilienceException {

    private final String circuit;
    private final CircuitState state;
    private final Duration retryAfter;

    public CircuitOpenException(String circuit, CircuitState state, Duration retryAfter) {
        super("Circuit [" + circuit + "] is " + state + "; call rejected");
        this.circuit = circuit;
        this.state = state;
        this.retryAfter = retryAfter;
    }

    /**
     * The name of the rejecting circuit breaker.
     */
    public String circuit() {
        return circuit;
    }

    /**
     * The state that caused the rejection: OPEN or HALF_OPEN.
     */
    public CircuitState state() {
        return state;
    }

    /**
     * Time left before the breaker admits a trial; zero when rejected by a half-open breaker.
     */
    public Duration retryAfter() {
        return retryAfter;
    }
}
