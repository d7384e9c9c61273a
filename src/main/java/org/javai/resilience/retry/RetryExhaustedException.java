package org.javai.resilience.retry;

import org.javai.resilience.ResilienceException;

/**
 * Thrown by {@link RetryPolicy} when every allowed attempt has failed.
 * The cause is the failure of the last attempt.
 */
public class RetryExhaustedException extends ResilienceException {

    private final String policy;
    private final int attempts;

    public RetryExhaustedException(String policy, int attempts, Throwable lastFailure) {
        super("Retry policy [" + policy + "] exhausted after " + attempts + " attempts: " + lastFailure, lastFailure);
        this.policy = policy;
        this.attempts = attempts;
    }

    /**
     * The retry policy that gave up.
     */
    public String policy() {
        return policy;
    }

    /**
     * Total number of times the action was invoked, including the first attempt.
     */
    public int attempts() {
        return attempts;
    }
}
