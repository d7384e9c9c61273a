package org.javai.resilience;

/**
 * Classifies failures by the layer of the pipeline that produced them.
 */
public enum FailureType {
    /**
     * The protected action itself failed.
     * Retryable unless the retry predicate says otherwise.
     */
    ACTION,

    /**
     * The circuit breaker rejected the call without running the action.
     * Never retried.
     */
    CIRCUIT_OPEN,

    /**
     * The retry policy spent every attempt; the last action failure is the cause.
     */
    RETRY_EXHAUSTED
}
