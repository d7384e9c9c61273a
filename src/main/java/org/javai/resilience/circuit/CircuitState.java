package org.javai.resilience.circuit;

/**
 * The states of a {@link CircuitBreaker}.
 *
 * <pre>
 *     CLOSED ──(throughput &amp;&amp; failure ratio reached)──&gt; OPEN
 *        ^                                                 │
 *        │                                      (break duration elapsed,
 *   (trial succeeds)                               next call claims trial)
 *        │                                                 │
 *        └───────────────── HALF_OPEN &lt;────────────────────┘
 *                               │
 *                        (trial fails) ──&gt; OPEN
 * </pre>
 */
public enum CircuitState {
    /**
     * Normal operation. Calls pass through and their outcomes feed the rolling statistics.
     */
    CLOSED,

    /**
     * Broken. Calls are rejected with {@link CircuitOpenException} without running the action.
     */
    OPEN,

    /**
     * Testing recovery. A single trial call is in flight; concurrent calls are rejected.
     */
    HALF_OPEN
}
