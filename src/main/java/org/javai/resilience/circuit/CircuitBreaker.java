package org.javai.resilience.circuit;

import org.javai.resilience.Action;
import org.javai.resilience.classify.DefaultFailureClassifier;
import org.javai.resilience.classify.FailureClassifier;
import org.javai.resilience.classify.GuardedFailureClassifier;
import org.javai.resilience.ops.CompositeResilienceListener;
import org.javai.resilience.ops.ResilienceListener;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Stops calling an action that keeps failing, and lets a single trial call through after a cooldown.
 *
 * <h2>State machine</h2>
 * <ul>
 *   <li><b>CLOSED</b> (initial): calls run and their outcomes are recorded in a rolling window
 *       of {@code samplingDuration}. When the window holds at least {@code minimumThroughput}
 *       calls and the failure ratio is at least {@code failureThreshold}, the breaker opens.</li>
 *   <li><b>OPEN</b>: calls are rejected with {@link CircuitOpenException} without running the
 *       action. Once {@code breakDuration} has elapsed, the next call moves the breaker to
 *       HALF_OPEN and runs as the trial.</li>
 *   <li><b>HALF_OPEN</b>: exactly one trial is in flight; every other call is rejected. A
 *       successful trial closes the breaker and clears the window; a failed trial opens it
 *       again and restarts the break timer.</li>
 * </ul>
 *
 * <h2>Thread safety</h2>
 * State, window, open timestamp and the trial flag form one unit guarded by a single lock.
 * Every read-check-write of that unit happens inside the lock, so two callers can never both
 * claim the trial. The action itself and all listener callbacks run outside the lock.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * CircuitBreaker breaker = CircuitBreaker.builder()
 *     .name("orders-api")
 *     .failureThreshold(0.25)
 *     .samplingDuration(Duration.ofSeconds(30))
 *     .breakDuration(Duration.ofSeconds(10))
 *     .minimumThroughput(64)
 *     .build();
 *
 * try {
 *     breaker.execute(() -> ordersApi.submit(order));
 * } catch (CircuitOpenException e) {
 *     // not attempted; the dependency is being given time to recover
 * }
 * }</pre>
 */
public final class CircuitBreaker {

    private final String name;
    private final double failureThreshold;
    private final Duration breakDuration;
    private final int minimumThroughput;
    private final Predicate<Throwable> recordAsFailure;
    private final FailureClassifier classifier;
    private final ResilienceListener listener;
    private final Clock clock;

    private final Object lock = new Object();
    // Guarded by lock.
    private final RollingWindowStats stats;
    private CircuitState state = CircuitState.CLOSED;
    private Instant openedAt;
    private boolean trialInFlight;

    private CircuitBreaker(Builder builder) {
        this.name = builder.name;
        this.failureThreshold = builder.failureThreshold;
        this.breakDuration = builder.breakDuration;
        this.minimumThroughput = builder.minimumThroughput;
        this.recordAsFailure = builder.recordAsFailure;
        this.classifier = GuardedFailureClassifier.guarding(builder.classifier);
        this.listener = CompositeResilienceListener.guarding(builder.listener);
        this.clock = builder.clock;
        this.stats = new RollingWindowStats(builder.samplingDuration);
    }

    /**
     * Creates a builder for configuring a CircuitBreaker.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns an action that runs {@code inner} through this breaker.
     */
    public Action wrap(Action inner) {
        Objects.requireNonNull(inner, "inner must not be null");
        return () -> execute(inner);
    }

    /**
     * Runs the action if the breaker admits it, recording the outcome exactly once.
     *
     * @param action the action to run
     * @throws CircuitOpenException if the breaker rejects the call
     * @throws Exception whatever the action throws, unchanged
     */
    public void execute(Action action) throws Exception {
        Objects.requireNonNull(action, "action must not be null");

        Permit permit = acquirePermit();
        try {
            action.run();
        } catch (Throwable t) {
            if (recordAsFailure.test(t)) {
                onFailure(permit, t);
            } else {
                onIgnored(permit);
            }
            throw t;
        }
        onSuccess(permit);
    }

    /**
     * Returns the current state. An expired OPEN state is reported as OPEN until a call
     * actually claims the half-open trial.
     */
    public CircuitState state() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * Returns the outcomes currently inside the sampling window.
     */
    public HealthSnapshot healthSnapshot() {
        synchronized (lock) {
            return stats.snapshot(clock.millis());
        }
    }

    public String name() {
        return name;
    }

    public Duration breakDuration() {
        return breakDuration;
    }

    private Permit acquirePermit() {
        boolean halfOpened = false;
        synchronized (lock) {
            switch (state) {
                case CLOSED:
                    return Permit.NORMAL;
                case OPEN:
                    Instant now = clock.instant();
                    Instant trialAt = openedAt.plus(breakDuration);
                    if (now.isBefore(trialAt)) {
                        throw new CircuitOpenException(name, CircuitState.OPEN, Duration.between(now, trialAt));
                    }
                    state = CircuitState.HALF_OPEN;
                    trialInFlight = true;
                    halfOpened = true;
                    break;
                case HALF_OPEN:
                    if (trialInFlight) {
                        throw new CircuitOpenException(name, CircuitState.HALF_OPEN, Duration.ZERO);
                    }
                    trialInFlight = true;
                    break;
                default:
                    throw new IllegalStateException("Unknown state: " + state);
            }
        }
        if (halfOpened) {
            try {
                listener.onHalfOpen();
            } catch (Throwable t) {
                // The trial call never runs, so its slot must not stay claimed.
                onIgnored(Permit.TRIAL);
                throw t;
            }
        }
        return Permit.TRIAL;
    }

    private void onSuccess(Permit permit) {
        boolean reset = false;
        synchronized (lock) {
            if (permit == Permit.TRIAL) {
                if (state == CircuitState.HALF_OPEN) {
                    state = CircuitState.CLOSED;
                    openedAt = null;
                    trialInFlight = false;
                    stats.reset();
                    reset = true;
                }
            } else if (state == CircuitState.CLOSED) {
                stats.recordSuccess(clock.millis());
            }
        }
        if (reset) {
            listener.onReset();
        }
    }

    private void onFailure(Permit permit, Throwable t) {
        boolean broke = false;
        synchronized (lock) {
            if (permit == Permit.TRIAL) {
                if (state == CircuitState.HALF_OPEN) {
                    open();
                    broke = true;
                }
            } else if (state == CircuitState.CLOSED) {
                long now = clock.millis();
                stats.recordFailure(now);
                HealthSnapshot health = stats.snapshot(now);
                if (health.throughput() >= minimumThroughput && health.failureRatio() >= failureThreshold) {
                    open();
                    broke = true;
                }
            }
        }
        if (broke) {
            listener.onBreak(classifier.classify(name, t), breakDuration);
        }
    }

    private void onIgnored(Permit permit) {
        if (permit == Permit.TRIAL) {
            synchronized (lock) {
                if (state == CircuitState.HALF_OPEN) {
                    trialInFlight = false;
                }
            }
        }
    }

    // Caller holds lock.
    private void open() {
        state = CircuitState.OPEN;
        openedAt = clock.instant();
        trialInFlight = false;
    }

    private enum Permit {
        NORMAL,
        TRIAL
    }

    /**
     * Builder for configuring a CircuitBreaker. Defaults match {@code ResilienceConfig.defaults()}.
     */
    public static final class Builder {
        private String name = "circuit";
        private double failureThreshold = 0.25;
        private Duration samplingDuration = Duration.ofSeconds(30);
        private Duration breakDuration = Duration.ofSeconds(10);
        private int minimumThroughput = 64;
        private Predicate<Throwable> recordAsFailure = t -> true;
        private FailureClassifier classifier = new DefaultFailureClassifier();
        private ResilienceListener listener = ResilienceListener.noOp();
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        /**
         * Sets the name used in diagnostics and rejections (optional, defaults to "circuit").
         */
        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            return this;
        }

        /**
         * Sets the failure ratio at or above which the breaker opens.
         *
         * @throws IllegalArgumentException unless {@code 0 < failureThreshold <= 1}
         */
        public Builder failureThreshold(double failureThreshold) {
            if (!(failureThreshold > 0.0 && failureThreshold <= 1.0)) {
                throw new IllegalArgumentException("failureThreshold must be > 0.0 and <= 1.0, was: " + failureThreshold);
            }
            this.failureThreshold = failureThreshold;
            return this;
        }

        /**
         * Sets the length of the rolling window over which outcomes are counted.
         */
        public Builder samplingDuration(Duration samplingDuration) {
            Objects.requireNonNull(samplingDuration, "samplingDuration must not be null");
            if (samplingDuration.isZero() || samplingDuration.isNegative()) {
                throw new IllegalArgumentException("samplingDuration must be positive");
            }
            this.samplingDuration = samplingDuration;
            return this;
        }

        /**
         * Sets how long the breaker stays open before admitting a trial.
         */
        public Builder breakDuration(Duration breakDuration) {
            Objects.requireNonNull(breakDuration, "breakDuration must not be null");
            if (breakDuration.isNegative()) {
                throw new IllegalArgumentException("breakDuration must not be negative");
            }
            this.breakDuration = breakDuration;
            return this;
        }

        /**
         * Sets the number of calls the window must hold before the breaker may open.
         *
         * @throws IllegalArgumentException if less than 1
         */
        public Builder minimumThroughput(int minimumThroughput) {
            if (minimumThroughput < 1) {
                throw new IllegalArgumentException("minimumThroughput must be >= 1, was: " + minimumThroughput);
            }
            this.minimumThroughput = minimumThroughput;
            return this;
        }

        /**
         * Sets which errors count as failures (optional, defaults to all). Errors that do not
         * count are rethrown without touching the statistics.
         */
        public Builder recordAsFailure(Predicate<Throwable> recordAsFailure) {
            this.recordAsFailure = Objects.requireNonNull(recordAsFailure, "recordAsFailure must not be null");
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
         * Sets the listener for state transitions (optional, defaults to no-op).
         */
        public Builder listener(ResilienceListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener must not be null");
            return this;
        }

        /**
         * Sets the clock (optional, defaults to the system UTC clock).
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Builds the CircuitBreaker instance.
         *
         * @return a configured CircuitBreaker
         */
        public CircuitBreaker build() {
            return new CircuitBreaker(this);
        }
    }
}
