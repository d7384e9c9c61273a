package org.javai.resilience.classify;

import org.javai.resilience.Failure;
import org.javai.resilience.FailureCode;
import org.javai.resilience.FailureType;
import org.javai.resilience.circuit.CircuitOpenException;
import org.javai.resilience.retry.RetryExhaustedException;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Default classifier for the exceptions that cross the pipeline.
 *
 * <ul>
 *   <li>{@link CircuitOpenException} → {@code circuit:open}, {@link FailureType#CIRCUIT_OPEN}</li>
 *   <li>{@link RetryExhaustedException} → {@code retry:exhausted}, {@link FailureType#RETRY_EXHAUSTED}</li>
 *   <li>anything else → {@code action:<SimpleName>}, {@link FailureType#ACTION}; anonymous
 *       exception classes take the name of their nearest named superclass</li>
 * </ul>
 */
public class DefaultFailureClassifier implements FailureClassifier {

    private final Clock clock;

    public DefaultFailureClassifier() {
        this(Clock.systemUTC());
    }

    public DefaultFailureClassifier(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Failure classify(String operation, Throwable t) {
        Instant now = clock.instant();

        if (t instanceof CircuitOpenException open) {
            return new Failure(
                    FailureCode.of("circuit", "open"),
                    messageFor("Circuit " + open.state(), t),
                    FailureType.CIRCUIT_OPEN,
                    t,
                    operation,
                    now
            );
        }

        if (t instanceof RetryExhaustedException exhausted) {
            Throwable last = exhausted.getCause();
            String lastType = last != null ? Failure.typeName(last.getClass()) : "unknown";
            return new Failure(
                    FailureCode.of("retry", "exhausted"),
                    "Retries exhausted after " + exhausted.attempts() + " attempts, last failure " + lastType,
                    FailureType.RETRY_EXHAUSTED,
                    t,
                    operation,
                    now
            );
        }

        return new Failure(
                FailureCode.of("action", Failure.typeName(t.getClass())),
                t.getMessage() != null ? t.getMessage() : t.getClass().getName(),
                FailureType.ACTION,
                t,
                operation,
                now
        );
    }

    private static String messageFor(String prefix, Throwable t) {
        return prefix + ": " + t.getMessage();
    }
}
