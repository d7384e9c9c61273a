package org.javai.resilience;

import java.time.Instant;
import java.util.Objects;

/**
 * A classified failure handed to listeners for diagnostics.
 *
 * <p>Failures never drive control flow; the exception itself is what the policies propagate.
 * This record only adds the classification and context a listener needs to report it.
 *
 * @param code The failure identifier (namespace:name)
 * @param message Human-readable description
 * @param type The pipeline layer that produced the failure
 * @param exception The underlying exception (may be null)
 * @param operation The policy that observed the failure (e.g., "orders-api")
 * @param occurredAt When the failure was observed
 */
public record Failure(
        FailureCode code,
        String message,
        FailureType type,
        Throwable exception,
        String operation,
        Instant occurredAt
) {

    public Failure {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
    }

    /**
     * Creates a failure observed now.
     */
    public static Failure of(FailureCode code, String message, FailureType type, String operation, Throwable exception) {
        return new Failure(code, message, type, exception, operation, Instant.now());
    }

    /**
     * Returns the simple class name of the underlying exception, or "none".
     */
    public String exceptionType() {
        return exception != null ? typeName(exception.getClass()) : "none";
    }

    /**
     * Returns the simple name of a type. Anonymous and hidden classes have no usable simple
     * name, so the nearest named superclass is used instead.
     */
    public static String typeName(Class<?> type) {
        Objects.requireNonNull(type, "type must not be null");
        for (Class<?> c = type; c != null; c = c.getSuperclass()) {
            String simple = c.getSimpleName();
            if (!simple.isBlank()) {
                return simple;
            }
        }
        return type.getName();
    }
}
