package org.javai.resilience.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Objects;
import java.util.Set;

/**
 * Everything needed to build a {@code PolicyPipeline}, validated on construction.
 *
 * <p>Configuration can be created in code or loaded from JSON:</p>
 * <pre>{@code
 * {
 *   "maxRetryCount": 3,
 *   "baseDelay": "PT0.1S",
 *   "jitterMax": 300,
 *   "failureThreshold": 0.25,
 *   "samplingDuration": "PT30S",
 *   "breakDuration": "PT10S",
 *   "minimumThroughput": 64
 * }
 * }</pre>
 * Durations are ISO-8601 strings or integer milliseconds. Missing keys take their
 * {@link #defaults() default} values; unknown keys are rejected.
 *
 * @param maxRetryCount retries after the first attempt (&gt;= 0)
 * @param baseDelay backoff base, doubled on every retry (&gt;= 0)
 * @param jitterMax upper bound (exclusive) of the random jitter added to each backoff (&gt;= 0)
 * @param failureThreshold failure ratio that opens the breaker (&gt; 0 and &lt;= 1)
 * @param samplingDuration length of the breaker's rolling window (&gt; 0)
 * @param breakDuration how long an open breaker rejects calls (&gt;= 0)
 * @param minimumThroughput calls the window must hold before the breaker may open (&gt;= 1)
 */
public record ResilienceConfig(
        int maxRetryCount,
        Duration baseDelay,
        Duration jitterMax,
        double failureThreshold,
        Duration samplingDuration,
        Duration breakDuration,
        int minimumThroughput
) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Set<String> KNOWN_KEYS = Set.of(
            "maxRetryCount", "baseDelay", "jitterMax", "failureThreshold",
            "samplingDuration", "breakDuration", "minimumThroughput");

    public ResilienceConfig {
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(jitterMax, "jitterMax must not be null");
        Objects.requireNonNull(samplingDuration, "samplingDuration must not be null");
        Objects.requireNonNull(breakDuration, "breakDuration must not be null");
        if (maxRetryCount < 0) {
            throw new IllegalArgumentException("maxRetryCount must be >= 0, was: " + maxRetryCount);
        }
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        if (jitterMax.isNegative()) {
            throw new IllegalArgumentException("jitterMax must not be negative");
        }
        if (!(failureThreshold > 0.0 && failureThreshold <= 1.0)) {
            throw new IllegalArgumentException("failureThreshold must be > 0.0 and <= 1.0, was: " + failureThreshold);
        }
        if (samplingDuration.isZero() || samplingDuration.isNegative()) {
            throw new IllegalArgumentException("samplingDuration must be positive");
        }
        if (breakDuration.isNegative()) {
            throw new IllegalArgumentException("breakDuration must not be negative");
        }
        if (minimumThroughput < 1) {
            throw new IllegalArgumentException("minimumThroughput must be >= 1, was: " + minimumThroughput);
        }
    }

    /**
     * Three retries from 100ms with up to 300ms jitter; the breaker opens at a 25% failure
     * ratio over 30s once 64 calls have been seen, and stays open for 10s.
     */
    public static ResilienceConfig defaults() {
        return new ResilienceConfig(
                3,
                Duration.ofMillis(100),
                Duration.ofMillis(300),
                0.25,
                Duration.ofSeconds(30),
                Duration.ofSeconds(10),
                64
        );
    }

    /**
     * Creates a builder initialised with the {@link #defaults()}.
     */
    public static Builder builder() {
        return new Builder(defaults());
    }

    /**
     * Returns a builder initialised with this configuration.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Reads a configuration from a JSON document.
     *
     * @throws UncheckedIOException if the stream cannot be read or is not JSON
     * @throws IllegalArgumentException if a value is of the wrong type, unknown, or out of range
     */
    public static ResilienceConfig fromJson(InputStream json) {
        Objects.requireNonNull(json, "json must not be null");
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new UncheckedIOException("Unreadable resilience configuration", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Resilience configuration must be a JSON object");
        }
        for (Iterator<String> names = root.fieldNames(); names.hasNext(); ) {
            String key = names.next();
            if (!KNOWN_KEYS.contains(key)) {
                throw new IllegalArgumentException("Unknown configuration key: " + key);
            }
        }

        ResilienceConfig d = defaults();
        return new ResilienceConfig(
                intValue(root, "maxRetryCount", d.maxRetryCount()),
                durationValue(root, "baseDelay", d.baseDelay()),
                durationValue(root, "jitterMax", d.jitterMax()),
                doubleValue(root, "failureThreshold", d.failureThreshold()),
                durationValue(root, "samplingDuration", d.samplingDuration()),
                durationValue(root, "breakDuration", d.breakDuration()),
                intValue(root, "minimumThroughput", d.minimumThroughput())
        );
    }

    /**
     * Reads a configuration from a classpath resource, or returns the defaults if there is none.
     */
    public static ResilienceConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "resource must not be null");
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = ResilienceConfig.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            return in == null ? defaults() : fromJson(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not close " + resource, e);
        }
    }

    private static int intValue(JsonNode root, String key, int fallback) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new IllegalArgumentException(key + " must be an integer, was: " + node);
        }
        return node.intValue();
    }

    private static double doubleValue(JsonNode root, String key, double fallback) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isNumber()) {
            throw new IllegalArgumentException(key + " must be a number, was: " + node);
        }
        return node.doubleValue();
    }

    private static Duration durationValue(JsonNode root, String key, Duration fallback) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isIntegralNumber()) {
            return Duration.ofMillis(node.longValue());
        }
        if (node.isTextual()) {
            try {
                return Duration.parse(node.textValue());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException(key + " is not an ISO-8601 duration: " + node.textValue(), e);
            }
        }
        throw new IllegalArgumentException(key + " must be milliseconds or an ISO-8601 duration, was: " + node);
    }

    /**
     * Builder for deriving a configuration from another one.
     */
    public static final class Builder {
        private int maxRetryCount;
        private Duration baseDelay;
        private Duration jitterMax;
        private double failureThreshold;
        private Duration samplingDuration;
        private Duration breakDuration;
        private int minimumThroughput;

        private Builder(ResilienceConfig from) {
            this.maxRetryCount = from.maxRetryCount;
            this.baseDelay = from.baseDelay;
            this.jitterMax = from.jitterMax;
            this.failureThreshold = from.failureThreshold;
            this.samplingDuration = from.samplingDuration;
            this.breakDuration = from.breakDuration;
            this.minimumThroughput = from.minimumThroughput;
        }

        public Builder maxRetryCount(int maxRetryCount) {
            this.maxRetryCount = maxRetryCount;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder jitterMax(Duration jitterMax) {
            this.jitterMax = jitterMax;
            return this;
        }

        public Builder failureThreshold(double failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder samplingDuration(Duration samplingDuration) {
            this.samplingDuration = samplingDuration;
            return this;
        }

        public Builder breakDuration(Duration breakDuration) {
            this.breakDuration = breakDuration;
            return this;
        }

        public Builder minimumThroughput(int minimumThroughput) {
            this.minimumThroughput = minimumThroughput;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is out of range
         */
        public ResilienceConfig build() {
            return new ResilienceConfig(maxRetryCount, baseDelay, jitterMax, failureThreshold,
                    samplingDuration, breakDuration, minimumThroughput);
        }
    }
}
