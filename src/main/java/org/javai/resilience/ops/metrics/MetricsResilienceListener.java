package org.javai.resilience.ops.metrics;

import org.javai.resilience.Failure;
import org.javai.resilience.ops.ResilienceListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;

/**
 * Reports resilience events as JSON-lines metrics via SLF4J.
 *
 * <p>Outputs one flat JSON object per event, suitable for metrics aggregation. Failure
 * events are keyed by the failing operation, optionally prefixed with a namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.orders","retryNumber":"1","delayMs":"312","code":"action:IOException"}
 * }</pre>
 */
public class MetricsResilienceListener implements ResilienceListener {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.resilience.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	/**
	 * Creates a MetricsResilienceListener with no namespace and the default logger.
	 */
	public MetricsResilienceListener() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsResilienceListener with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsResilienceListener(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsResilienceListener with explicit configuration.
	 * Package-private for testing.
	 */
	MetricsResilienceListener(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void onRetry(Failure failure, Duration delay, int retryNumber) {
		emit(new JsonLine("retry")
				.field("timestamp", ISO_FORMATTER.format(failure.occurredAt()))
				.field("trackingKey", buildTrackingKey(failure.operation()))
				.field("retryNumber", String.valueOf(retryNumber))
				.field("delayMs", String.valueOf(delay.toMillis()))
				.field("code", failure.code().toString()));
	}

	@Override
	public void onRetryExhausted(Failure failure, int totalAttempts) {
		emit(new JsonLine("retry_exhausted")
				.field("timestamp", ISO_FORMATTER.format(failure.occurredAt()))
				.field("trackingKey", buildTrackingKey(failure.operation()))
				.field("totalAttempts", String.valueOf(totalAttempts))
				.field("code", failure.code().toString()));
	}

	@Override
	public void onBreak(Failure failure, Duration breakDuration) {
		emit(new JsonLine("circuit_break")
				.field("timestamp", ISO_FORMATTER.format(failure.occurredAt()))
				.field("trackingKey", buildTrackingKey(failure.operation()))
				.field("breakMs", String.valueOf(breakDuration.toMillis()))
				.field("code", failure.code().toString()));
	}

	@Override
	public void onReset() {
		emit(new JsonLine("circuit_reset")
				.field("timestamp", ISO_FORMATTER.format(clock.instant())));
	}

	@Override
	public void onHalfOpen() {
		emit(new JsonLine("circuit_half_open")
				.field("timestamp", ISO_FORMATTER.format(clock.instant())));
	}

	@Override
	public void onFallback(Failure failure) {
		emit(new JsonLine("fallback")
				.field("timestamp", ISO_FORMATTER.format(failure.occurredAt()))
				.field("trackingKey", buildTrackingKey(failure.operation()))
				.field("code", failure.code().toString())
				.field("type", failure.type().name())
				.field("message", failure.message()));
	}

	String buildTrackingKey(String operation) {
		if (namespace == null) {
			return operation;
		}
		return namespace + "." + operation;
	}

	private void emit(JsonLine line) {
		try {
			logger.info(line.toString());
		} catch (RuntimeException e) {
			logger.debug("Dropped metrics event", e);
		}
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}

	static String escapeJson(String s) {
		if (s == null) {
			return "";
		}
		return s.replace("\\", "\\\\")
				.replace("\"", "\\\"")
				.replace("\n", "\\n")
				.replace("\r", "\\r")
				.replace("\t", "\\t");
	}

	private static final class JsonLine {
		private final StringBuilder sb = new StringBuilder("{");

		JsonLine(String eventType) {
			sb.append("\"eventType\":\"").append(escapeJson(eventType)).append("\"");
		}

		JsonLine field(String key, String value) {
			sb.append(",\"").append(key).append("\":\"").append(escapeJson(value)).append("\"");
			return this;
		}

		@Override
		public String toString() {
			return sb + "}";
		}
	}
}
