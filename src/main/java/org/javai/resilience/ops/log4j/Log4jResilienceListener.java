package org.javai.resilience.ops.log4j;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.resilience.Failure;
import org.javai.resilience.ops.ResilienceListener;

import java.time.Duration;

/**
 * Logs resilience events using Log4j2, one marker per event kind.
 *
 * <p>Levels follow how much attention an event deserves:
 * <ul>
 *   <li>{@code onRetry}, {@code onHalfOpen}, {@code onReset} → INFO</li>
 *   <li>{@code onRetryExhausted}, {@code onFallback} → WARN</li>
 *   <li>{@code onBreak} → ERROR</li>
 * </ul>
 */
public class Log4jResilienceListener implements ResilienceListener {

	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	static final Marker BREAK_MARKER = MarkerManager.getMarker("CIRCUIT_BREAK");
	static final Marker RESET_MARKER = MarkerManager.getMarker("CIRCUIT_RESET");
	static final Marker HALF_OPEN_MARKER = MarkerManager.getMarker("CIRCUIT_HALF_OPEN");
	static final Marker FALLBACK_MARKER = MarkerManager.getMarker("FALLBACK");

	private final Logger logger;

	/**
	 * Creates a Log4jResilienceListener using the default logger name.
	 */
	public Log4jResilienceListener() {
		this(LogManager.getLogger("org.javai.resilience.Events"));
	}

	/**
	 * Creates a Log4jResilienceListener with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jResilienceListener(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jResilienceListener with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jResilienceListener(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void onRetry(Failure failure, Duration delay, int retryNumber) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retrying [{}]: retry {} in {} ms after {}",
				failure.operation(),
				retryNumber,
				delay.toMillis(),
				failure.code());
	}

	@Override
	public void onRetryExhausted(Failure failure, int totalAttempts) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Retry exhausted for [{}] after {} attempts. Code: {}, Message: {}",
				failure.operation(),
				totalAttempts,
				failure.code(),
				failure.message());
	}

	@Override
	public void onBreak(Failure failure, Duration breakDuration) {
		logger.atError()
			.withMarker(BREAK_MARKER)
			.log("Circuit breaker break: waiting {}... Code: {}, Message: {}",
				breakDuration,
				failure.code(),
				failure.message());
	}

	@Override
	public void onReset() {
		logger.atInfo()
			.withMarker(RESET_MARKER)
			.log("Circuit breaker has reset!");
	}

	@Override
	public void onHalfOpen() {
		logger.atInfo()
			.withMarker(HALF_OPEN_MARKER)
			.log("Circuit breaker half-open");
	}

	@Override
	public void onFallback(Failure failure) {
		logger.atWarn()
			.withMarker(FALLBACK_MARKER)
			.log("Fallback for [{}] | code={}, type={}, exception={}",
				failure.operation(),
				failure.code(),
				failure.type(),
				failure.exceptionType());
	}
}
