package org.javai.resilience.ops;

import org.javai.resilience.Failure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * A {@link ResilienceListener} that delegates to multiple listeners.
 *
 * <p>All configured listeners receive every call. If a listener throws, the exception is
 * logged and the remaining listeners still run. Policies wrap whatever listener they are
 * given in a composite, so a misbehaving listener never reaches the protected call path.
 *
 * <p>Example usage:
 * <pre>{@code
 * ResilienceListener listener = CompositeResilienceListener.of(
 *     new Log4jResilienceListener(),
 *     new MetricsResilienceListener("myapp")
 * );
 *
 * // Or using the builder for more control:
 * ResilienceListener listener = CompositeResilienceListener.builder()
 *     .add(new Log4jResilienceListener())
 *     .addIf(metricsEnabled, new MetricsResilienceListener())
 *     .build();
 * }</pre>
 */
public final class CompositeResilienceListener implements ResilienceListener {

	private static final Logger LOG = LoggerFactory.getLogger(CompositeResilienceListener.class);

	private final List<ResilienceListener> listeners;

	private CompositeResilienceListener(List<ResilienceListener> listeners) {
		this.listeners = List.copyOf(listeners);
	}

	/**
	 * Creates a composite listener from the given listeners.
	 *
	 * @param listeners the listeners to delegate to
	 * @return a composite that fans out to all given listeners
	 */
	public static CompositeResilienceListener of(ResilienceListener... listeners) {
		return builder().addAll(Arrays.asList(listeners)).build();
	}

	/**
	 * Creates a composite listener from a collection of listeners.
	 *
	 * @param listeners the listeners to delegate to
	 * @return a composite that fans out to all given listeners
	 */
	public static CompositeResilienceListener of(Collection<? extends ResilienceListener> listeners) {
		return builder().addAll(listeners).build();
	}

	/**
	 * Wraps a single listener so that its exceptions are contained.
	 * Returns the listener itself if it is already a composite.
	 */
	public static CompositeResilienceListener guarding(ResilienceListener listener) {
		if (listener instanceof CompositeResilienceListener composite) {
			return composite;
		}
		return of(listener);
	}

	/**
	 * Creates a builder for constructing a composite listener.
	 *
	 * @return a new builder
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void onRetry(Failure failure, Duration delay, int retryNumber) {
		dispatch("onRetry", l -> l.onRetry(failure, delay, retryNumber));
	}

	@Override
	public void onRetryExhausted(Failure failure, int totalAttempts) {
		dispatch("onRetryExhausted", l -> l.onRetryExhausted(failure, totalAttempts));
	}

	@Override
	public void onBreak(Failure failure, Duration breakDuration) {
		dispatch("onBreak", l -> l.onBreak(failure, breakDuration));
	}

	@Override
	public void onReset() {
		dispatch("onReset", ResilienceListener::onReset);
	}

	@Override
	public void onHalfOpen() {
		dispatch("onHalfOpen", ResilienceListener::onHalfOpen);
	}

	@Override
	public void onFallback(Failure failure) {
		dispatch("onFallback", l -> l.onFallback(failure));
	}

	/**
	 * Returns the number of listeners in this composite.
	 */
	public int size() {
		return listeners.size();
	}

	private void dispatch(String method, Consumer<ResilienceListener> call) {
		for (ResilienceListener listener : listeners) {
			try {
				call.accept(listener);
			} catch (RuntimeException e) {
				LOG.warn("ResilienceListener.{} failed for {}", method, listener.getClass().getName(), e);
			}
		}
	}

	/**
	 * Builder for creating a {@link CompositeResilienceListener}.
	 */
	public static final class Builder {
		private final List<ResilienceListener> listeners = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a listener to the composite. Nested composites are flattened.
		 *
		 * @param listener the listener to add
		 * @return this builder
		 */
		public Builder add(ResilienceListener listener) {
			if (listener instanceof CompositeResilienceListener composite) {
				listeners.addAll(composite.listeners);
			} else if (listener != null) {
				listeners.add(listener);
			}
			return this;
		}

		/**
		 * Adds multiple listeners to the composite.
		 *
		 * @param listeners the listeners to add
		 * @return this builder
		 */
		public Builder addAll(Collection<? extends ResilienceListener> listeners) {
			for (ResilienceListener listener : listeners) {
				add(listener);
			}
			return this;
		}

		/**
		 * Conditionally adds a listener based on a flag.
		 *
		 * @param condition if true, the listener is added
		 * @param listener the listener to add
		 * @return this builder
		 */
		public Builder addIf(boolean condition, ResilienceListener listener) {
			if (condition) {
				add(listener);
			}
			return this;
		}

		/**
		 * Builds the composite listener.
		 *
		 * @return the composite listener
		 */
		public CompositeResilienceListener build() {
			return new CompositeResilienceListener(listeners);
		}
	}
}
