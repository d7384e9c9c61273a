package org.javai.resilience.fallback;

import org.javai.resilience.Action;
import org.javai.resilience.classify.DefaultFailureClassifier;
import org.javai.resilience.classify.FailureClassifier;
import org.javai.resilience.classify.GuardedFailureClassifier;
import org.javai.resilience.ops.CompositeResilienceListener;
import org.javai.resilience.ops.ResilienceListener;

import java.util.Objects;

/**
 * Substitutes a fallback action when the protected call fails.
 *
 * <p>Any {@link Exception} escaping the inner call, including circuit-open rejections and
 * exhausted retries, is classified, reported through {@link ResilienceListener#onFallback},
 * and replaced by a run of the fallback action. The original error is not rethrown.
 *
 * <p>Two things are not absorbed:
 * <ul>
 *   <li>{@link InterruptedException}: the caller cancelled, so the fallback does not run;</li>
 *   <li>a failure of the fallback action itself, which surfaces as
 *       {@link FallbackFailedException}. There is no nested fallback.</li>
 * </ul>
 * {@link Error}s are not caught.
 */
public final class FallbackPolicy {

    private final String name;
    private final Action fallbackAction;
    private final FailureClassifier classifier;
    private final ResilienceListener listener;

    private FallbackPolicy(Builder builder) {
        this.name = builder.name;
        this.fallbackAction = builder.fallbackAction;
        this.classifier = GuardedFailureClassifier.guarding(builder.classifier);
        this.listener = CompositeResilienceListener.guarding(builder.listener);
    }

    /**
     * Creates a builder for configuring a FallbackPolicy.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a policy with the given fallback action and no listener.
     */
    public static FallbackPolicy of(Action fallbackAction) {
        return builder().fallbackAction(fallbackAction).build();
    }

    /**
     * Returns an action that runs {@code inner} under this policy.
     */
    public Action wrap(Action inner) {
        Objects.requireNonNull(inner, "inner must not be null");
        return () -> execute(inner);
    }

    /**
     * Runs the inner action, running the fallback action instead if it fails.
     *
     * @param inner the action to protect
     * @throws FallbackFailedException if the fallback action fails
     * @throws InterruptedException if the calling thread is interrupted
     */
    public void execute(Action inner) throws InterruptedException {
        Objects.requireNonNull(inner, "inner must not be null");

        try {
            inner.run();
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            listener.onFallback(classifier.classify(name, e));
            runFallback(e);
        }
    }

    public String name() {
        return name;
    }

    private void runFallback(Exception original) throws InterruptedException {
        try {
            fallbackAction.run();
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            throw new FallbackFailedException(name, e, original);
        }
    }

    /**
     * Builder for configuring a FallbackPolicy.
     */
    public static final class Builder {
        private String name = "fallback";
        private Action fallbackAction;
        private FailureClassifier classifier = new DefaultFailureClassifier();
        private ResilienceListener listener = ResilienceListener.noOp();

        private Builder() {}

        /**
         * Sets the name used in diagnostics (optional, defaults to "fallback").
         */
        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            return this;
        }

        /**
         * Sets the substitute action (required).
         */
        public Builder fallbackAction(Action fallbackAction) {
            this.fallbackAction = Objects.requireNonNull(fallbackAction, "fallbackAction must not be null");
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
         * Sets the listener for fallback events (optional, defaults to no-op).
         */
        public Builder listener(ResilienceListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener must not be null");
            return this;
        }

        /**
         * Builds the FallbackPolicy instance.
         *
         * @return a configured FallbackPolicy
         * @throws NullPointerException if the fallback action has not been set
         */
        public FallbackPolicy build() {
            Objects.requireNonNull(fallbackAction, "fallbackAction must be set");
            return new FallbackPolicy(this);
        }
    }
}
