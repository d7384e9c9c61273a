package org.javai.resilience.classify;

import org.javai.resilience.Failure;
import org.javai.resilience.FailureCode;
import org.javai.resilience.FailureType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Wraps a classifier so that a failing classification never changes a policy's control flow.
 *
 * <p>If the delegate throws, the failure is logged at WARN and an {@code action:unclassified}
 * failure carrying the original exception is returned instead.
 */
public final class GuardedFailureClassifier implements FailureClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(GuardedFailureClassifier.class);

    private final FailureClassifier delegate;

    private GuardedFailureClassifier(FailureClassifier delegate) {
        this.delegate = delegate;
    }

    /**
     * Wraps a classifier. Returns the classifier itself if it is already guarded.
     */
    public static GuardedFailureClassifier guarding(FailureClassifier classifier) {
        Objects.requireNonNull(classifier, "classifier must not be null");
        if (classifier instanceof GuardedFailureClassifier guarded) {
            return guarded;
        }
        return new GuardedFailureClassifier(classifier);
    }

    @Override
    public Failure classify(String operation, Throwable throwable) {
        try {
            return delegate.classify(operation, throwable);
        } catch (RuntimeException e) {
            LOG.warn("FailureClassifier {} failed for {}", delegate.getClass().getName(),
                    throwable == null ? "null" : throwable.getClass().getName(), e);
            return unclassified(operation, throwable);
        }
    }

    private static Failure unclassified(String operation, Throwable throwable) {
        String message = throwable == null ? "unknown failure"
                : throwable.getMessage() != null ? throwable.getMessage()
                : throwable.getClass().getName();
        return Failure.of(
                FailureCode.of("action", "unclassified"),
                message,
                FailureType.ACTION,
                operation != null ? operation : "unknown",
                throwable);
    }
}
