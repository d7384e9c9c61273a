package org.javai.resilience.classify;

import org.javai.resilience.Failure;

/**
 * Classifies exceptions observed by a policy into structured failures for listeners.
 * Implementations should be deterministic and must not throw.
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * Classifies an exception into a Failure.
     *
     * @param operation The policy or pipeline that observed the exception
     * @param throwable The exception that occurred
     * @return A classified Failure
     */
    Failure classify(String operation, Throwable throwable);
}
