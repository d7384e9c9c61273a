package org.javai.resilience.fallback;

import org.javai.resilience.ResilienceException;

/**
 * Thrown when the fallback action itself fails.
 *
 * <p>This is the only failure the pipeline does not absorb. The cause is the fallback
 * action's error; the failure the fallback was standing in for is attached as suppressed.
 */
public class FallbackFailedException extends ResilienceException {

    public FallbackFailedException(String policy, Throwable fallbackFailure, Throwable originalFailure) {
        super("Fallback [" + policy + "] failed: " + fallbackFailure, fallbackFailure);
        if (originalFailure != null) {
            addSuppressed(originalFailure);
        }
    }

    /**
     * The failure that triggered the fallback, or null if none was recorded.
     */
    public Throwable originalFailure() {
        Throwable[] suppressed = getSuppressed();
        return suppressed.length > 0 ? suppressed[0] : null;
    }
}
