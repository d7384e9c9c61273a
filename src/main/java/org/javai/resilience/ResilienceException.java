package org.javai.resilience;

/**
 * Base class for failures raised by the pipeline itself rather than by the protected action.
 *
 * <p>This is an unchecked exception: policies rethrow action failures unchanged, so callers
 * composing policies by hand only need to catch the pipeline's own kinds where they care.
 */
public abstract class ResilienceException extends RuntimeException {

    protected ResilienceException(String message) {
        super(message);
    }

    protected ResilienceException(String message, Throwable cause) {
        super(message, cause);
    }
}
