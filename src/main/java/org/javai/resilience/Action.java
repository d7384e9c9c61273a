package org.javai.resilience;

/**
 * A fallible unit of work protected by the resilience policies.
 *
 * <p>An action either completes normally or throws. It produces no value; only its side
 * effects matter. Actions are cancellation-aware through thread interruption: a cancelled
 * action should stop and throw {@link InterruptedException}.
 */
@FunctionalInterface
public interface Action {

    void run() throws Exception;
}
