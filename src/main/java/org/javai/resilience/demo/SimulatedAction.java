package org.javai.resilience.demo;

import org.javai.resilience.Action;

import java.io.IOException;
import java.util.Objects;
import java.util.Random;
import java.util.function.Consumer;

/**
 * A primary action standing in for a flaky dependency: it fails one call in four.
 */
final class SimulatedAction implements Action {

    static final int FAILURE_ODDS = 4;

    private final Random random;
    private final Consumer<String> log;

    SimulatedAction(Random random, Consumer<String> log) {
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.log = Objects.requireNonNull(log, "log must not be null");
    }

    @Override
    public void run() throws IOException {
        if (random.nextInt(FAILURE_ODDS) == 0) {
            throw new IOException("Ope");
        }
        log.accept("! Primary Action");
    }
}
