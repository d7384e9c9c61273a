package org.javai.resilience.demo;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Measures time since the demo started and formats it as {@code [MMm:SSs:mmmms]}.
 */
final class Stopwatch {

    private final LongSupplier nanoTime;
    private final long startedAt;

    private Stopwatch(LongSupplier nanoTime) {
        this.nanoTime = nanoTime;
        this.startedAt = nanoTime.getAsLong();
    }

    static Stopwatch start() {
        return new Stopwatch(System::nanoTime);
    }

    static Stopwatch start(LongSupplier nanoTime) {
        return new Stopwatch(nanoTime);
    }

    Duration elapsed() {
        return Duration.ofNanos(nanoTime.getAsLong() - startedAt);
    }

    String stamp(String message) {
        return "[" + format(elapsed()) + "]: " + message;
    }

    static String format(Duration elapsed) {
        return String.format("%02dm:%02ds:%03dms",
                elapsed.toMinutesPart(),
                elapsed.toSecondsPart(),
                elapsed.toMillisPart());
    }
}
