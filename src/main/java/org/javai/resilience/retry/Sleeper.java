package org.javai.resilience.retry;

import java.time.Duration;

/**
 * Suspends the calling thread between retries. Injectable so tests do not really wait.
 */
@FunctionalInterface
interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> {
            long millis;
            try {
                millis = duration.toMillis();
            } catch (ArithmeticException overflow) {
                millis = Long.MAX_VALUE;
            }
            Thread.sleep(millis);
        };
    }
}
