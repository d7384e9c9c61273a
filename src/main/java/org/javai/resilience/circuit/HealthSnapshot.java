package org.javai.resilience.circuit;

/**
 * Success and failure counts within a breaker's sampling window at one instant.
 *
 * @param successes calls that completed normally
 * @param failures calls that failed
 */
public record HealthSnapshot(long successes, long failures) {

    public static final HealthSnapshot EMPTY = new HealthSnapshot(0, 0);

    public HealthSnapshot {
        if (successes < 0 || failures < 0) {
            throw new IllegalArgumentException("counts must be >= 0");
        }
    }

    /**
     * Total calls observed in the window.
     */
    public long throughput() {
        return successes + failures;
    }

    /**
     * Fraction of calls that failed, or 0.0 when the window is empty.
     */
    public double failureRatio() {
        long total = throughput();
        return total == 0 ? 0.0 : (double) failures / total;
    }
}
