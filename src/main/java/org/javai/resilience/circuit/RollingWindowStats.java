package org.javai.resilience.circuit;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Counts successes and failures over a sliding time window of fixed length.
 *
 * <p>The window is split into buckets so that old outcomes expire in steps instead of all at
 * once: ten buckets, or one when the sampling duration is too short to split usefully.
 * A bucket is dropped once its start is a full sampling duration in the past.
 *
 * <p>Not thread-safe. {@link CircuitBreaker} owns each instance and only touches it while
 * holding its own lock.
 */
final class RollingWindowStats {

    static final int DEFAULT_BUCKETS = 10;
    static final Duration MIN_SPLIT_DURATION = Duration.ofMillis(200);

    private final long samplingMillis;
    private final long bucketMillis;
    private final Deque<Bucket> buckets = new ArrayDeque<>();

    RollingWindowStats(Duration samplingDuration) {
        Objects.requireNonNull(samplingDuration, "samplingDuration must not be null");
        if (samplingDuration.isZero() || samplingDuration.isNegative()) {
            throw new IllegalArgumentException("samplingDuration must be positive");
        }
        this.samplingMillis = Math.max(1, samplingDuration.toMillis());
        int bucketCount = samplingDuration.compareTo(MIN_SPLIT_DURATION) < 0 ? 1 : DEFAULT_BUCKETS;
        this.bucketMillis = Math.max(1, samplingMillis / bucketCount);
    }

    void recordSuccess(long nowMillis) {
        currentBucket(nowMillis).successes++;
    }

    void recordFailure(long nowMillis) {
        currentBucket(nowMillis).failures++;
    }

    HealthSnapshot snapshot(long nowMillis) {
        expire(nowMillis);
        long successes = 0;
        long failures = 0;
        for (Bucket bucket : buckets) {
            successes += bucket.successes;
            failures += bucket.failures;
        }
        return new HealthSnapshot(successes, failures);
    }

    void reset() {
        buckets.clear();
    }

    int bucketCount() {
        return buckets.size();
    }

    private Bucket currentBucket(long nowMillis) {
        expire(nowMillis);
        Bucket last = buckets.peekLast();
        if (last == null || nowMillis - last.startedAt >= bucketMillis) {
            last = new Bucket(nowMillis);
            buckets.addLast(last);
        }
        return last;
    }

    private void expire(long nowMillis) {
        while (!buckets.isEmpty() && nowMillis - buckets.peekFirst().startedAt >= samplingMillis) {
            buckets.removeFirst();
        }
    }

    private static final class Bucket {
        final long startedAt;
        long successes;
        long failures;

        Bucket(long startedAt) {
            this.startedAt = startedAt;
        }
    }
}
