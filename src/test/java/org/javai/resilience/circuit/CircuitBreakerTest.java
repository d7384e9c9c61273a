package org.javai.resilience.circuit;

import org.javai.resilience.Failure;
import org.javai.resilience.ops.ResilienceListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class CircuitBreakerTest {

    private static final Duration BREAK = Duration.ofSeconds(10);

    private MutableClock clock;
    private List<String> events;
    private List<Failure> breakFailures;
    private ResilienceListener listener;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-20T10:30:00Z"));
        events = new ArrayList<>();
        breakFailures = new ArrayList<>();
        listener = new ResilienceListener() {
            @Override
            public void onBreak(Failure failure, Duration breakDuration) {
                events.add("break " + breakDuration.toSeconds() + "s");
                breakFailures.add(failure);
            }

            @Override
            public void onReset() {
                events.add("reset");
            }

            @Override
            public void onHalfOpen() {
                events.add("half-open");
            }
        };
    }

    private CircuitBreaker.Builder breaker() {
        return CircuitBreaker.builder()
                .name("orders")
                .failureThreshold(0.5)
                .samplingDuration(Duration.ofSeconds(30))
                .breakDuration(BREAK)
                .minimumThroughput(4)
                .listener(listener)
                .clock(clock);
    }

    private static void succeed(CircuitBreaker breaker) throws Exception {
        breaker.execute(() -> {});
    }

    private static void fail(CircuitBreaker breaker) {
        assertThatThrownBy(() -> breaker.execute(() -> {
            throw new IOException("Ope");
        })).isInstanceOf(IOException.class);
    }

    private void trip(CircuitBreaker breaker) {
        for (int i = 0; i < 4; i++) {
            fail(breaker);
        }
        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
    }

    /**
     * A call admitted while the breaker is closed that completes only when released.
     */
    private static final class LateCall {
        private final CountDownLatch admitted = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private final AtomicReference<Throwable> thrown = new AtomicReference<>();
        private final Thread thread;

        LateCall(CircuitBreaker breaker, boolean fails) {
            thread = new Thread(() -> {
                try {
                    breaker.execute(() -> {
                        admitted.countDown();
                        release.await(5, TimeUnit.SECONDS);
                        if (fails) {
                            throw new IOException("late");
                        }
                    });
                } catch (Exception e) {
                    thrown.set(e);
                }
            });
        }

        LateCall start() throws InterruptedException {
            thread.start();
            assertThat(admitted.await(5, TimeUnit.SECONDS)).isTrue();
            return this;
        }

        void finish() throws InterruptedException {
            release.countDown();
            thread.join(5_000);
            assertThat(thread.isAlive()).isFalse();
        }
    }

    @Test
    void newBreaker_isClosedAndEmpty() {
        CircuitBreaker breaker = breaker().build();

        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.healthSnapshot()).isEqualTo(HealthSnapshot.EMPTY);
    }

    @Test
    void execute_success_recordedAndReturned() throws Exception {
        CircuitBreaker breaker = breaker().build();
        AtomicInteger calls = new AtomicInteger();

        breaker.execute(calls::incrementAndGet);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(breaker.healthSnapshot().successes()).isEqualTo(1);
    }

    @Test
    void execute_failure_rethrownUnchanged() {
        CircuitBreaker breaker = breaker().build();
        IOException ope = new IOException("Ope");

        assertThatThrownBy(() -> breaker.execute(() -> {
            throw ope;
        })).isSameAs(ope);

        assertThat(breaker.healthSnapshot().failures()).isEqualTo(1);
    }

    @Test
    void opens_whenRatioReachedWithEnoughThroughput() throws Exception {
        CircuitBreaker breaker = breaker().build();

        succeed(breaker);
        succeed(breaker);
        fail(breaker);
        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);

        fail(breaker);

        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
        assertThat(events).containsExactly("break 10s");
        assertThat(breakFailures.get(0).code().toString()).isEqualTo("action:IOException");
        assertThat(breakFailures.get(0).operation()).isEqualTo("orders");
    }

    @Test
    void staysClosed_belowMinimumThroughput() {
        CircuitBreaker breaker = breaker().minimumThroughput(10).build();

        for (int i = 0; i < 9; i++) {
            fail(breaker);
        }

        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.healthSnapshot().failureRatio()).isEqualTo(1.0);
        assertThat(events).isEmpty();
    }

    @Test
    void staysClosed_belowFailureThreshold() throws Exception {
        CircuitBreaker breaker = breaker().build();

        succeed(breaker);
        succeed(breaker);
        succeed(breaker);
        fail(breaker);

        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void outcomesOutsideSamplingWindow_doNotCount() throws Exception {
        CircuitBreaker breaker = breaker().build();

        fail(breaker);
        fail(breaker);
        fail(breaker);
        clock.advance(Duration.ofSeconds(31));
        fail(breaker);

        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.healthSnapshot().throughput()).isEqualTo(1);
    }

    @Test
    void open_rejectsWithoutRunningAction() {
        CircuitBreaker breaker = breaker().build();
        trip(breaker);
        clock.advance(Duration.ofSeconds(4));
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> breaker.execute(calls::incrementAndGet))
                .isInstanceOf(CircuitOpenException.class)
                .satisfies(e -> {
                    CircuitOpenException open = (CircuitOpenException) e;
                    assertThat(open.state()).isEqualTo(CircuitState.OPEN);
                    assertThat(open.circuit()).isEqualTo("orders");
                    assertThat(open.retryAfter()).isEqualTo(Duration.ofSeconds(6));
                });

        assertThat(calls.get()).isZero();
    }

    @Test
    void rejectionsWhileOpen_doNotTouchStatistics() {
        CircuitBreaker breaker = breaker().build();
        trip(breaker);
        HealthSnapshot before = breaker.healthSnapshot();

        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> breaker.execute(() -> {}))
                    .isInstanceOf(CircuitOpenException.class);
        }

        assertThat(breaker.healthSnapshot()).isEqualTo(before);
    }

    @Test
    void lateFailureWhileOpen_isIgnored() throws Exception {
        CircuitBreaker breaker = breaker().build();
        LateCall late = new LateCall(breaker, true).start();
        trip(breaker);
        HealthSnapshot before = breaker.healthSnapshot();

        late.finish();

        assertThat(late.thrown.get()).isInstanceOf(IOException.class);
        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.healthSnapshot()).isEqualTo(before);
        assertThat(events).containsExactly("break 10s");
        clock.advance(Duration.ofSeconds(4));
        assertThatThrownBy(() -> breaker.execute(() -> {}))
                .isInstanceOf(CircuitOpenException.class)
                .satisfies(e -> assertThat(((CircuitOpenException) e).retryAfter())
                        .isEqualTo(Duration.ofSeconds(6)));
    }

    @Test
    void lateSuccessWhileOpen_isIgnored() throws Exception {
        CircuitBreaker breaker = breaker().build();
        LateCall late = new LateCall(breaker, false).start();
        trip(breaker);
        HealthSnapshot before = breaker.healthSnapshot();

        late.finish();

        assertThat(late.thrown.get()).isNull();
        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.healthSnapshot()).isEqualTo(before);
        assertThat(events).containsExactly("break 10s");
    }

    @Test
    void lateFailureWhileHalfOpen_doesNotReopen() throws Exception {
        CircuitBreaker breaker = breaker().build();
        LateCall late = new LateCall(breaker, true).start();
        trip(breaker);
        clock.advance(BREAK);

        breaker.execute(() -> {
            late.finish();
            assertThat(breaker.state()).isEqualTo(CircuitState.HALF_OPEN);
        });

        assertThat(late.thrown.get()).isInstanceOf(IOException.class);
        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.healthSnapshot()).isEqualTo(HealthSnapshot.EMPTY);
        assertThat(events).containsExactly("break 10s", "half-open", "reset");
    }

    @Test
    void lateSuccessWhileHalfOpen_doesNotClose() throws Exception {
        CircuitBreaker breaker = breaker().build();
        LateCall late = new LateCall(breaker, false).start();
        trip(breaker);
        clock.advance(BREAK);
        HealthSnapshot before = breaker.healthSnapshot();

        assertThatThrownBy(() -> breaker.execute(() -> {
            late.finish();
            assertThat(breaker.state()).isEqualTo(CircuitState.HALF_OPEN);
            throw new IOException("still down");
        })).isInstanceOf(IOException.class);

        assertThat(late.thrown.get()).isNull();
        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.healthSnapshot()).isEqualTo(before);
        assertThat(events).containsExactly("break 10s", "half-open", "break 10s");
    }

    @Test
    void state_reportsOpenUntilTrialIsClaimed() {
        CircuitBreaker breaker = breaker().build();
        trip(breaker);

        clock.advance(BREAK);

        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void successfulTrial_closesAndClearsWindow() throws Exception {
        CircuitBreaker breaker = breaker().build();
        trip(breaker);
        clock.advance(BREAK);

        succeed(breaker);

        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.healthSnapshot()).isEqualTo(HealthSnapshot.EMPTY);
        assertThat(events).containsExactly("break 10s", "half-open", "reset");
    }

    @Test
    void failedTrial_reopensAndRestartsBreakTimer() {
        CircuitBreaker breaker = breaker().build();
        trip(breaker);
        clock.advance(BREAK.plusSeconds(5));

        fail(breaker);

        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
        assertThat(events).containsExactly("break 10s", "half-open", "break 10s");

        clock.advance(BREAK.minusMillis(1));
        assertThatThrownBy(() -> breaker.execute(() -> {}))
                .isInstanceOf(CircuitOpenException.class);
    }

    @Test
    void halfOpen_rejectsCallsWhileTrialInFlight() throws Exception {
        CircuitBreaker breaker = breaker().build();
        trip(breaker);
        clock.advance(BREAK);
        List<Throwable> nested = new ArrayList<>();

        breaker.execute(() -> {
            assertThat(breaker.state()).isEqualTo(CircuitState.HALF_OPEN);
            try {
                breaker.execute(() -> {});
            } catch (CircuitOpenException e) {
                nested.add(e);
            }
        });

        assertThat(nested).hasSize(1);
        assertThat(((CircuitOpenException) nested.get(0)).state()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(((CircuitOpenException) nested.get(0)).retryAfter()).isZero();
        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void zeroBreakDuration_admitsTrialImmediately() throws Exception {
        CircuitBreaker breaker = breaker().breakDuration(Duration.ZERO).build();
        trip(breaker);

        succeed(breaker);

        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void errorsExcludedByPredicate_areRethrownWithoutRecording() {
        CircuitBreaker breaker = breaker()
                .recordAsFailure(t -> !(t instanceof IllegalArgumentException))
                .build();

        for (int i = 0; i < 6; i++) {
            assertThatThrownBy(() -> breaker.execute(() -> {
                throw new IllegalArgumentException("caller error");
            })).isInstanceOf(IllegalArgumentException.class);
        }

        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.healthSnapshot()).isEqualTo(HealthSnapshot.EMPTY);
    }

    @Test
    void excludedErrorDuringTrial_freesTrialSlot() throws Exception {
        CircuitBreaker breaker = breaker()
                .recordAsFailure(t -> !(t instanceof IllegalArgumentException))
                .build();
        trip(breaker);
        clock.advance(BREAK);

        assertThatThrownBy(() -> breaker.execute(() -> {
            throw new IllegalArgumentException("caller error");
        })).isInstanceOf(IllegalArgumentException.class);
        assertThat(breaker.state()).isEqualTo(CircuitState.HALF_OPEN);

        succeed(breaker);
        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void errors_areRecordedAndRethrown() {
        CircuitBreaker breaker = breaker().build();

        assertThatThrownBy(() -> breaker.execute(() -> {
            throw new AssertionError("boom");
        })).isInstanceOf(AssertionError.class);

        assertThat(breaker.healthSnapshot().failures()).isEqualTo(1);
    }

    @Test
    void throwingListener_doesNotPreventTransition() {
        CircuitBreaker breaker = breaker()
                .listener(new ResilienceListener() {
                    @Override
                    public void onBreak(Failure failure, Duration breakDuration) {
                        throw new IllegalStateException("listener broke");
                    }
                })
                .build();

        trip(breaker);

        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void halfOpenListenerError_releasesTrialSlot() throws Exception {
        AtomicInteger halfOpens = new AtomicInteger();
        CircuitBreaker breaker = breaker()
                .listener(new ResilienceListener() {
                    @Override
                    public void onHalfOpen() {
                        if (halfOpens.incrementAndGet() == 1) {
                            throw new AssertionError("listener broke");
                        }
                    }
                })
                .build();
        trip(breaker);
        clock.advance(BREAK);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> breaker.execute(calls::incrementAndGet))
                .isInstanceOf(AssertionError.class);
        assertThat(calls.get()).isZero();
        assertThat(breaker.state()).isEqualTo(CircuitState.HALF_OPEN);

        breaker.execute(calls::incrementAndGet);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void anonymousExceptionSubclass_opensAndReportsNamedType() {
        CircuitBreaker breaker = breaker().build();

        for (int i = 0; i < 4; i++) {
            assertThatThrownBy(() -> breaker.execute(() -> {
                throw new IOException("Ope") {};
            })).isInstanceOf(IOException.class);
        }

        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
        assertThat(breakFailures).hasSize(1);
        assertThat(breakFailures.get(0).code().toString()).isEqualTo("action:IOException");
    }

    @Test
    void wrap_runsThroughBreaker() throws Exception {
        CircuitBreaker breaker = breaker().build();
        AtomicInteger calls = new AtomicInteger();

        breaker.wrap(calls::incrementAndGet).run();

        assertThat(calls.get()).isEqualTo(1);
        assertThat(breaker.healthSnapshot().successes()).isEqualTo(1);
    }

    @Test
    void builder_rejectsInvalidSettings() {
        assertThatThrownBy(() -> CircuitBreaker.builder().failureThreshold(0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CircuitBreaker.builder().failureThreshold(1.01))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CircuitBreaker.builder().failureThreshold(Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CircuitBreaker.builder().minimumThroughput(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CircuitBreaker.builder().samplingDuration(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CircuitBreaker.builder().breakDuration(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void thresholdOfOne_opensOnlyWhenEverythingFails() throws Exception {
        CircuitBreaker breaker = breaker().failureThreshold(1.0).build();

        succeed(breaker);
        fail(breaker);
        fail(breaker);
        fail(breaker);
        fail(breaker);
        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
    }
}
